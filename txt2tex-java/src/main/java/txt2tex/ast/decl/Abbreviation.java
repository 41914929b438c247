package txt2tex.ast.decl;

import txt2tex.ast.expr.Expr;

import java.util.List;

public record Abbreviation(
        String name,
        List<String> genericParams,
        Expr expression,
        int line,
        int column
) implements ZedItem {

    public Abbreviation {
        genericParams = List.copyOf(genericParams);
    }
}

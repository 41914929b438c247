package txt2tex.ast.expr;

import java.util.List;

public record SetLiteral(List<Expr> elements, int line, int column) implements Expr {

    public SetLiteral {
        elements = List.copyOf(elements);
    }
}

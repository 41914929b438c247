package txt2tex.ast.decl;

import txt2tex.ast.expr.Expr;

import java.util.List;

/** {@code x, y : T} */
public record Declaration(List<String> names, Expr type, int line, int column) {

    public Declaration {
        names = List.copyOf(names);
    }
}

package txt2tex.ast.expr;

import java.util.List;

public record TupleExpr(List<Expr> elements, int line, int column) implements Expr {

    public TupleExpr {
        elements = List.copyOf(elements);
    }
}

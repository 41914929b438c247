package txt2tex.ast.expr;

import java.util.List;

public record SequenceLiteral(List<Expr> elements, int line, int column) implements Expr {

    public SequenceLiteral {
        elements = List.copyOf(elements);
    }
}

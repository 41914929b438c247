package txt2tex.ast.expr;

import java.util.List;

public record SetComprehension(
        List<String> variables,
        Expr domain,
        Expr predicate,
        Expr expression,
        int line,
        int column
) implements Expr {

    public SetComprehension {
        if (predicate == null && expression == null) {
            throw new IllegalArgumentException("set comprehension needs a predicate or an expression");
        }
        variables = List.copyOf(variables);
    }
}

package txt2tex.ast.expr;

import java.util.List;
import java.util.Objects;

/**
 * {@code forall}, {@code exists}, {@code exists1} or {@code mu}.
 * Domain and constraint are optional; a constraint survives only for {@code mu},
 * the other kinds receive it already folded into the body as an implication.
 */
public record Quantifier(
        Kind kind,
        List<String> variables,
        Expr domain,
        Expr constraint,
        Expr body,
        int line,
        int column
) implements Expr {

    public Quantifier {
        Objects.requireNonNull(body, "quantifier body");
        variables = List.copyOf(variables);
    }

    public enum Kind {
        FORALL, EXISTS, EXISTS1, MU
    }
}

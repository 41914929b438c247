package txt2tex.ast.proof;

import txt2tex.ast.expr.Expr;

import java.util.List;

/**
 * One line of a proof and the lines indented beneath it.
 *
 * @param justification text of the trailing {@code [...]}, or null
 * @param label         number of a {@code [n]} assumption, or null
 * @param sibling       a {@code ::} line restating a premise rather than inferring it
 */
public record ProofNode(
        Expr expression,
        String justification,
        Integer label,
        List<ProofStep> children,
        boolean assumption,
        boolean sibling,
        int line
) implements ProofStep {

    public ProofNode {
        children = List.copyOf(children);
    }
}

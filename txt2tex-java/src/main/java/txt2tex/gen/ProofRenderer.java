package txt2tex.gen;

import txt2tex.ast.expr.BinaryExpr;
import txt2tex.ast.expr.Quantifier;
import txt2tex.ast.expr.UnaryExpr;
import txt2tex.ast.proof.CaseAnalysis;
import txt2tex.ast.proof.ProofNode;
import txt2tex.ast.proof.ProofStep;
import txt2tex.ast.proof.ProofTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Natural-deduction trees with the {@code proof} package's {@code \infer}.
 */
final class ProofRenderer {

    /** Trees deeper than this are set in a smaller font. */
    static final int DEEP_TREE = 4;

    private static final String INDENT = "  ";

    private final LatexGenerator generator;
    private final Map<String, String> justificationSymbols;

    ProofRenderer(LatexGenerator generator, SymbolTable symbols) {
        this.generator = generator;
        this.justificationSymbols = Map.of(
                "land", "$" + symbols.binary(BinaryExpr.Operator.AND) + "$",
                "lor", "$" + symbols.binary(BinaryExpr.Operator.OR) + "$",
                "lnot", "$" + symbols.unary(UnaryExpr.Operator.NOT) + "$",
                "=>", "$" + symbols.binary(BinaryExpr.Operator.IMPLIES) + "$",
                "<=>", "$" + symbols.binary(BinaryExpr.Operator.IFF) + "$",
                "forall", "$" + symbols.quantifier(Quantifier.Kind.FORALL) + "$",
                "exists", "$" + symbols.quantifier(Quantifier.Kind.EXISTS) + "$");
    }

    String render(ProofTree tree) {
        StringBuilder sb = new StringBuilder("\\begin{center}\n");
        if (tree.depth() > DEEP_TREE) sb.append("\\scriptsize\n");
        sb.append("$\n");
        sb.append(step(tree.conclusion(), 0)).append('\n');
        sb.append("$\n");
        sb.append("\\end{center}");
        return sb.toString();
    }

    private String step(ProofStep step, int depth) {
        if (step instanceof CaseAnalysis c) return caseAnalysis(c, depth);
        ProofNode node = (ProofNode) step;

        String expr = generator.generateExpr(node.expression());
        if (node.assumption()) {
            expr = "[" + expr + "]" + (node.label() == null ? "" : "^{" + node.label() + "}");
        }

        boolean leaf = node.children().isEmpty();
        if (leaf && (node.sibling() || node.assumption() || node.justification() == null)) {
            return expr;
        }

        List<String> premises = new ArrayList<>();
        for (ProofStep child : node.children()) premises.add(step(child, depth + 1));
        return "\\infer" + label(node.justification()) + "{" + expr + "}" + premises(premises, depth);
    }

    private String caseAnalysis(CaseAnalysis c, int depth) {
        String head = "\\mbox{case } " + generator.identifier(c.caseName());
        if (c.steps().isEmpty()) return head;

        List<String> steps = new ArrayList<>();
        for (ProofNode s : c.steps()) steps.add(step(s, depth + 1));
        return "\\deduce{" + head + "}" + premises(steps, depth);
    }

    private static String premises(List<String> rendered, int depth) {
        if (rendered.isEmpty()) return "{}";
        String inner = INDENT.repeat(depth + 1);
        return "{\n" + inner + String.join("\n" + inner + "&\n" + inner, rendered)
                + "\n" + INDENT.repeat(depth) + "}";
    }

    private String label(String justification) {
        if (justification == null || justification.isEmpty()) return "";
        return "[" + justification(justification) + "]";
    }

    /** Justification text in an {@code \mbox}, with logical keywords set as symbols. */
    String justification(String text) {
        List<String> words = new ArrayList<>();
        for (String word : text.trim().split("\\s+")) {
            String symbol = justificationSymbols.get(word);
            words.add(symbol != null ? symbol : ProseMath.escape(word));
        }
        return "\\mbox{" + String.join(" ", words) + "}";
    }
}

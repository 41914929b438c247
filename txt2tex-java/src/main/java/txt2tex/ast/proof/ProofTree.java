package txt2tex.ast.proof;

import txt2tex.ast.DocumentItem;

public record ProofTree(ProofNode conclusion, int line) implements DocumentItem {

    /** Levels of nesting below and including the conclusion. */
    public int depth() {
        return depth(conclusion);
    }

    public static int depth(ProofStep step) {
        if (step instanceof CaseAnalysis c) {
            int max = 0;
            for (ProofNode s : c.steps()) max = Math.max(max, depth(s));
            return max;
        }
        ProofNode node = (ProofNode) step;
        int max = 0;
        for (ProofStep child : node.children()) max = Math.max(max, depth(child));
        return 1 + max;
    }
}

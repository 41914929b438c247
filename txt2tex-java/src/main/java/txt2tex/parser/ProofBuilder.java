package txt2tex.parser;

import txt2tex.ast.expr.Expr;
import txt2tex.ast.proof.CaseAnalysis;
import txt2tex.ast.proof.ProofNode;
import txt2tex.ast.proof.ProofStep;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Assembles proof lines into a tree from their indentation.
 * Each open step sits on a stack with the indent of the line that opened it;
 * a new line closes every step indented at least as far, then becomes a child
 * of the step left on top.
 */
final class ProofBuilder {

    private final Deque<Frame> stack = new ArrayDeque<>();
    private Open root;

    private record Frame(int indent, Open step) {}

    /** True when a line at {@code indent} belongs to the proof already started. */
    boolean accepts(int indent) {
        return root == null || indent > stack.getLast().indent();
    }

    boolean isEmpty() {
        return root == null;
    }

    /** Returns an error message, or null when the step was placed. */
    String add(int indent, Open step) {
        if (root == null) {
            if (step instanceof OpenCase) return "A proof must start with its conclusion, not a case";
            root = step;
            stack.push(new Frame(indent, step));
            return null;
        }
        while (stack.peek().indent() >= indent) stack.pop();

        Open parent = stack.peek().step();
        if (parent instanceof OpenCase c) {
            if (step instanceof OpenCase) return "A case must be followed by a proof step before another case";
            c.steps.add((OpenNode) step);
        } else {
            ((OpenNode) parent).children.add(step);
        }
        stack.push(new Frame(indent, step));
        return null;
    }

    ProofNode build() {
        return ((OpenNode) root).build();
    }

    sealed interface Open permits OpenNode, OpenCase {
        ProofStep build();
    }

    static final class OpenNode implements Open {
        private final Expr expression;
        private final String justification;
        private final Integer label;
        private final boolean assumption;
        private final boolean sibling;
        private final int line;
        private final List<Open> children = new ArrayList<>();

        OpenNode(Expr expression, String justification, Integer label,
                 boolean assumption, boolean sibling, int line) {
            this.expression = expression;
            this.justification = justification;
            this.label = label;
            this.assumption = assumption;
            this.sibling = sibling;
            this.line = line;
        }

        @Override
        public ProofNode build() {
            List<ProofStep> built = children.stream().map(Open::build).toList();
            return new ProofNode(expression, justification, label, built, assumption, sibling, line);
        }
    }

    static final class OpenCase implements Open {
        private final String name;
        private final int line;
        private final List<OpenNode> steps = new ArrayList<>();

        OpenCase(String name, int line) {
            this.name = name;
            this.line = line;
        }

        @Override
        public CaseAnalysis build() {
            return new CaseAnalysis(name, steps.stream().map(OpenNode::build).toList(), line);
        }
    }
}

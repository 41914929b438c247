package txt2tex.ast.proof;

import java.util.List;

public record CaseAnalysis(String caseName, List<ProofNode> steps, int line) implements ProofStep {

    public CaseAnalysis {
        steps = List.copyOf(steps);
    }
}

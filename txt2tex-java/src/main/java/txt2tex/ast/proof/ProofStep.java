package txt2tex.ast.proof;

public sealed interface ProofStep permits ProofNode, CaseAnalysis {

    int line();
}

package txt2tex.ast.doc;

import txt2tex.ast.expr.Expr;

public record ArgueStep(Expr expression, String justification, int line) {}

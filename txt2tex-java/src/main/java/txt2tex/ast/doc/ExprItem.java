package txt2tex.ast.doc;

import txt2tex.ast.DocumentItem;
import txt2tex.ast.expr.Expr;

/** A bare expression line, typeset as inline math. */
public record ExprItem(Expr expression, int line) implements DocumentItem {}

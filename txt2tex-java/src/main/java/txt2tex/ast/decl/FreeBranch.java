package txt2tex.ast.decl;

import txt2tex.ast.expr.Expr;

/** A constructor of a free type; {@code parameter} is null for a constant. */
public record FreeBranch(String name, Expr parameter, int line, int column) {}

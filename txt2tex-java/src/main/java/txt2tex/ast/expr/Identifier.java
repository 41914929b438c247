package txt2tex.ast.expr;

public record Identifier(String name, int line, int column) implements Expr {}

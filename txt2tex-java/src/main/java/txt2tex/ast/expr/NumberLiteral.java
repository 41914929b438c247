package txt2tex.ast.expr;

public record NumberLiteral(String value, int line, int column) implements Expr {}

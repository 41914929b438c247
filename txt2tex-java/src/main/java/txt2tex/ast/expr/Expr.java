package txt2tex.ast.expr;

public sealed interface Expr
        permits BinaryExpr, UnaryExpr, Identifier, NumberLiteral,
        Quantifier, SetComprehension, SetLiteral, TupleExpr,
        FunctionApp, SequenceLiteral {

    int line();

    int column();
}

package txt2tex.ast.expr;

public record UnaryExpr(
        Operator op,
        Expr operand,
        int line,
        int column
) implements Expr {

    public enum Operator {
        NOT,
        NEGATE,
        CARD,
        DOM, RAN,
        POWER, POWER1, FINSET, FINSET1,
        SEQ, SEQ1, ISEQ, BAG,
        BIGCUP, BIGCAP,
        INVERSE;

        /** Type constructors need an explicit group around any compound argument. */
        public boolean typeConstructor() {
            return switch (this) {
                case POWER, POWER1, FINSET, FINSET1, SEQ, SEQ1, ISEQ, BAG -> true;
                default -> false;
            };
        }

        public boolean postfix() {
            return this == INVERSE;
        }
    }
}

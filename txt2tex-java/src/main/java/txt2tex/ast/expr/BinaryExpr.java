package txt2tex.ast.expr;

/**
 * Binary operator application.
 *
 * @param explicitParens the node was written inside its own pair of source parentheses
 */
public record BinaryExpr(
        Operator op,
        Expr left,
        Expr right,
        boolean explicitParens,
        int line,
        int column
) implements Expr {

    public BinaryExpr(Operator op, Expr left, Expr right, int line, int column) {
        this(op, left, right, false, line, column);
    }

    public BinaryExpr withExplicitParens() {
        return new BinaryExpr(op, left, right, true, line, column);
    }

    /** Closed operator set, ordered loosest first. */
    public enum Operator {
        IFF(1, true),
        IMPLIES(2, true),
        OR(3),
        AND(4),

        EQUALS(6), NOT_EQUAL(6),
        LESS(6), GREATER(6), LESS_EQUAL(6), GREATER_EQUAL(6),
        IN(6), NOTIN(6), SUBSETEQ(6), PSUBSET(6),

        REL(7), TFUN(7), PFUN(7), TINJ(7), PINJ(7),
        TSURJ(7), PSURJ(7), BIJ(7), FFUN(7),

        MAPSTO(8), UNION(8), INTERSECT(8), SETMINUS(8),
        DRES(8), RRES(8), NDRES(8), NRRES(8),
        COMP(8), OVERRIDE(8), CAT(8), FILTER(8), UPTO(8),

        PLUS(9), MINUS(9),
        TIMES(10), DIV(10), MOD(10),
        CROSS(11);

        /** Precedence of prefix {@code not}, between conjunction and comparison. */
        public static final int NEGATION = 5;

        private final int precedence;
        private final boolean rightAssoc;

        Operator(int precedence) {
            this(precedence, false);
        }

        Operator(int precedence, boolean rightAssoc) {
            this.precedence = precedence;
            this.rightAssoc = rightAssoc;
        }

        public int precedence() {
            return precedence;
        }

        public boolean rightAssoc() {
            return rightAssoc;
        }
    }
}

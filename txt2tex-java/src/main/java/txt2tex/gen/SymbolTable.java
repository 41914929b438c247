package txt2tex.gen;

import txt2tex.ast.expr.BinaryExpr;
import txt2tex.ast.expr.Quantifier;
import txt2tex.ast.expr.UnaryExpr;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Operator and name spellings for one {@link Dialect}.
 * The two tables agree on everything except the entries overridden per dialect.
 */
final class SymbolTable {

    private static final Map<BinaryExpr.Operator, String> binaryCommon = Collections.unmodifiableMap(new EnumMap<>(Map.ofEntries(
            Map.entry(BinaryExpr.Operator.OR, "\\lor"),
            Map.entry(BinaryExpr.Operator.AND, "\\land"),
            Map.entry(BinaryExpr.Operator.EQUALS, "="),
            Map.entry(BinaryExpr.Operator.NOT_EQUAL, "\\neq"),
            Map.entry(BinaryExpr.Operator.LESS, "<"),
            Map.entry(BinaryExpr.Operator.GREATER, ">"),
            Map.entry(BinaryExpr.Operator.LESS_EQUAL, "\\leq"),
            Map.entry(BinaryExpr.Operator.GREATER_EQUAL, "\\geq"),
            Map.entry(BinaryExpr.Operator.IN, "\\in"),
            Map.entry(BinaryExpr.Operator.NOTIN, "\\notin"),
            Map.entry(BinaryExpr.Operator.SUBSETEQ, "\\subseteq"),
            Map.entry(BinaryExpr.Operator.PSUBSET, "\\subset"),
            Map.entry(BinaryExpr.Operator.REL, "\\rel"),
            Map.entry(BinaryExpr.Operator.TFUN, "\\fun"),
            Map.entry(BinaryExpr.Operator.PFUN, "\\pfun"),
            Map.entry(BinaryExpr.Operator.TINJ, "\\inj"),
            Map.entry(BinaryExpr.Operator.PINJ, "\\pinj"),
            Map.entry(BinaryExpr.Operator.TSURJ, "\\surj"),
            Map.entry(BinaryExpr.Operator.PSURJ, "\\psurj"),
            Map.entry(BinaryExpr.Operator.BIJ, "\\bij"),
            Map.entry(BinaryExpr.Operator.FFUN, "\\ffun"),
            Map.entry(BinaryExpr.Operator.MAPSTO, "\\mapsto"),
            Map.entry(BinaryExpr.Operator.UNION, "\\cup"),
            Map.entry(BinaryExpr.Operator.INTERSECT, "\\cap"),
            Map.entry(BinaryExpr.Operator.SETMINUS, "\\setminus"),
            Map.entry(BinaryExpr.Operator.DRES, "\\dres"),
            Map.entry(BinaryExpr.Operator.RRES, "\\rres"),
            Map.entry(BinaryExpr.Operator.NDRES, "\\ndres"),
            Map.entry(BinaryExpr.Operator.NRRES, "\\nrres"),
            Map.entry(BinaryExpr.Operator.COMP, "\\comp"),
            Map.entry(BinaryExpr.Operator.OVERRIDE, "\\oplus"),
            Map.entry(BinaryExpr.Operator.CAT, "\\cat"),
            Map.entry(BinaryExpr.Operator.FILTER, "\\filter"),
            Map.entry(BinaryExpr.Operator.UPTO, "\\upto"),
            Map.entry(BinaryExpr.Operator.PLUS, "+"),
            Map.entry(BinaryExpr.Operator.MINUS, "-"),
            Map.entry(BinaryExpr.Operator.TIMES, "*"),
            Map.entry(BinaryExpr.Operator.DIV, "\\div"),
            Map.entry(BinaryExpr.Operator.MOD, "\\mod"),
            Map.entry(BinaryExpr.Operator.CROSS, "\\cross")
    )));

    private static final Map<UnaryExpr.Operator, String> unaryCommon = Collections.unmodifiableMap(new EnumMap<>(Map.ofEntries(
            Map.entry(UnaryExpr.Operator.NOT, "\\lnot"),
            Map.entry(UnaryExpr.Operator.NEGATE, "-"),
            Map.entry(UnaryExpr.Operator.CARD, "\\#"),
            Map.entry(UnaryExpr.Operator.DOM, "\\dom"),
            Map.entry(UnaryExpr.Operator.RAN, "\\ran"),
            Map.entry(UnaryExpr.Operator.POWER, "\\power"),
            Map.entry(UnaryExpr.Operator.POWER1, "\\power_1"),
            Map.entry(UnaryExpr.Operator.FINSET, "\\finset"),
            Map.entry(UnaryExpr.Operator.FINSET1, "\\finset_1"),
            Map.entry(UnaryExpr.Operator.SEQ, "\\seq"),
            Map.entry(UnaryExpr.Operator.SEQ1, "\\seq_1"),
            Map.entry(UnaryExpr.Operator.ISEQ, "\\iseq"),
            Map.entry(UnaryExpr.Operator.BAG, "\\bag"),
            Map.entry(UnaryExpr.Operator.BIGCUP, "\\bigcup"),
            Map.entry(UnaryExpr.Operator.BIGCAP, "\\bigcap")
    )));

    private static final Map<Quantifier.Kind, String> quantifiers = Collections.unmodifiableMap(new EnumMap<>(Map.of(
            Quantifier.Kind.FORALL, "\\forall",
            Quantifier.Kind.EXISTS, "\\exists",
            Quantifier.Kind.EXISTS1, "\\exists_1",
            Quantifier.Kind.MU, "\\mu"
    )));

    private static final SymbolTable FUZZ = new SymbolTable(
            Map.of(BinaryExpr.Operator.IMPLIES, "\\implies", BinaryExpr.Operator.IFF, "\\iff"),
            "\\inv",
            Map.of("N", "\\nat", "Z", "\\num", "N1", "\\nat_1"));

    private static final SymbolTable STANDARD = new SymbolTable(
            Map.of(BinaryExpr.Operator.IMPLIES, "\\Rightarrow", BinaryExpr.Operator.IFF, "\\Leftrightarrow"),
            "^{\\sim}",
            Map.of("N", "\\mathbb{N}", "Z", "\\mathbb{Z}", "N1", "\\mathbb{N}_1"));

    private final Map<BinaryExpr.Operator, String> binary;
    private final Map<UnaryExpr.Operator, String> unary;
    private final Map<String, String> typeNames;

    private SymbolTable(Map<BinaryExpr.Operator, String> logic, String inverse, Map<String, String> typeNames) {
        EnumMap<BinaryExpr.Operator, String> b = new EnumMap<>(binaryCommon);
        b.putAll(logic);
        EnumMap<UnaryExpr.Operator, String> u = new EnumMap<>(unaryCommon);
        u.put(UnaryExpr.Operator.INVERSE, inverse);
        this.binary = Collections.unmodifiableMap(b);
        this.unary = Collections.unmodifiableMap(u);
        this.typeNames = typeNames;
    }

    static SymbolTable forDialect(Dialect dialect) {
        return dialect == Dialect.FUZZ ? FUZZ : STANDARD;
    }

    String binary(BinaryExpr.Operator op) {
        return binary.get(op);
    }

    String unary(UnaryExpr.Operator op) {
        return unary.get(op);
    }

    String quantifier(Quantifier.Kind kind) {
        return quantifiers.get(kind);
    }

    /**
     * Built-in number sets map to their macros. Otherwise: {@code x_1} stays a bare
     * subscript, a two or three character suffix is braced ({@code a_{bc}}), and
     * longer suffixes or several underscores fall back to {@code \mathit} with every
     * underscore escaped. Z decorations ({@code ' ? !}) are kept after the name.
     */
    String identifier(String name) {
        String mapped = typeNames.get(name);
        if (mapped != null) return mapped;

        int end = name.length();
        while (end > 0 && "'?!".indexOf(name.charAt(end - 1)) >= 0) end--;
        String base = name.substring(0, end);
        String decoration = name.substring(end);

        String[] parts = base.split("_", -1);
        if (parts.length == 1) return name;
        if (parts.length == 2 && !parts[0].isEmpty() && !parts[1].isEmpty()) {
            int suffix = parts[1].length();
            if (suffix == 1) return base + decoration;
            if (suffix <= 3) return parts[0] + "_{" + parts[1] + "}" + decoration;
        }
        return "\\mathit{" + base.replace("_", "\\_") + "}" + decoration;
    }
}

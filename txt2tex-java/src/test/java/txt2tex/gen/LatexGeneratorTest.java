package txt2tex.gen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import txt2tex.ast.Document;
import txt2tex.lexer.Lexer;
import txt2tex.parser.Parser;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class LatexGeneratorTest {

    private static final LatexGenerator fuzz = new LatexGenerator(Dialect.FUZZ);
    private static final LatexGenerator standard = new LatexGenerator(Dialect.STANDARD);

    private static Document parse(String src) {
        return new Parser(new Lexer(src).tokenize()).parseDocument();
    }

    private static String expr(LatexGenerator gen, String src) {
        return gen.generateExpr(new Parser(new Lexer(src).tokenize()).parseExpression());
    }

    private static int count(String haystack, String needle) {
        int n = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + needle.length())) n++;
        return n;
    }

    static Stream<Arguments> parenthesization() {
        return Stream.of(
                Arguments.of("A cross B cross C", "A \\cross B \\cross C"),
                Arguments.of("(A cross B) cross C", "(A \\cross B) \\cross C"),
                Arguments.of("A cross (B cross C)", "A \\cross (B \\cross C)"),
                Arguments.of("a + b * c", "a + b * c"),
                Arguments.of("(a + b) * c", "(a + b) * c"),
                Arguments.of("a - (b - c)", "a - (b - c)"),
                Arguments.of("p => q => r", "p \\implies q \\implies r"),
                Arguments.of("(p => q) => r", "(p \\implies q) \\implies r"),
                Arguments.of("p land q lor r", "p \\land q \\lor r"),
                Arguments.of("p land (q lor r)", "p \\land (q \\lor r)"),
                Arguments.of("not (p land q)", "\\lnot (p \\land q)"),
                Arguments.of("not p land q", "\\lnot p \\land q"),
                Arguments.of("(forall x : N | p) land q", "(\\forall x : \\nat @ p) \\land q")
        );
    }

    @ParameterizedTest
    @MethodSource("parenthesization")
    void generate_parens_only_where_needed(String src, String expected) {
        assertEquals(expected, expr(fuzz, src));
    }

    @Test
    void generate_type_constructors_group_compound_operands() {
        assertEquals("\\iseq (A \\cross B)", expr(fuzz, "iseq(A cross B)"));
        assertEquals("\\seq_1 (\\seq X)", expr(fuzz, "seq1(seq(X))"));
        assertEquals("\\power X", expr(fuzz, "P X"));
        assertEquals("\\# (A \\cup B)", expr(fuzz, "#(A union B)"));
        assertEquals("(R \\comp S)\\inv", expr(fuzz, "(R o9 S)~"));
        assertEquals("-x", expr(fuzz, "-x"));
        assertEquals("\\dom \\ran R", expr(fuzz, "dom ran R"));
        assertEquals("\\power (\\seq X)", expr(fuzz, "P seq X"));
    }

    @Test
    void generate_identifier_subscripts() {
        assertEquals("x_1", expr(fuzz, "x_1"));
        assertEquals("x_{ab}", expr(fuzz, "x_ab"));
        assertEquals("\\mathit{max\\_value}", expr(fuzz, "max_value"));
        assertEquals("\\mathit{a\\_b\\_c}", expr(fuzz, "a_b_c"));
        assertEquals("count'", expr(fuzz, "count'"));
        assertEquals("x_1?", expr(fuzz, "x_1?"));
    }

    @Test
    void generate_dialect_symbols() {
        assertEquals("p \\implies q", expr(fuzz, "p => q"));
        assertEquals("p \\Rightarrow q", expr(standard, "p => q"));
        assertEquals("p \\iff q", expr(fuzz, "p <=> q"));
        assertEquals("p \\Leftrightarrow q", expr(standard, "p <=> q"));
        assertEquals("R\\inv", expr(fuzz, "R~"));
        assertEquals("R^{\\sim}", expr(standard, "R~"));
        assertEquals("\\nat \\cross \\num", expr(fuzz, "N cross Z"));
        assertEquals("\\mathbb{N}_1 \\cross \\mathbb{Z}", expr(standard, "N1 cross Z"));
    }

    @Test
    void generate_binders_and_collections() {
        assertEquals("\\forall x : \\nat @ x > 0", expr(fuzz, "forall x : N | x > 0"));
        assertEquals("\\exists_1 x, y : \\nat @ x = y", expr(fuzz, "exists1 x, y : N . x = y"));
        assertEquals("\\mu x : \\nat | x > 3 @ x", expr(fuzz, "mu x : N | x > 3 . x"));
        assertEquals("\\mu x : \\nat | x > 3", expr(fuzz, "mu x : N | x > 3"));
        assertEquals("\\{ x : \\nat | x > 0 @ x * x \\}", expr(fuzz, "{x : N | x > 0 . x * x}"));
        assertEquals("\\{ x : \\nat @ x * x \\}", expr(fuzz, "{x : N . x * x}"));
        assertEquals("\\{1, 2\\}", expr(fuzz, "{1, 2}"));
        assertEquals("\\langle a, b \\rangle", expr(fuzz, "<a, b>"));
        assertEquals("\\langle \\rangle", expr(fuzz, "<>"));
        assertEquals("f(x, (a, b))", expr(fuzz, "f(x, (a, b))"));
    }

    @Test
    void generate_zed_run_in_one_environment() {
        String out = fuzz.generateDocument(parse("""
            given A

            given B

            T == A cross B
            """));
        assertEquals(1, count(out, "\\begin{zed}"));
        assertEquals(2, count(out, "\\also"));
        assertTrue(out.contains("[A]\n\\also\n[B]\n\\also\nT == A \\cross B"), out);
    }

    @Test
    void generate_zed_run_broken_by_paragraph() {
        String out = fuzz.generateDocument(parse("""
            given A

            TEXT: some words

            given B
            """));
        assertEquals(2, count(out, "\\begin{zed}"));
        assertEquals(0, count(out, "\\also"));
    }

    @Test
    void generate_free_type_and_abbreviation() {
        var doc = parse("""
            Tree ::= leaf | node <<Tree cross Tree>>
            Pair[X] == X cross X
            """);
        String out = fuzz.generateItem(doc.items().get(0));
        assertEquals("\\begin{zed}\nTree ::= leaf | node \\ldata Tree \\cross Tree \\rdata\n\\end{zed}", out);
        assertEquals("\\begin{zed}\nPair[X] == X \\cross X\n\\end{zed}", fuzz.generateItem(doc.items().get(1)));
    }

    @Test
    void generate_schema_with_predicate_groups() {
        var doc = parse("""
            schema Counter
              value, limit : N
            where
              value <= limit
              limit > 0

              value != 7

              limit < 100
            end
            """);
        String out = fuzz.generateItem(doc.items().get(0));
        assertEquals("""
            \\begin{schema}{Counter}
            value, limit : \\nat
            \\where
            value \\leq limit \\\\
            limit > 0
            \\also
            value \\neq 7
            \\also
            limit < 100
            \\end{schema}""", out);
    }

    @Test
    void generate_single_predicate_group_has_no_also() {
        var doc = parse("""
            schema Counter
              value, limit : N
            where
              value <= limit
              limit > 0
              value != 7
            end
            """);
        String out = fuzz.generateItem(doc.items().get(0));
        assertEquals(0, count(out, "\\also"));
        assertEquals(2, count(out, " \\\\\n"));
    }

    @Test
    void generate_axdef_without_where() {
        var doc = parse("""
            axdef [X]
              empty : P X; size : N
            end
            """);
        assertEquals("\\begin{axdef}[X]\nempty : \\power X \\\\\nsize : \\nat\n\\end{axdef}",
                fuzz.generateItem(doc.items().get(0)));
    }

    @Test
    void generate_preamble_per_dialect() {
        var doc = parse("x = 1");
        String f = fuzz.generateDocument(doc);
        assertTrue(f.startsWith("\\documentclass[a4paper,10pt,fleqn]{article}\n\\usepackage{fuzz}\n"));
        assertTrue(f.contains("\\usepackage{proof}"));
        assertTrue(f.contains("$x = 1$"));
        assertTrue(f.endsWith("\\end{document}\n"));

        String s = standard.generateDocument(doc);
        assertTrue(s.contains("\\usepackage{zed-cm}\n\\usepackage{zed-maths}\n"));
        assertFalse(s.contains("{fuzz}"));
    }

    @Test
    void generate_title_and_bibliography() {
        String out = fuzz.generateDocument(parse("""
            TITLE: Notes
            SUBTITLE: Week 1
            AUTHOR: Sam
            BIBLIOGRAPHY: refs

            x = 1
            """));
        assertTrue(out.contains("\\title{Notes\\\\\n\\large Week 1}"), out);
        assertTrue(out.contains("\\author{Sam}"));
        assertTrue(out.contains("\\maketitle"));
        assertTrue(out.contains("\\bibliographystyle{plain}\n\\bibliography{refs}"));
        assertFalse(fuzz.generateDocument(parse("x = 1")).contains("\\maketitle"));
    }

    @Test
    void generate_document_structure_items() {
        String out = fuzz.generateDocument(parse("""
            === Sets ===

            ** Solution 2 **

            (a) x = 1

            PAGEBREAK:

            LATEX: \\emph{raw}

            PURETEXT: 50% of x_1
            """));
        assertTrue(out.contains("\\section*{Sets}"));
        assertTrue(out.contains("\\noindent\\textbf{Solution 2}"));
        assertTrue(out.contains("\\medskip\n\\noindent\\textbf{(a)}"));
        assertTrue(out.contains("\\newpage"));
        assertTrue(out.contains("\\emph{raw}"));
        assertTrue(out.contains("50\\% of x\\_1"));
    }

    @Test
    void generate_parts_as_subsections() {
        String out = fuzz.generateDocument(parse("""
            PARTS: subsection

            (b) y = 2
            """));
        assertTrue(out.contains("\\subsection*{(b)}"));
    }

    @Test
    void generate_argue_chain() {
        var doc = parse("""
            EQUIV:
            p land q
            <=> q land p [commutativity]
            """);
        assertEquals("""
            \\begin{argue}
              p \\land q \\\\
              \\iff q \\land p & [\\mbox{commutativity}]
            \\end{argue}""", fuzz.generateItem(doc.items().get(0)));
    }
}

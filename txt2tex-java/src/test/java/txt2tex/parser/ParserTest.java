package txt2tex.parser;

import org.junit.jupiter.api.Test;
import txt2tex.ast.Document;
import txt2tex.ast.PartsFormat;
import txt2tex.ast.decl.*;
import txt2tex.ast.doc.ArgueChain;
import txt2tex.ast.doc.ExprItem;
import txt2tex.ast.doc.Paragraph;
import txt2tex.ast.expr.*;
import txt2tex.ast.proof.CaseAnalysis;
import txt2tex.ast.proof.ProofNode;
import txt2tex.ast.proof.ProofTree;
import txt2tex.lexer.Lexer;
import txt2tex.lexer.LexerException;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Document parse(String src) {
        var tokens = new Lexer(src).tokenize();
        return new Parser(tokens).parseDocument();
    }

    private static Expr expr(String src) {
        return new Parser(new Lexer(src).tokenize()).parseExpression();
    }

    private static BinaryExpr binary(Expr e, BinaryExpr.Operator op) {
        var b = assertInstanceOf(BinaryExpr.class, e);
        assertEquals(op, b.op());
        return b;
    }

    // ---------- expressions ----------

    @Test
    void parse_multiplication_binds_tighter_than_addition() {
        var plus = binary(expr("a + b * c"), BinaryExpr.Operator.PLUS);
        assertInstanceOf(Identifier.class, plus.left());
        binary(plus.right(), BinaryExpr.Operator.TIMES);
    }

    @Test
    void parse_arithmetic_is_left_associative() {
        var outer = binary(expr("a - b - c"), BinaryExpr.Operator.MINUS);
        var inner = binary(outer.left(), BinaryExpr.Operator.MINUS);
        assertEquals("a", ((Identifier) inner.left()).name());
        assertEquals("c", ((Identifier) outer.right()).name());
    }

    @Test
    void parse_implication_is_right_associative() {
        var outer = binary(expr("p => q => r"), BinaryExpr.Operator.IMPLIES);
        assertInstanceOf(Identifier.class, outer.left());
        binary(outer.right(), BinaryExpr.Operator.IMPLIES);

        var iff = binary(expr("p <=> q => r"), BinaryExpr.Operator.IFF);
        binary(iff.right(), BinaryExpr.Operator.IMPLIES);
    }

    @Test
    void parse_logic_precedence_ladder() {
        var or = binary(expr("p land q lor r"), BinaryExpr.Operator.OR);
        binary(or.left(), BinaryExpr.Operator.AND);

        var and = binary(expr("not p land q"), BinaryExpr.Operator.AND);
        assertEquals(UnaryExpr.Operator.NOT, ((UnaryExpr) and.left()).op());

        var conj = binary(expr("x in S land y notin T"), BinaryExpr.Operator.AND);
        binary(conj.left(), BinaryExpr.Operator.IN);
        binary(conj.right(), BinaryExpr.Operator.NOTIN);

        var eq = binary(expr("f = A -->> B"), BinaryExpr.Operator.EQUALS);
        binary(eq.right(), BinaryExpr.Operator.TSURJ);
    }

    @Test
    void parse_explicit_parens_are_remembered() {
        var flat = binary(expr("A cross B cross C"), BinaryExpr.Operator.CROSS);
        assertFalse(binary(flat.left(), BinaryExpr.Operator.CROSS).explicitParens());

        var grouped = binary(expr("(A cross B) cross C"), BinaryExpr.Operator.CROSS);
        assertTrue(binary(grouped.left(), BinaryExpr.Operator.CROSS).explicitParens());

        var right = binary(expr("a - (b - c)"), BinaryExpr.Operator.MINUS);
        assertInstanceOf(Identifier.class, right.left());
        assertTrue(binary(right.right(), BinaryExpr.Operator.MINUS).explicitParens());
    }

    @Test
    void parse_quantifier_constraint_lowered_to_implication() {
        var q = assertInstanceOf(Quantifier.class, expr("forall x : N | x > 0 | x >= 1"));
        assertEquals(Quantifier.Kind.FORALL, q.kind());
        assertEquals("N", ((Identifier) q.domain()).name());
        assertNull(q.constraint());
        var body = binary(q.body(), BinaryExpr.Operator.IMPLIES);
        binary(body.left(), BinaryExpr.Operator.GREATER);
        binary(body.right(), BinaryExpr.Operator.GREATER_EQUAL);
    }

    @Test
    void parse_quantifier_variants() {
        var ex = assertInstanceOf(Quantifier.class, expr("exists1 x, y : N . x = y"));
        assertEquals(Quantifier.Kind.EXISTS1, ex.kind());
        assertEquals(List.of("x", "y"), ex.variables());
        binary(ex.body(), BinaryExpr.Operator.EQUALS);

        var untyped = assertInstanceOf(Quantifier.class, expr("exists x | p(x)"));
        assertNull(untyped.domain());
        assertInstanceOf(FunctionApp.class, untyped.body());
    }

    @Test
    void parse_mu_with_and_without_expression() {
        var full = assertInstanceOf(Quantifier.class, expr("mu x : N | x > 3 . x * 2"));
        assertEquals(Quantifier.Kind.MU, full.kind());
        binary(full.constraint(), BinaryExpr.Operator.GREATER);
        binary(full.body(), BinaryExpr.Operator.TIMES);

        var bare = assertInstanceOf(Quantifier.class, expr("mu x : N | x > 3"));
        assertNull(bare.constraint());
        binary(bare.body(), BinaryExpr.Operator.GREATER);
    }

    @Test
    void parse_comprehension_separators() {
        var pred = assertInstanceOf(SetComprehension.class, expr("{x : N | x > 0}"));
        assertNotNull(pred.predicate());
        assertNull(pred.expression());

        var term = assertInstanceOf(SetComprehension.class, expr("{x : N . x * x}"));
        assertNull(term.predicate());
        binary(term.expression(), BinaryExpr.Operator.TIMES);

        var both = assertInstanceOf(SetComprehension.class, expr("{x : N | x > 0 . x * x}"));
        binary(both.predicate(), BinaryExpr.Operator.GREATER);
        binary(both.expression(), BinaryExpr.Operator.TIMES);

        var bar = assertInstanceOf(SetComprehension.class, expr("{x, y : N | x < y | x + y}"));
        assertEquals(2, bar.variables().size());
        binary(bar.expression(), BinaryExpr.Operator.PLUS);
    }

    @Test
    void parse_collections_and_application() {
        assertEquals(3, assertInstanceOf(SetLiteral.class, expr("{1, 2, 3}")).elements().size());
        assertTrue(assertInstanceOf(SetLiteral.class, expr("{}")).elements().isEmpty());
        assertEquals(2, assertInstanceOf(TupleExpr.class, expr("(a, b)")).elements().size());
        assertEquals(2, assertInstanceOf(SequenceLiteral.class, expr("<a, b>")).elements().size());
        assertTrue(assertInstanceOf(SequenceLiteral.class, expr("<>")).elements().isEmpty());
        assertTrue(assertInstanceOf(SequenceLiteral.class, expr("⟨⟩")).elements().isEmpty());

        var app = assertInstanceOf(FunctionApp.class, expr("f(x, y)"));
        assertEquals(2, app.args().size());
        var curried = assertInstanceOf(FunctionApp.class, expr("f(x)(y)"));
        assertInstanceOf(FunctionApp.class, curried.function());
    }

    @Test
    void parse_nested_sequences_split_double_angles() {
        var outer = assertInstanceOf(SequenceLiteral.class, expr("<<a>, <b>>"));
        assertEquals(2, outer.elements().size());
        for (Expr inner : outer.elements()) {
            assertEquals(1, assertInstanceOf(SequenceLiteral.class, inner).elements().size());
        }

        var mixed = assertInstanceOf(SequenceLiteral.class, expr("<<x, y, z>, <>>"));
        assertEquals(3, assertInstanceOf(SequenceLiteral.class, mixed.elements().get(0)).elements().size());
        assertTrue(assertInstanceOf(SequenceLiteral.class, mixed.elements().get(1)).elements().isEmpty());

        var single = assertInstanceOf(SequenceLiteral.class, expr("<<a>>"));
        assertInstanceOf(SequenceLiteral.class, single.elements().get(0));

        var cat = binary(expr("<<a>> ^ s"), BinaryExpr.Operator.CAT);
        assertInstanceOf(SequenceLiteral.class, cat.left());
        assertEquals("s", assertInstanceOf(Identifier.class, cat.right()).name());
    }

    @Test
    void parse_deep_nesting_is_rejected_not_overflowed() {
        String deep = "(".repeat(20000) + "x" + ")".repeat(20000);
        var ex = assertThrows(ParserException.class, () -> expr(deep));
        assertEquals("Expression nested too deeply", ex.detail());

        String fine = "(".repeat(50) + "x" + ")".repeat(50);
        assertEquals("x", assertInstanceOf(Identifier.class, expr(fine)).name());
    }

    @Test
    void parse_long_prefix_and_implication_chains() {
        var nots = assertInstanceOf(UnaryExpr.class, expr("not ".repeat(5000) + "p"));
        assertEquals(UnaryExpr.Operator.NOT, nots.op());

        var chain = binary(expr("p => ".repeat(5000) + "p"), BinaryExpr.Operator.IMPLIES);
        assertEquals("p", assertInstanceOf(Identifier.class, chain.left()).name());
        binary(chain.right(), BinaryExpr.Operator.IMPLIES);
    }

    @Test
    void parse_prefix_and_postfix_operators() {
        var inv = assertInstanceOf(UnaryExpr.class, expr("R~"));
        assertEquals(UnaryExpr.Operator.INVERSE, inv.op());

        var power = assertInstanceOf(UnaryExpr.class, expr("P X"));
        assertEquals(UnaryExpr.Operator.POWER, power.op());

        var card = assertInstanceOf(UnaryExpr.class, expr("#(A union B)"));
        assertEquals(UnaryExpr.Operator.CARD, card.op());
        binary(card.operand(), BinaryExpr.Operator.UNION);

        assertEquals("P", assertInstanceOf(Identifier.class, expr("P")).name());
        binary(expr("dom R = A"), BinaryExpr.Operator.EQUALS);
    }

    @Test
    void parse_expression_rejects_trailing_tokens() {
        var ex = assertThrows(ParserException.class, () -> expr("a b"));
        assertTrue(ex.detail().startsWith("Unexpected token after expression"));
        assertEquals(1, ex.line());
        assertEquals(3, ex.column());
    }

    @Test
    void parse_unclosed_paren_reports_position() {
        var ex = assertThrows(ParserException.class, () -> expr("(a + b"));
        assertTrue(ex.detail().startsWith("Unclosed '('"));
    }

    // ---------- zed items and blocks ----------

    @Test
    void parse_free_type_branches_in_order() {
        var d = parse("Tree ::= leaf | node <<Tree cross Tree>>");
        var ft = assertInstanceOf(FreeType.class, d.items().get(0));
        assertEquals("Tree", ft.name());
        assertEquals(2, ft.branches().size());
        assertEquals("leaf", ft.branches().get(0).name());
        assertNull(ft.branches().get(0).parameter());
        assertEquals("node", ft.branches().get(1).name());
        binary(ft.branches().get(1).parameter(), BinaryExpr.Operator.CROSS);
    }

    @Test
    void parse_free_type_continued_on_next_line() {
        var d = parse("""
            Colour ::= red
              | green
              | blue
            """);
        assertEquals(1, d.items().size());
        assertEquals(3, ((FreeType) d.items().get(0)).branches().size());
    }

    @Test
    void parse_free_type_doubled_equals_is_named() {
        var ex = assertThrows(ParserException.class, () -> parse("Status ::== ok | bad"));
        assertTrue(ex.detail().contains("'::='"), ex.detail());
        assertEquals(1, ex.line());
    }

    @Test
    void parse_given_and_abbreviation() {
        var d = parse("""
            given PERSON, BOOK

            Pair[X] == X cross X
            """);
        var given = assertInstanceOf(GivenType.class, d.items().get(0));
        assertEquals(List.of("PERSON", "BOOK"), given.names());

        var abbr = assertInstanceOf(Abbreviation.class, d.items().get(1));
        assertEquals("Pair", abbr.name());
        assertEquals(List.of("X"), abbr.genericParams());
        binary(abbr.expression(), BinaryExpr.Operator.CROSS);
    }

    @Test
    void parse_schema_predicate_groups_split_on_blank_lines() {
        var d = parse("""
            schema Counter
              value : N
              limit : N
            where
              value <= limit
              limit > 0


              value != 7
            end
            """);
        var s = assertInstanceOf(Schema.class, d.items().get(0));
        assertEquals("Counter", s.name());
        assertEquals(2, s.declarations().size());
        assertEquals(2, s.predicateGroups().size());
        assertEquals(2, s.predicateGroups().get(0).size());
        assertEquals(1, s.predicateGroups().get(1).size());
        binary(s.predicateGroups().get(1).get(0), BinaryExpr.Operator.NOT_EQUAL);
    }

    @Test
    void parse_continued_predicate_stays_in_its_group() {
        var d = parse("""
            schema Range
              low, high : N
            where
              low >= 0 land \\
                low <= high
              high < 100
            end
            """);
        var s = assertInstanceOf(Schema.class, d.items().get(0));
        assertEquals(1, s.predicateGroups().size());
        assertEquals(2, s.predicateGroups().get(0).size());
        binary(s.predicateGroups().get(0).get(0), BinaryExpr.Operator.AND);
    }

    @Test
    void parse_axdef_with_semicolons_and_generics() {
        var d = parse("""
            axdef
              x : N; y, z : Z
            where
              x < y
            end

            gendef [X]
              empty : P X
            end
            """);
        var ax = assertInstanceOf(AxDef.class, d.items().get(0));
        assertEquals(2, ax.declarations().size());
        assertEquals(List.of("y", "z"), ax.declarations().get(1).names());
        assertEquals(1, ax.predicateGroups().size());

        var gen = assertInstanceOf(GenDef.class, d.items().get(1));
        assertEquals(List.of("X"), gen.genericParams());
        assertTrue(gen.predicateGroups().isEmpty());
    }

    @Test
    void parse_missing_end_is_reported() {
        var ex = assertThrows(ParserException.class, () -> parse("""
            schema S
              x : N
            where
              x > 0
            """));
        assertTrue(ex.detail().startsWith("Expected 'end' to close schema S"), ex.detail());
    }

    @Test
    void parse_missing_colon_in_declaration() {
        var ex = assertThrows(ParserException.class, () -> parse("""
            axdef
              x N
            end
            """));
        assertTrue(ex.detail().startsWith("Expected ':'"), ex.detail());
        assertEquals(2, ex.line());
    }

    @Test
    void parse_unknown_character_is_lexical() {
        var ex = assertThrows(LexerException.class, () -> parse("x $ y"));
        assertEquals("Unexpected character '$'", ex.detail());
        assertEquals(3, ex.column());
    }

    // ---------- proofs ----------

    @Test
    void parse_proof_nesting_from_indentation() {
        var d = parse("""
            PROOF:
              p land q => q land p [=> intro]
                [1] p land q [assumption]
                q land p [land intro]
                  q [land elim]
                    :: p land q
                  p [land elim]
                    :: p land q
            """);
        var tree = assertInstanceOf(ProofTree.class, d.items().get(0));
        ProofNode root = tree.conclusion();
        assertEquals("=> intro", root.justification());
        assertEquals(2, root.children().size());

        var assumed = (ProofNode) root.children().get(0);
        assertTrue(assumed.assumption());
        assertEquals(Integer.valueOf(1), assumed.label());

        var intro = (ProofNode) root.children().get(1);
        assertEquals("land intro", intro.justification());
        assertEquals(2, intro.children().size());
        var left = (ProofNode) intro.children().get(0);
        assertTrue(((ProofNode) left.children().get(0)).sibling());
        assertEquals(4, tree.depth());
    }

    @Test
    void parse_continued_proof_line_is_one_step() {
        var d = parse("""
            PROOF:
              p land \\
                q [land intro]
                p [assumption]
                q [assumption]
            """);
        ProofNode root = assertInstanceOf(ProofTree.class, d.items().get(0)).conclusion();
        binary(root.expression(), BinaryExpr.Operator.AND);
        assertEquals("land intro", root.justification());
        assertEquals(2, root.children().size());
    }

    @Test
    void parse_out_of_range_assumption_label() {
        var ex = assertThrows(ParserException.class, () -> parse("""
            PROOF:
              q [mp]
                [99999999999] p
            """));
        assertEquals("Assumption label out of range", ex.detail());
        assertEquals(3, ex.line());
    }

    @Test
    void parse_proof_case_analysis() {
        var d = parse("""
            PROOF:
              r [or elim]
                p lor q
                case p:
                  r [from p]
                case q:
                  r [from q]
            """);
        var root = ((ProofTree) d.items().get(0)).conclusion();
        assertEquals(3, root.children().size());
        assertInstanceOf(ProofNode.class, root.children().get(0));

        var first = assertInstanceOf(CaseAnalysis.class, root.children().get(1));
        assertEquals("p", first.caseName());
        assertEquals(1, first.steps().size());
        assertEquals("from p", first.steps().get(0).justification());
        assertEquals("q", ((CaseAnalysis) root.children().get(2)).caseName());
    }

    @Test
    void parse_proof_ends_at_blank_line() {
        var d = parse("""
            PROOF:
              q [modus ponens]
                p

            x = 1
            """);
        assertEquals(2, d.items().size());
        assertInstanceOf(ExprItem.class, d.items().get(1));
    }

    @Test
    void parse_proof_cannot_start_with_case() {
        assertThrows(ParserException.class, () -> parse("""
            PROOF:
              case p:
                q
            """));
    }

    // ---------- document ----------

    @Test
    void parse_equivalence_chain() {
        var d = parse("""
            EQUIV:
            p land q
            <=> q land p [commutativity]
            """);
        var chain = assertInstanceOf(ArgueChain.class, d.items().get(0));
        assertEquals(2, chain.steps().size());
        assertNull(chain.steps().get(0).justification());
        assertEquals("commutativity", chain.steps().get(1).justification());
    }

    @Test
    void parse_metadata_and_text() {
        var d = parse("""
            TITLE: Notes on Z
            AUTHOR: A. Student
            PARTS: subsection
            BIBLIOGRAPHY: refs

            TEXT: Some words here.

            (a) x = 1
            """);
        assertEquals("Notes on Z", d.title().title());
        assertEquals("A. Student", d.title().author());
        assertEquals(PartsFormat.SUBSECTION, d.partsFormat());
        assertEquals("refs", d.bibliography().file());
        assertNull(d.bibliography().style());

        assertEquals(3, d.items().size());
        assertEquals("Some words here.", ((Paragraph) d.items().get(0)).text());
    }

    @Test
    void parse_parts_format_ignores_default_locale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr"));
        try {
            assertEquals(PartsFormat.SUBSECTION, parse("PARTS: SUBSECTION\n").partsFormat());
            assertEquals(PartsFormat.INLINE, parse("PARTS: INLINE\n").partsFormat());
        } finally {
            Locale.setDefault(saved);
        }
    }
}

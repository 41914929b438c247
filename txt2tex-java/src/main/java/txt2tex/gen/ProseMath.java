package txt2tex.gen;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import txt2tex.TranslationException;
import txt2tex.ast.expr.Expr;
import txt2tex.lexer.Lexer;
import txt2tex.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds mathematics inside prose and sets it in math mode.
 *
 * <p>Candidates are tried in order: regions already between {@code $} are kept,
 * then outermost balanced braces, then quantifier phrases, then runs of
 * operands joined by operators. A candidate becomes math only if it parses as
 * an expression; everything else stays text, escaped for LaTeX.
 */
final class ProseMath {

    private static final Logger log = LogManager.getLogger(ProseMath.class);

    /** English words that never count as operands. */
    static final Set<String> PROSE_WORDS = Set.of(
            "a", "an", "the",
            "is", "are", "was", "were", "be", "been", "being",
            "has", "have", "had", "do", "does", "did",
            "will", "would", "can", "could", "should", "may", "might", "must", "shall",
            "false", "true",
            "this", "that", "these", "those",
            "it", "its", "we", "you", "they", "he", "she", "i", "me", "us", "them",
            "as", "at", "by", "for", "from", "in", "of", "on", "to", "with",
            "and", "or", "not", "if", "then", "else", "but", "so", "when", "which", "where",
            "here", "syntax", "there", "valid");

    private static final Set<String> OPERATORS = Set.of(
            "=", "!=", "<", ">", "<=", ">=", "=>", "<=>",
            "<->", "->", "+->", ">->", ">+>", "-->>", "+->>", ">->>", "|->",
            "+", "-", "*", "^", "++", "..", "<|", "|>", "<<|", "|>>",
            "elem", "notin", "subset", "subseteq", "psubset",
            "union", "intersect", "cross", "land", "lor", "div", "mod", "o9");

    private static final Pattern OPERAND = Pattern.compile("[A-Za-z0-9_'#()]+");
    private static final Pattern GLUED = Pattern.compile("[A-Za-z0-9_]+(<=|>=|!=|=|<|>)[A-Za-z0-9_]+");
    private static final Pattern QUANTIFIER = Pattern.compile("\\b(forall|exists1|exists|mu)\\s");
    private static final Pattern WORD = Pattern.compile("\\S+");
    private static final String TRAILING = ".,;:";

    private final LatexGenerator generator;

    ProseMath(LatexGenerator generator) {
        this.generator = generator;
    }

    private record Segment(String text, boolean math) {}

    String render(String text) {
        List<Segment> segments = splitExistingMath(text);
        segments = expand(segments, this::braces);
        segments = expand(segments, this::quantifiers);
        segments = expand(segments, this::operatorRuns);

        StringBuilder sb = new StringBuilder();
        for (Segment s : segments) sb.append(s.math() ? s.text() : escape(s.text()));
        return sb.toString();
    }

    private interface Detector {
        List<Segment> apply(String text);
    }

    private static List<Segment> expand(List<Segment> segments, Detector detector) {
        List<Segment> out = new ArrayList<>();
        for (Segment s : segments) {
            if (s.math()) out.add(s);
            else out.addAll(detector.apply(s.text()));
        }
        return out;
    }

    private static List<Segment> splitExistingMath(String text) {
        List<Segment> out = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            int open = text.indexOf('$', i);
            int close = open < 0 ? -1 : text.indexOf('$', open + 1);
            if (close < 0) {
                out.add(new Segment(text.substring(i), false));
                break;
            }
            if (open > i) out.add(new Segment(text.substring(i, open), false));
            out.add(new Segment(text.substring(open, close + 1), true));
            i = close + 1;
        }
        return out;
    }

    // ---------- braces ----------
    private List<Segment> braces(String text) {
        List<Segment> out = new ArrayList<>();
        int last = 0;
        for (int[] span : findBalancedBraces(text)) {
            String math = toMath(text.substring(span[0], span[1]));
            if (math == null) continue;
            if (span[0] > last) out.add(new Segment(text.substring(last, span[0]), false));
            out.add(new Segment(math, true));
            last = span[1];
        }
        if (last < text.length()) out.add(new Segment(text.substring(last), false));
        return out;
    }

    /**
     * Outermost balanced {@code {...}} regions as {start, endExclusive} pairs.
     * An unmatched close is skipped; an unmatched open yields nothing.
     */
    static List<int[]> findBalancedBraces(String text) {
        List<int[]> spans = new ArrayList<>();
        int depth = 0;
        int start = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                if (depth == 0) start = i;
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
                if (depth == 0) spans.add(new int[]{start, i + 1});
            }
        }
        return spans;
    }

    // ---------- quantifier phrases ----------
    private List<Segment> quantifiers(String text) {
        Matcher m = QUANTIFIER.matcher(text);
        if (!m.find()) return List.of(new Segment(text, false));

        int start = m.start();
        int sentenceEnd = sentenceEnd(text, start);
        List<int[]> words = words(text, start, sentenceEnd);

        // longest phrase that parses
        for (int n = words.size(); n >= 3; n--) {
            int end = stripTrailing(text, words.get(0)[0], words.get(n - 1)[1]);
            String math = toMath(text.substring(start, end));
            if (math != null) {
                List<Segment> out = new ArrayList<>();
                if (start > 0) out.add(new Segment(text.substring(0, start), false));
                out.add(new Segment(math, true));
                out.addAll(quantifiers(text.substring(end)));
                return out;
            }
        }
        List<Segment> out = new ArrayList<>();
        out.add(new Segment(text.substring(0, m.end()), false));
        out.addAll(quantifiers(text.substring(m.end())));
        return out;
    }

    private static int sentenceEnd(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c == '.' && (i + 1 == text.length() || Character.isWhitespace(text.charAt(i + 1)))) || c == ';') {
                return i;
            }
        }
        return text.length();
    }

    // ---------- operator runs ----------
    private record Word(int start, int end, String clean, boolean operator, boolean operand, boolean breaksAfter) {}

    private List<Segment> operatorRuns(String text) {
        List<Word> words = new ArrayList<>();
        for (int[] w : words(text, 0, text.length())) {
            int cleanEnd = stripTrailing(text, w[0], w[1]);
            if (cleanEnd == w[0]) cleanEnd = w[1]; // a lone ':' is a token of its own
            String clean = text.substring(w[0], cleanEnd);
            boolean op = OPERATORS.contains(clean) || clean.equals(":");
            boolean operand = !op && !clean.isEmpty()
                    && (OPERAND.matcher(clean).matches() || GLUED.matcher(clean).matches())
                    && !PROSE_WORDS.contains(clean.toLowerCase(Locale.ROOT));
            words.add(new Word(w[0], cleanEnd, clean, op, operand, cleanEnd < w[1]));
        }

        List<Segment> out = new ArrayList<>();
        int last = 0;
        int i = 0;
        while (i < words.size()) {
            int j = i;
            while (j < words.size() && (words.get(j).operator() || words.get(j).operand())) {
                if (words.get(j).breaksAfter()) {
                    j++;
                    break;
                }
                j++;
            }
            if (j == i) {
                i++;
                continue;
            }
            int[] found = bestSpan(text, words.subList(i, j));
            if (found == null) {
                i = j;
                continue;
            }
            Word first = words.get(i + found[0]);
            Word lastWord = words.get(i + found[1]);
            if (first.start() > last) out.add(new Segment(text.substring(last, first.start()), false));
            out.add(new Segment(toMathOrDeclaration(text.substring(first.start(), lastWord.end())), true));
            last = lastWord.end();
            i = i + found[1] + 1;
        }
        if (last < text.length()) out.add(new Segment(text.substring(last), false));
        return out;
    }

    // longest sub-run that starts and ends on an operand, holds an operator, and parses
    private int[] bestSpan(String text, List<Word> run) {
        for (int len = run.size(); len >= 1; len--) {
            for (int from = 0; from + len <= run.size(); from++) {
                List<Word> span = run.subList(from, from + len);
                Word a = span.get(0);
                Word b = span.get(len - 1);
                if (!a.operand() || !b.operand()) continue;
                boolean hasOp = span.stream().anyMatch(Word::operator)
                        || (len == 1 && GLUED.matcher(a.clean()).matches());
                if (!hasOp) continue;
                if (toMathOrDeclaration(text.substring(a.start(), b.end())) != null) {
                    return new int[]{from, from + len - 1};
                }
            }
        }
        return null;
    }

    private String toMathOrDeclaration(String candidate) {
        int colon = candidate.indexOf(" : ");
        if (colon > 0) {
            String name = candidate.substring(0, colon).trim();
            if (!name.matches("[A-Za-z][A-Za-z0-9_]*(\\s*,\\s*[A-Za-z][A-Za-z0-9_]*)*")) return null;
            Expr type = parse(candidate.substring(colon + 3));
            if (type == null) return null;
            StringBuilder names = new StringBuilder();
            for (String n : name.split("\\s*,\\s*")) {
                if (names.length() > 0) names.append(", ");
                names.append(generator.identifier(n));
            }
            return "$" + names + " : " + generator.generateExpr(type) + "$";
        }
        return toMath(candidate);
    }

    // ---------- helpers ----------
    private String toMath(String candidate) {
        Expr e = parse(candidate);
        return e == null ? null : "$" + generator.generateExpr(e) + "$";
    }

    private static Expr parse(String candidate) {
        try {
            return new Parser(new Lexer(candidate).tokenize()).parseExpression();
        } catch (TranslationException e) {
            log.debug("not math: '{}' ({})", candidate, e.detail());
            return null;
        }
    }

    private static List<int[]> words(String text, int from, int to) {
        List<int[]> out = new ArrayList<>();
        Matcher m = WORD.matcher(text).region(from, to);
        while (m.find()) out.add(new int[]{m.start(), m.end()});
        return out;
    }

    private static int stripTrailing(String text, int start, int end) {
        while (end > start && TRAILING.indexOf(text.charAt(end - 1)) >= 0) end--;
        return end;
    }

    /** Escapes LaTeX special characters in running text. */
    static String escape(String text) {
        StringBuilder sb = new StringBuilder();
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\textbackslash{}");
                case '{', '}', '$', '&', '%', '#', '_' -> sb.append('\\').append(c);
                case '~' -> sb.append("\\textasciitilde{}");
                case '^' -> sb.append("\\textasciicircum{}");
                case '<' -> sb.append("\\textless{}");
                case '>' -> sb.append("\\textgreater{}");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}

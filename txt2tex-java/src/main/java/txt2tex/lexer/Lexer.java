package txt2tex.lexer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

public class Lexer {

    private static final Logger log = LogManager.getLogger(Lexer.class);

    private static final int TAB_WIDTH = 4;

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;
    // no token emitted yet on the current physical line
    private boolean lineStart = true;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("and", TokenType.AND),
            Map.entry("land", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("lor", TokenType.OR),
            Map.entry("not", TokenType.NOT),
            Map.entry("lnot", TokenType.NOT),
            Map.entry("implies", TokenType.IMPLIES),
            Map.entry("iff", TokenType.IFF),
            Map.entry("in", TokenType.IN),
            Map.entry("elem", TokenType.IN),
            Map.entry("notin", TokenType.NOTIN),
            Map.entry("subset", TokenType.SUBSETEQ),
            Map.entry("subseteq", TokenType.SUBSETEQ),
            Map.entry("psubset", TokenType.PSUBSET),
            Map.entry("union", TokenType.UNION),
            Map.entry("intersect", TokenType.INTERSECT),
            Map.entry("cross", TokenType.CROSS),
            Map.entry("div", TokenType.DIV),
            Map.entry("mod", TokenType.MOD),
            Map.entry("dom", TokenType.DOM),
            Map.entry("ran", TokenType.RAN),
            Map.entry("P", TokenType.POWER),
            Map.entry("P1", TokenType.POWER1),
            Map.entry("F", TokenType.FINSET),
            Map.entry("F1", TokenType.FINSET1),
            Map.entry("seq", TokenType.SEQ),
            Map.entry("seq1", TokenType.SEQ1),
            Map.entry("iseq", TokenType.ISEQ),
            Map.entry("bag", TokenType.BAG),
            Map.entry("bigcup", TokenType.BIGCUP),
            Map.entry("bigcap", TokenType.BIGCAP),
            Map.entry("filter", TokenType.FILTER),
            Map.entry("o9", TokenType.COMP),
            Map.entry("comp", TokenType.COMP),
            Map.entry("forall", TokenType.FORALL),
            Map.entry("exists", TokenType.EXISTS),
            Map.entry("exists1", TokenType.EXISTS1),
            Map.entry("mu", TokenType.MU),
            Map.entry("schema", TokenType.SCHEMA),
            Map.entry("axdef", TokenType.AXDEF),
            Map.entry("gendef", TokenType.GENDEF),
            Map.entry("where", TokenType.WHERE),
            Map.entry("end", TokenType.END),
            Map.entry("given", TokenType.GIVEN),
            Map.entry("case", TokenType.CASE)
    );

    // recognised only at the start of a line and only when followed by ':'
    private static final Map<String, TokenType> directives = Map.ofEntries(
            Map.entry("TEXT", TokenType.TEXT),
            Map.entry("PURETEXT", TokenType.PURETEXT),
            Map.entry("LATEX", TokenType.LATEX),
            Map.entry("TITLE", TokenType.TITLE),
            Map.entry("SUBTITLE", TokenType.SUBTITLE),
            Map.entry("AUTHOR", TokenType.AUTHOR),
            Map.entry("DATE", TokenType.DATE),
            Map.entry("INSTITUTION", TokenType.INSTITUTION),
            Map.entry("BIBLIOGRAPHY", TokenType.BIBLIOGRAPHY),
            Map.entry("BIBLIOGRAPHY_STYLE", TokenType.BIBLIOGRAPHY_STYLE),
            Map.entry("PARTS", TokenType.PARTS),
            Map.entry("PROOF", TokenType.PROOF),
            Map.entry("EQUIV", TokenType.EQUIV),
            Map.entry("ARGUE", TokenType.EQUIV),
            Map.entry("PAGEBREAK", TokenType.PAGEBREAK)
    );

    private static final Set<TokenType> blockCaptures =
            EnumSet.of(TokenType.TEXT, TokenType.PURETEXT, TokenType.LATEX);

    private static final Set<TokenType> lineCaptures = EnumSet.of(
            TokenType.TITLE, TokenType.SUBTITLE, TokenType.AUTHOR, TokenType.DATE,
            TokenType.INSTITUTION, TokenType.BIBLIOGRAPHY, TokenType.BIBLIOGRAPHY_STYLE,
            TokenType.PARTS);

    private static final List<Map.Entry<String, TokenType>> operators = longestFirst(Map.ofEntries(
            Map.entry("<=>", TokenType.IFF),
            Map.entry("=>", TokenType.IMPLIES),
            Map.entry("::=", TokenType.FREE_EQ),
            Map.entry("::", TokenType.DCOLON),
            Map.entry("==", TokenType.DEFEQ),
            Map.entry("=", TokenType.EQUALS),
            Map.entry("!=", TokenType.NOT_EQUAL),
            Map.entry("<=", TokenType.LESS_EQUAL),
            Map.entry(">=", TokenType.GREATER_EQUAL),
            Map.entry("<", TokenType.LESS),
            Map.entry(">", TokenType.GREATER),
            Map.entry("<->", TokenType.REL),
            Map.entry("->", TokenType.TFUN),
            Map.entry("+->", TokenType.PFUN),
            Map.entry(">->", TokenType.TINJ),
            Map.entry(">+>", TokenType.PINJ),
            Map.entry("-->>", TokenType.TSURJ),
            Map.entry("+->>", TokenType.PSURJ),
            Map.entry(">->>", TokenType.BIJ),
            Map.entry("-|->", TokenType.FFUN),
            Map.entry("|->", TokenType.MAPSTO),
            Map.entry("<|", TokenType.DRES),
            Map.entry("|>", TokenType.RRES),
            Map.entry("<<|", TokenType.NDRES),
            Map.entry("|>>", TokenType.NRRES),
            Map.entry("++", TokenType.OVERRIDE),
            Map.entry("^{\\sim}", TokenType.INVERSE),
            Map.entry("^", TokenType.CAT),
            Map.entry("..", TokenType.UPTO),
            Map.entry("<<", TokenType.LDATA),
            Map.entry(">>", TokenType.RDATA),
            Map.entry("+", TokenType.PLUS),
            Map.entry("-", TokenType.MINUS),
            Map.entry("*", TokenType.TIMES),
            Map.entry("#", TokenType.HASH),
            Map.entry("~", TokenType.INVERSE),
            Map.entry("(", TokenType.LPAREN),
            Map.entry(")", TokenType.RPAREN),
            Map.entry("[", TokenType.LBRACKET),
            Map.entry("]", TokenType.RBRACKET),
            Map.entry("{", TokenType.LBRACE),
            Map.entry("}", TokenType.RBRACE),
            Map.entry(",", TokenType.COMMA),
            Map.entry(";", TokenType.SEMICOLON),
            Map.entry(":", TokenType.COLON),
            Map.entry(".", TokenType.DOT),
            Map.entry("|", TokenType.PIPE),
            Map.entry("@", TokenType.BULLET)
    ));

    // spellings the generator emits, so generated math can be read back
    private static final Map<String, TokenType> latexCommands = Map.ofEntries(
            Map.entry("land", TokenType.AND),
            Map.entry("lor", TokenType.OR),
            Map.entry("lnot", TokenType.NOT),
            Map.entry("implies", TokenType.IMPLIES),
            Map.entry("Rightarrow", TokenType.IMPLIES),
            Map.entry("iff", TokenType.IFF),
            Map.entry("Leftrightarrow", TokenType.IFF),
            Map.entry("forall", TokenType.FORALL),
            Map.entry("exists", TokenType.EXISTS),
            Map.entry("exists_1", TokenType.EXISTS1),
            Map.entry("mu", TokenType.MU),
            Map.entry("in", TokenType.IN),
            Map.entry("notin", TokenType.NOTIN),
            Map.entry("subseteq", TokenType.SUBSETEQ),
            Map.entry("subset", TokenType.PSUBSET),
            Map.entry("neq", TokenType.NOT_EQUAL),
            Map.entry("leq", TokenType.LESS_EQUAL),
            Map.entry("geq", TokenType.GREATER_EQUAL),
            Map.entry("cup", TokenType.UNION),
            Map.entry("cap", TokenType.INTERSECT),
            Map.entry("setminus", TokenType.SETMINUS),
            Map.entry("cross", TokenType.CROSS),
            Map.entry("div", TokenType.DIV),
            Map.entry("mod", TokenType.MOD),
            Map.entry("dom", TokenType.DOM),
            Map.entry("ran", TokenType.RAN),
            Map.entry("power", TokenType.POWER),
            Map.entry("power_1", TokenType.POWER1),
            Map.entry("finset", TokenType.FINSET),
            Map.entry("finset_1", TokenType.FINSET1),
            Map.entry("seq", TokenType.SEQ),
            Map.entry("seq_1", TokenType.SEQ1),
            Map.entry("iseq", TokenType.ISEQ),
            Map.entry("bag", TokenType.BAG),
            Map.entry("bigcup", TokenType.BIGCUP),
            Map.entry("bigcap", TokenType.BIGCAP),
            Map.entry("rel", TokenType.REL),
            Map.entry("fun", TokenType.TFUN),
            Map.entry("pfun", TokenType.PFUN),
            Map.entry("inj", TokenType.TINJ),
            Map.entry("pinj", TokenType.PINJ),
            Map.entry("surj", TokenType.TSURJ),
            Map.entry("psurj", TokenType.PSURJ),
            Map.entry("bij", TokenType.BIJ),
            Map.entry("ffun", TokenType.FFUN),
            Map.entry("mapsto", TokenType.MAPSTO),
            Map.entry("dres", TokenType.DRES),
            Map.entry("rres", TokenType.RRES),
            Map.entry("ndres", TokenType.NDRES),
            Map.entry("nrres", TokenType.NRRES),
            Map.entry("comp", TokenType.COMP),
            Map.entry("oplus", TokenType.OVERRIDE),
            Map.entry("cat", TokenType.CAT),
            Map.entry("filter", TokenType.FILTER),
            Map.entry("upto", TokenType.UPTO),
            Map.entry("inv", TokenType.INVERSE),
            Map.entry("langle", TokenType.LANGLE),
            Map.entry("rangle", TokenType.RANGLE),
            Map.entry("ldata", TokenType.LDATA),
            Map.entry("rdata", TokenType.RDATA)
    );

    private static final Map<String, String> latexNames = Map.of(
            "nat", "N",
            "num", "Z",
            "nat_1", "N1"
    );

    private static final Map<Character, TokenType> unicodeSymbols = Map.ofEntries(
            Map.entry('∧', TokenType.AND),
            Map.entry('∨', TokenType.OR),
            Map.entry('¬', TokenType.NOT),
            Map.entry('⇒', TokenType.IMPLIES),
            Map.entry('⇔', TokenType.IFF),
            Map.entry('∀', TokenType.FORALL),
            Map.entry('∃', TokenType.EXISTS),
            Map.entry('∈', TokenType.IN),
            Map.entry('∉', TokenType.NOTIN),
            Map.entry('⊆', TokenType.SUBSETEQ),
            Map.entry('⊂', TokenType.PSUBSET),
            Map.entry('∪', TokenType.UNION),
            Map.entry('∩', TokenType.INTERSECT),
            Map.entry('×', TokenType.CROSS),
            Map.entry('↦', TokenType.MAPSTO),
            Map.entry('⟨', TokenType.LANGLE),
            Map.entry('⟩', TokenType.RANGLE)
    );

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipBlanks();
            if (isAtEnd()) break;

            int startLine = line;
            int startCol = col;
            char c = peek();

            if (c == '\n') {
                advance();
                add(lineStart ? TokenType.BLANK_LINE : TokenType.NEWLINE, "", startLine, startCol);
                lineStart = true;
                continue;
            }
            if (c == '\\' && continuationAhead()) {
                skipContinuation();
                continue;
            }
            if (lineStart && lineDirective(startLine, startCol)) {
                lineStart = false;
                continue;
            }
            lineStart = false;

            if (isDigit(c)) numberLiteral(startLine, startCol);
            else if (isLetter(c)) identifier(startLine, startCol);
            else if (c == '\\') latexCommand(startLine, startCol);
            else if (unicodeSymbols.containsKey(c)) {
                advance();
                add(unicodeSymbols.get(c), String.valueOf(c), startLine, startCol);
            } else if (!operator(startLine, startCol)) {
                advance();
                add(TokenType.UNKNOWN, String.valueOf(c), startLine, startCol);
            }
        }

        if (!lineStart) add(TokenType.NEWLINE, "", line, col);
        tokens.add(new Token(TokenType.EOF, "", line, col));
        log.debug("tokenized {} chars into {} tokens", source.length(), tokens.size());
        return tokens;
    }

    // ================= line-start directives =================

    private boolean lineDirective(int line, int col) {
        if (source.startsWith("===", pos)) {
            String title = restOfLine().replaceAll("^=+|=+$", "").strip();
            add(TokenType.SECTION, title, line, col);
            return true;
        }
        if (source.startsWith("**", pos)) {
            String label = restOfLine().replaceAll("^\\*+|\\*+$", "").strip();
            add(TokenType.SOLUTION, label, line, col);
            return true;
        }
        if (isPartLabel()) {
            String label = source.substring(pos, pos + 3);
            advance();
            advance();
            advance();
            add(TokenType.PART_LABEL, label, line, col);
            return true;
        }

        int end = pos;
        while (end < source.length() && (isUpper(source.charAt(end)) || source.charAt(end) == '_')) end++;
        if (end == pos || end >= source.length() || source.charAt(end) != ':') return false;

        String word = source.substring(pos, end);
        TokenType type = directives.get(word);
        if (type == null) return false;

        while (pos <= end) advance();

        if (blockCaptures.contains(type)) add(type, captureBlock(), line, col);
        else if (lineCaptures.contains(type)) add(type, restOfLine().strip(), line, col);
        else add(type, word + ":", line, col);
        return true;
    }

    private boolean isPartLabel() {
        if (pos + 2 >= source.length()) return false;
        char letter = source.charAt(pos + 1);
        if (source.charAt(pos) != '(' || letter < 'a' || letter > 'j' || source.charAt(pos + 2) != ')') {
            return false;
        }
        return pos + 3 >= source.length() || Character.isWhitespace(source.charAt(pos + 3));
    }

    // text up to the next blank line, the final newline is left in place
    private String captureBlock() {
        StringBuilder sb = new StringBuilder(restOfLine());
        while (peek() == '\n' && !nextLineBlank()) {
            advance();
            sb.append('\n').append(restOfLine());
        }
        return sb.toString().strip();
    }

    private boolean nextLineBlank() {
        int i = pos + 1;
        if (i >= source.length()) return true;
        while (i < source.length() && source.charAt(i) != '\n') {
            if (!Character.isWhitespace(source.charAt(i))) return false;
            i++;
        }
        return true;
    }

    private String restOfLine() {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '\n') sb.append(advance());
        return sb.toString();
    }

    // ================= tokens =================

    private void numberLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        add(TokenType.NUMBER, sb.toString(), line, col);
    }

    private void identifier(int line, int col) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        // braced subscript as emitted for short suffixes: x_{ab}
        if (sb.charAt(sb.length() - 1) == '_' && peek() == '{') {
            int close = source.indexOf('}', pos);
            if (close > pos + 1 && source.substring(pos + 1, close).chars().allMatch(ch -> isAlphaNumeric((char) ch))) {
                advance();
                while (peek() != '}') sb.append(advance());
                advance();
            }
        }

        String word = sb.toString();
        TokenType type = keywords.get(word);
        if (type != null) {
            add(type, word, line, col);
            return;
        }

        // Z decorations: x' (after state), x? (input), x! (output)
        while (peek() == '\'' || peek() == '?' || (peek() == '!' && peekNext() != '=')) {
            sb.append(advance());
        }
        add(TokenType.IDENTIFIER, sb.toString(), line, col);
    }

    private void latexCommand(int line, int col) {
        advance(); // '\'
        char c = peek();

        if (c == '{' || c == '}' || c == '#') {
            advance();
            add(c == '{' ? TokenType.LBRACE : c == '}' ? TokenType.RBRACE : TokenType.HASH,
                    "\\" + c, line, col);
            return;
        }
        if (c == ' ' || c == '\t') {
            add(TokenType.SETMINUS, "\\", line, col);
            return;
        }
        if (!isLetter(c)) {
            add(TokenType.UNKNOWN, "\\", line, col);
            return;
        }

        StringBuilder sb = new StringBuilder();
        while (isLetter(peek())) sb.append(advance());
        String name = sb.toString();

        if (peek() == '_' && peekNext() == '1'
                && (latexCommands.containsKey(name + "_1") || latexNames.containsKey(name + "_1"))) {
            advance();
            advance();
            name = name + "_1";
        }

        if (name.equals("mathit") || name.equals("mathbb")) {
            braceName(name, line, col);
            return;
        }

        TokenType type = latexCommands.get(name);
        if (type != null) {
            add(type, "\\" + name, line, col);
        } else if (latexNames.containsKey(name)) {
            add(TokenType.IDENTIFIER, latexNames.get(name), line, col);
        } else {
            add(TokenType.UNKNOWN, "\\" + name, line, col);
        }
    }

    // \mathit{max\_value} and \mathbb{N}_1 read back as plain identifiers
    private void braceName(String command, int line, int col) {
        if (peek() != '{') {
            add(TokenType.UNKNOWN, "\\" + command, line, col);
            return;
        }
        advance();
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '}' && peek() != '\n') {
            char ch = advance();
            if (ch != '\\') sb.append(ch);
        }
        if (peek() == '}') advance();

        String name = sb.toString();
        if (command.equals("mathbb") && peek() == '_' && peekNext() == '1') {
            advance();
            advance();
            name = name + "1";
        }
        add(TokenType.IDENTIFIER, name, line, col);
    }

    private boolean operator(int line, int col) {
        for (Map.Entry<String, TokenType> op : operators) {
            if (source.startsWith(op.getKey(), pos)) {
                for (int i = 0; i < op.getKey().length(); i++) advance();
                add(op.getValue(), op.getKey(), line, col);
                return true;
            }
        }
        return false;
    }

    // ================= helpers =================

    private boolean continuationAhead() {
        int i = pos + 1;
        while (i < source.length() && source.charAt(i) != '\n') {
            char c = source.charAt(i);
            if (c != ' ' && c != '\t' && c != '\r') return false;
            i++;
        }
        return true;
    }

    private void skipContinuation() {
        while (!isAtEnd() && peek() != '\n') advance();
        if (!isAtEnd()) advance();
    }

    private void skipBlanks() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') advance();
            else return;
        }
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else if (c == '\t') {
            col = ((col - 1) / TAB_WIDTH + 1) * TAB_WIDTH + 1;
        } else {
            col++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isAlphaNumeric(char c) {
        return isLetter(c) || isDigit(c) || c == '_';
    }

    private void add(TokenType type, String lexeme, int line, int col) {
        tokens.add(new Token(type, lexeme, line, col));
    }

    private static List<Map.Entry<String, TokenType>> longestFirst(Map<String, TokenType> table) {
        List<Map.Entry<String, TokenType>> sorted = new ArrayList<>(table.entrySet());
        sorted.sort((a, b) -> Integer.compare(b.getKey().length(), a.getKey().length()));
        return List.copyOf(sorted);
    }
}

package txt2tex.lexer;

public record Token(TokenType type, String lexeme, int line, int column) {

    /** Leading-whitespace width of the line, valid for the first token on it. */
    public int indent() {
        return column - 1;
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + line + ":" + column;
    }
}

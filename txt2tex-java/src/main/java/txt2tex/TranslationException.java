package txt2tex;

/**
 * Base of every failure raised while turning source text into LaTeX.
 * Carries the 1-based source position of the offending token.
 */
public abstract class TranslationException extends RuntimeException {

    private final String detail;
    private final int line;
    private final int column;

    protected TranslationException(String detail, int line, int column) {
        super("[" + line + ":" + column + "] " + detail);
        this.detail = detail;
        this.line = line;
        this.column = column;
    }

    /** The message without the position prefix. */
    public String detail() {
        return detail;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}

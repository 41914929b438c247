package txt2tex.pipeline;

/**
 * A failed run, reduced to what a caller needs to report it.
 *
 * @param kind    which stage gave up
 * @param message the message without position prefix
 * @param line    1-based source line, 0 when unknown
 * @param column  1-based source column, 0 when unknown
 */
public record StageError(Kind kind, String message, int line, int column) {

    public enum Kind {
        /** A character the notation does not use. */
        LEXICAL,
        /** The input does not follow the grammar. */
        SYNTAX,
        /** Parser and generator disagree, or the run failed unexpectedly. */
        INTERNAL
    }

    @Override
    public String toString() {
        return kind + " [" + line + ":" + column + "] " + message;
    }
}

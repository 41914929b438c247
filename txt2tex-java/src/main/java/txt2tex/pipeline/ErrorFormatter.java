package txt2tex.pipeline;

import java.util.List;

/**
 * Renders a {@link StageError} for a person: the message, the offending source
 * line with a caret under the column, and a hint when the message is one we
 * know how to explain.
 */
public final class ErrorFormatter {

    private record Hint(String messagePrefix, String text) {}

    private static final List<Hint> hints = List.of(
            new Hint("Expected 'end'", "Did you forget 'end' before starting a new block?"),
            new Hint("Expected 'where' or 'end'", "Declarations must be followed by 'where' or 'end'"),
            new Hint("Unexpected character", "This character is not valid in txt2tex notation"),
            new Hint("Unclosed", "Check that every bracket is closed on the same expression"),
            new Hint("Expected identifier", "A name must start with a letter"),
            new Hint("Expected ':'", "Type declarations need a colon between name and type"));

    private ErrorFormatter() {
    }

    public static String format(StageError error, String source) {
        StringBuilder sb = new StringBuilder();
        sb.append("Error: ").append(error.message()).append('\n');
        if (error.line() > 0) {
            sb.append("  --> line ").append(error.line()).append(", column ").append(error.column()).append('\n');
            String text = sourceLine(source, error.line());
            if (text != null) {
                String number = String.valueOf(error.line());
                String gutter = " ".repeat(number.length());
                sb.append(gutter).append(" |\n");
                sb.append(number).append(" | ").append(text).append('\n');
                sb.append(gutter).append(" | ").append(" ".repeat(Math.max(0, error.column() - 1))).append("^\n");
            }
        }
        String hint = hintFor(error.message());
        if (hint != null) sb.append("Hint: ").append(hint).append('\n');
        return sb.toString();
    }

    static String hintFor(String message) {
        for (Hint h : hints) {
            if (message.startsWith(h.messagePrefix())) return h.text();
        }
        return null;
    }

    // tabs become spaces so the caret lines up with the lexer's columns
    private static String sourceLine(String source, int line) {
        String[] lines = source.split("\n", -1);
        if (line > lines.length) return null;
        StringBuilder sb = new StringBuilder();
        for (char c : lines[line - 1].toCharArray()) {
            if (c == '\t') sb.append(" ".repeat(4 - sb.length() % 4));
            else if (c != '\r') sb.append(c);
        }
        return sb.toString();
    }
}

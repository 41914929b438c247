package txt2tex.ast.doc;

import txt2tex.ast.DocumentItem;

/** {@code TEXT:} prose; inline math is detected on output. */
public record Paragraph(String text, int line) implements DocumentItem {}

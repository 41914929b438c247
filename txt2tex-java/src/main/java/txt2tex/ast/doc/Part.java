package txt2tex.ast.doc;

import txt2tex.ast.DocumentItem;

/** A part label such as {@code (a)}. */
public record Part(String label, int line) implements DocumentItem {}

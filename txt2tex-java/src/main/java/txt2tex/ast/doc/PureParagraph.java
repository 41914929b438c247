package txt2tex.ast.doc;

import txt2tex.ast.DocumentItem;

/** {@code PURETEXT:} prose copied with LaTeX escaping only. */
public record PureParagraph(String text, int line) implements DocumentItem {}

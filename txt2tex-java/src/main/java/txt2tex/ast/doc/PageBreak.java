package txt2tex.ast.doc;

import txt2tex.ast.DocumentItem;

public record PageBreak(int line) implements DocumentItem {}

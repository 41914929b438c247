package txt2tex.ast.doc;

import txt2tex.ast.DocumentItem;

public record LatexBlock(String latex, int line) implements DocumentItem {}

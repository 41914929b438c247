package txt2tex.ast.doc;

import txt2tex.ast.DocumentItem;

public record Solution(String label, int line) implements DocumentItem {}

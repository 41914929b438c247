package txt2tex.ast.doc;

import txt2tex.ast.DocumentItem;

public record Section(String title, int line) implements DocumentItem {}

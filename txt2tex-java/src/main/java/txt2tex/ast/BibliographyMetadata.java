package txt2tex.ast;

public record BibliographyMetadata(String file, String style) {}

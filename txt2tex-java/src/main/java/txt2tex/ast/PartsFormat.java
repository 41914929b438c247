package txt2tex.ast;

public enum PartsFormat {
    INLINE,
    SUBSECTION
}

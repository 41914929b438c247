package txt2tex.gen;

import txt2tex.TranslationException;

/** The generator met a node shape the parser should never produce. */
public class GenerationException extends TranslationException {

    public GenerationException(String detail, int line, int column) {
        super(detail, line, column);
    }
}

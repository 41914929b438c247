package txt2tex.parser;

import txt2tex.TranslationException;

public class ParserException extends TranslationException {

    public ParserException(String detail, int line, int column) {
        super(detail, line, column);
    }
}

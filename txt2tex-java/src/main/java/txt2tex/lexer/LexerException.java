package txt2tex.lexer;

import txt2tex.TranslationException;

public class LexerException extends TranslationException {

    public LexerException(String detail, int line, int column) {
        super(detail, line, column);
    }
}

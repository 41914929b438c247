package txt2tex.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import txt2tex.TranslationException;
import txt2tex.ast.Document;
import txt2tex.ast.expr.Expr;
import txt2tex.gen.Dialect;
import txt2tex.gen.GenerationException;
import txt2tex.gen.LatexGenerator;
import txt2tex.lexer.Lexer;
import txt2tex.lexer.LexerException;
import txt2tex.lexer.Token;
import txt2tex.parser.Parser;
import txt2tex.parser.ParserException;

import java.util.List;

/**
 * Lexer, parser and generator run back to back. Exceptions stop at this
 * boundary and come out as a {@link StageError}; anything unexpected is
 * reported as {@link StageError.Kind#INTERNAL}.
 */
public final class Pipeline {

    private static final Logger log = LogManager.getLogger(Pipeline.class);

    private Pipeline() {
    }

    /** Translates a whole document. */
    public static PipelineResult run(String text, Dialect dialect) {
        try {
            List<Token> tokens = new Lexer(text).tokenize();
            Document doc = new Parser(tokens).parseDocument();
            String latex = new LatexGenerator(dialect).generateDocument(doc);
            log.info("translated {} items ({} tokens) to {} chars", doc.items().size(), tokens.size(), latex.length());
            return new PipelineResult.Ok(latex);
        } catch (TranslationException e) {
            return failed(e);
        } catch (RuntimeException | StackOverflowError e) {
            return crashed(e);
        }
    }

    /** Translates one expression to its math-mode text, without {@code $} delimiters. */
    public static PipelineResult runExpression(String text, Dialect dialect) {
        try {
            Expr e = new Parser(new Lexer(text).tokenize()).parseExpression();
            return new PipelineResult.Ok(new LatexGenerator(dialect).generateExpr(e));
        } catch (TranslationException e) {
            return failed(e);
        } catch (RuntimeException | StackOverflowError e) {
            return crashed(e);
        }
    }

    private static PipelineResult failed(TranslationException e) {
        StageError.Kind kind;
        if (e instanceof LexerException) kind = StageError.Kind.LEXICAL;
        else if (e instanceof ParserException) kind = StageError.Kind.SYNTAX;
        else kind = StageError.Kind.INTERNAL;

        if (e instanceof GenerationException) log.error("generator rejected parser output: {}", e.getMessage());
        else log.info("translation failed: {}", e.getMessage());
        return new PipelineResult.Err(new StageError(kind, e.detail(), e.line(), e.column()));
    }

    private static PipelineResult crashed(Throwable e) {
        log.error("translation aborted", e);
        return new PipelineResult.Err(new StageError(StageError.Kind.INTERNAL, String.valueOf(e), 0, 0));
    }
}

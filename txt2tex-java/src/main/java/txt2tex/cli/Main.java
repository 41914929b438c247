package txt2tex.cli;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import txt2tex.gen.Dialect;
import txt2tex.pipeline.ErrorFormatter;
import txt2tex.pipeline.Pipeline;
import txt2tex.pipeline.PipelineResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public final class Main {

    private static final Logger log = LogManager.getLogger(Main.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    public static void main(String[] args) throws IOException {
        System.exit(run(args));
    }

    static int run(String[] args) throws IOException {
        Path input = null;
        Path output = null;
        Dialect dialect = Dialect.FUZZ;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.equals("--zed")) {
                dialect = Dialect.STANDARD;
            } else if (a.equals("-o")) {
                if (i + 1 >= args.length) return usage("-o needs a file name");
                output = Path.of(args[++i]);
            } else if (a.startsWith("-")) {
                return usage("unknown option " + a);
            } else if (input == null) {
                input = Path.of(a);
            } else {
                return usage("more than one input file");
            }
        }
        if (input == null) return usage(null);
        if (output == null) {
            output = Path.of(input.toString().replaceFirst("\\.txt$", "") + ".tex");
        }

        // 1. Read
        String source = Files.readString(input);
        System.out.println("[1/3] Reading: " + input);

        // 2. Translate
        PipelineResult result = Pipeline.run(source, dialect);
        if (result instanceof PipelineResult.Err err) {
            System.err.print(ErrorFormatter.format(err.error(), source));
            log.info("{} failed with {}", input, err.error().kind());
            return FAILED;
        }
        String latex = ((PipelineResult.Ok) result).latex();
        System.out.println("[2/3] Translated: " + dialect.name().toLowerCase(Locale.ROOT) + " dialect");

        // 3. Write
        Files.writeString(output, latex);
        System.out.println("[3/3] Writing: " + output);

        System.out.println("\n✓ Success: " + output);
        System.out.println("  Lines:     " + latex.lines().count());
        System.out.println("  File size: " + Files.size(output) + " bytes");
        return OK;
    }

    private static int usage(String problem) {
        if (problem != null) System.err.println("txt2tex: " + problem);
        System.err.println("Usage: txt2tex <input.txt> [-o output.tex] [--zed]");
        return USAGE;
    }
}

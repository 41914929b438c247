package txt2tex.gen;

import java.util.List;

/**
 * Output flavour. Only symbol spelling and the preamble differ; parsing is shared.
 */
public enum Dialect {
    FUZZ(List.of("fuzz")),
    STANDARD(List.of("zed-cm", "zed-maths"));

    private final List<String> packages;

    Dialect(List<String> packages) {
        this.packages = packages;
    }

    public List<String> packages() {
        return packages;
    }
}

package txt2tex.ast;

/** A top-level entry of a {@link Document}. */
public interface DocumentItem {

    int line();
}

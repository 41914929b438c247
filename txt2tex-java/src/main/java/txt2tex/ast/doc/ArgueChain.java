package txt2tex.ast.doc;

import txt2tex.ast.DocumentItem;

import java.util.List;

/** {@code EQUIV:} chain of equivalent predicates with optional justifications. */
public record ArgueChain(List<ArgueStep> steps, int line) implements DocumentItem {

    public ArgueChain {
        steps = List.copyOf(steps);
    }
}

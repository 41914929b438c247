package txt2tex.ast.decl;

import java.util.List;

public record FreeType(String name, List<FreeBranch> branches, int line, int column) implements ZedItem {

    public FreeType {
        branches = List.copyOf(branches);
    }
}

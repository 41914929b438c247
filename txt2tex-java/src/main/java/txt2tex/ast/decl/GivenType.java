package txt2tex.ast.decl;

import java.util.List;

public record GivenType(List<String> names, int line, int column) implements ZedItem {

    public GivenType {
        names = List.copyOf(names);
    }
}

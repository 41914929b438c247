package txt2tex.ast.decl;

import txt2tex.ast.expr.Expr;

import java.util.List;

public record GenDef(
        List<String> genericParams,
        List<Declaration> declarations,
        List<List<Expr>> predicateGroups,
        int line,
        int column
) implements DeclarationBlock {

    public GenDef {
        genericParams = List.copyOf(genericParams);
        declarations = List.copyOf(declarations);
        predicateGroups = predicateGroups.stream().map(List::copyOf).toList();
    }
}

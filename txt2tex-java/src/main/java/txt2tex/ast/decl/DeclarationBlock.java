package txt2tex.ast.decl;

import txt2tex.ast.DocumentItem;
import txt2tex.ast.expr.Expr;

import java.util.List;

/**
 * Declarations, then predicates split into blank-line separated groups.
 */
public sealed interface DeclarationBlock extends DocumentItem permits Schema, AxDef, GenDef {

    List<String> genericParams();

    List<Declaration> declarations();

    List<List<Expr>> predicateGroups();
}

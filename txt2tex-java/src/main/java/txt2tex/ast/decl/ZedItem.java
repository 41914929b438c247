package txt2tex.ast.decl;

import txt2tex.ast.DocumentItem;

/** Items that share a single {@code zed} environment when adjacent. */
public sealed interface ZedItem extends DocumentItem permits GivenType, FreeType, Abbreviation {}

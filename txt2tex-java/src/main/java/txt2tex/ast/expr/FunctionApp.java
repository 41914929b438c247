package txt2tex.ast.expr;

import java.util.List;

public record FunctionApp(Expr function, List<Expr> args, int line, int column) implements Expr {

    public FunctionApp {
        args = List.copyOf(args);
    }
}

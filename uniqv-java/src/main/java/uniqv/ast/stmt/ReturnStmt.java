package uniqv.ast.stmt;

import uniqv.ast.expr.Expr;

public record ReturnStmt(
        Expr value // null for a bare return
) implements Stmt {}

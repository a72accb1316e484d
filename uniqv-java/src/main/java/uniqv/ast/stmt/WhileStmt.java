package uniqv.ast.stmt;

import uniqv.ast.expr.Expr;

public record WhileStmt(
        Expr condition,
        BlockStmt body
) implements Stmt {}

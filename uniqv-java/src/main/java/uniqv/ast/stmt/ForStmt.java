package uniqv.ast.stmt;

import uniqv.ast.expr.Expr;

public record ForStmt(
        Stmt init,       // may be null
        Expr condition,  // may be null
        Expr update,     // may be null
        BlockStmt body
) implements Stmt {}

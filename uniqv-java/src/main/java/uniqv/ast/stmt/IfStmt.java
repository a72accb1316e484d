package uniqv.ast.stmt;

import uniqv.ast.expr.Expr;

import java.util.List;

public record IfStmt(
        List<Branch> branches,   // if + else if ...
        BlockStmt elseBlock      // may be null
) implements Stmt {
    public record Branch(Expr condition, BlockStmt body) {}
}

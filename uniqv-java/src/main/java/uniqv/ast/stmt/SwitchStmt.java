package uniqv.ast.stmt;

import uniqv.ast.expr.Expr;

import java.util.List;

public record SwitchStmt(
        Expr subject,
        List<Case> cases,
        BlockStmt defaultBlock // may be null
) implements Stmt {
    public record Case(Expr match, BlockStmt body) {}
}

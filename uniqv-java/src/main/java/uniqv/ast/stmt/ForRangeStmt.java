package uniqv.ast.stmt;

import uniqv.ast.expr.Expr;
import uniqv.ast.pattern.Pattern;

public record ForRangeStmt(
        Pattern variable,
        Expr from,
        Expr to,
        BlockStmt body
) implements Stmt {}

package uniqv.ast.stmt;

import uniqv.ast.expr.Expr;

public record ExprStmt(Expr expr) implements Stmt {}

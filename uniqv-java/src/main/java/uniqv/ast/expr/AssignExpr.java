package uniqv.ast.expr;

public record AssignExpr(
        Expr target, // VarExpr, FieldAccessExpr or ArrayAccessExpr
        Expr value
) implements Expr {}

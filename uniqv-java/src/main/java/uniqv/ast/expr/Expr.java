package uniqv.ast.expr;

public sealed interface Expr
        permits IntLiteral, FloatLiteral, BoolLiteral, StringLiteral,
        VarExpr, BinaryExpr, UnaryExpr, AssignExpr, CallExpr,
        ArrayAccessExpr, FieldAccessExpr, ArrayLiteralExpr, TupleExpr {}

package uniqv.ast.expr;

public record IntLiteral(int value) implements Expr {}

package uniqv.ast.expr;

public record StringLiteral(String value) implements Expr {}

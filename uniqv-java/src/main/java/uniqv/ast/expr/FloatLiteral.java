package uniqv.ast.expr;

public record FloatLiteral(String text) implements Expr {}

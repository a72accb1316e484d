package uniqv.ast.expr;

import java.util.List;

public record TupleExpr(List<Expr> items) implements Expr {}

package uniqv.ast.stmt;

import uniqv.ast.expr.Expr;

/**
 * {@code repeat { ... } until (cond) fixup { ... };}
 * Bindings of the body are visible to the condition and to the fixup block.
 */
public record RepeatStmt(
        BlockStmt body,
        Expr condition,
        BlockStmt fixup // may be null
) implements Stmt {}

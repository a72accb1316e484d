package uniqv.transform;

import uniqv.ast.decl.CallableDecl;
import uniqv.ast.expr.VarExpr;
import uniqv.ast.pattern.Pattern;
import uniqv.ast.stmt.BlockStmt;
import uniqv.ast.stmt.RepeatStmt;
import uniqv.ast.stmt.Stmt;

/**
 * The extension points of {@link TreeRewriter}.
 *
 * @param callable functions, methods and constructors
 * @param block    every nested statement block
 * @param repeat   {@code repeat ... until ... fixup}
 * @param loop     {@code for} statements, whose header binds outside the body block
 * @param pattern  binding targets, called again for each tuple element
 * @param variable identifier references
 */
public record RewriteHooks(
        Hook<CallableDecl> callable,
        Hook<BlockStmt> block,
        Hook<RepeatStmt> repeat,
        Hook<Stmt> loop,
        Hook<Pattern> pattern,
        Hook<VarExpr> variable
) {
    public static RewriteHooks identity() {
        return new RewriteHooks(Hook.proceed(), Hook.proceed(), Hook.proceed(),
                Hook.proceed(), Hook.proceed(), Hook.proceed());
    }

    public RewriteHooks withCallable(Hook<CallableDecl> h) {
        return new RewriteHooks(h, block, repeat, loop, pattern, variable);
    }

    public RewriteHooks withBlock(Hook<BlockStmt> h) {
        return new RewriteHooks(callable, h, repeat, loop, pattern, variable);
    }

    public RewriteHooks withRepeat(Hook<RepeatStmt> h) {
        return new RewriteHooks(callable, block, h, loop, pattern, variable);
    }

    public RewriteHooks withLoop(Hook<Stmt> h) {
        return new RewriteHooks(callable, block, repeat, h, pattern, variable);
    }

    public RewriteHooks withPattern(Hook<Pattern> h) {
        return new RewriteHooks(callable, block, repeat, loop, h, variable);
    }

    public RewriteHooks withVariable(Hook<VarExpr> h) {
        return new RewriteHooks(callable, block, repeat, loop, pattern, h);
    }
}

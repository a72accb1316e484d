package uniqv.rename;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uniqv.ast.Program;
import uniqv.ast.decl.CallableDecl;
import uniqv.ast.decl.ConstructorDecl;
import uniqv.ast.decl.FunctionDecl;
import uniqv.ast.decl.MethodDecl;
import uniqv.ast.decl.ParamTuple;
import uniqv.ast.expr.VarExpr;
import uniqv.ast.pattern.NamePattern;
import uniqv.ast.pattern.Pattern;
import uniqv.ast.pattern.TuplePattern;
import uniqv.ast.stmt.BlockStmt;
import uniqv.ast.stmt.RepeatStmt;
import uniqv.ast.stmt.Stmt;
import uniqv.transform.RewriteHooks;
import uniqv.transform.TreeRewriter;

import java.util.function.UnaryOperator;

/**
 * Renames the local variables of each callable so that no two bindings in one
 * callable body share a name. Generated names are either the original name or
 * {@code __uqVar<n>__<name>__}; see {@link Demangler}.
 *
 * <p>State is reset at every callable, so one instance can rename any number of
 * callables in sequence. It is not safe to use from two threads at once.
 */
public final class VariableRenamer {
    private static final Logger log = LoggerFactory.getLogger(VariableRenamer.class);

    private final RenamingContext context = new RenamingContext();
    private final TreeRewriter rewriter;

    public VariableRenamer() {
        this.rewriter = new TreeRewriter(RewriteHooks.identity()
                .withCallable(this::onCallable)
                .withBlock(this::onBlock)
                .withRepeat(this::onRepeat)
                .withLoop(this::onLoop)
                .withPattern(this::onPattern)
                .withVariable(this::onVariable));
    }

    /** Renames every function, method and constructor independently. */
    public Program rename(Program program) {
        return rewriter.rewrite(program);
    }

    public FunctionDecl rename(FunctionDecl function) {
        return rewriter.rewriteFunction(function);
    }

    public MethodDecl rename(MethodDecl method) {
        return rewriter.rewriteMethod(method);
    }

    public ConstructorDecl rename(ConstructorDecl constructor) {
        return rewriter.rewriteConstructor(constructor);
    }

    RenamingContext context() {
        return context;
    }

    // ---------- hooks ----------

    private CallableDecl onCallable(CallableDecl c, UnaryOperator<CallableDecl> proceed) {
        context.reset();
        ParamTuple.Tuple params = declareAll(c.params());
        CallableDecl result = proceed.apply(c.withImplementation(params, c.body()));

        log.debug("Renamed {} '{}': {} local bindings", c.getClass().getSimpleName(), c.name(),
                context.allocatedNames().size());
        return result;
    }

    private ParamTuple.Tuple declareAll(ParamTuple.Tuple tuple) {
        return new ParamTuple.Tuple(tuple.items().stream().map(this::declare).toList());
    }

    private ParamTuple declare(ParamTuple p) {
        if (p instanceof ParamTuple.Tuple t) return declareAll(t);
        ParamTuple.Item item = (ParamTuple.Item) p;
        return item.isNamed() ? item.withName(context.declare(item.name())) : item;
    }

    private BlockStmt onBlock(BlockStmt b, UnaryOperator<BlockStmt> proceed) {
        if (context.consumeSkipScope()) {
            return proceed.apply(b);
        }
        context.enterScope();
        BlockStmt result = proceed.apply(b);
        context.exitScope();
        return result;
    }

    // body and condition share one frame; the fixup block nests inside it
    private RepeatStmt onRepeat(RepeatStmt r, UnaryOperator<RepeatStmt> proceed) {
        context.enterScope();
        context.skipNextScope();
        RepeatStmt result = proceed.apply(r);
        context.exitScope();
        return result;
    }

    // loop header bindings live in a frame of their own around the body
    private Stmt onLoop(Stmt loop, UnaryOperator<Stmt> proceed) {
        context.enterScope();
        Stmt result = proceed.apply(loop);
        context.exitScope();
        return result;
    }

    private Pattern onPattern(Pattern p, UnaryOperator<Pattern> proceed) {
        if (p instanceof NamePattern n) return new NamePattern(context.declare(n.name()));
        if (p instanceof TuplePattern) return proceed.apply(p);
        // discarded and invalid patterns bind nothing
        return p;
    }

    private VarExpr onVariable(VarExpr v, UnaryOperator<VarExpr> proceed) {
        return context.resolve(v.name()).map(v::withName).orElse(v);
    }
}

package uniqv.transform;

import uniqv.ast.Program;
import uniqv.ast.decl.CallableDecl;
import uniqv.ast.decl.ClassDecl;
import uniqv.ast.decl.ConstructorDecl;
import uniqv.ast.decl.FunctionDecl;
import uniqv.ast.decl.MethodDecl;
import uniqv.ast.expr.*;
import uniqv.ast.pattern.Pattern;
import uniqv.ast.pattern.TuplePattern;
import uniqv.ast.stmt.*;

import java.util.List;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Depth-first, left-to-right rebuild of the AST. Every node kind has a default
 * rewrite of its children; the kinds named in {@link RewriteHooks} go through
 * their hook first. With {@link RewriteHooks#identity()} the result equals the input.
 */
public final class TreeRewriter {
    private final RewriteHooks hooks;

    public TreeRewriter(RewriteHooks hooks) {
        this.hooks = hooks;
    }

    // ---------- declarations ----------
    public Program rewrite(Program program) {
        List<FunctionDecl> functions = map(program.functions(), this::rewriteFunction);
        List<ClassDecl> classes = map(program.classes(), this::rewriteClass);
        return new Program(functions, classes);
    }

    public ClassDecl rewriteClass(ClassDecl c) {
        List<MethodDecl> methods = map(c.methods(), this::rewriteMethod);
        List<ConstructorDecl> ctors = map(c.constructors(), this::rewriteConstructor);
        return new ClassDecl(c.name(), c.fields(), methods, ctors);
    }

    public FunctionDecl rewriteFunction(FunctionDecl f) {
        if (rewriteCallable(f) instanceof FunctionDecl result) return result;
        throw kindChanged(f);
    }

    public MethodDecl rewriteMethod(MethodDecl m) {
        if (rewriteCallable(m) instanceof MethodDecl result) return result;
        throw kindChanged(m);
    }

    public ConstructorDecl rewriteConstructor(ConstructorDecl c) {
        if (rewriteCallable(c) instanceof ConstructorDecl result) return result;
        throw kindChanged(c);
    }

    private CallableDecl rewriteCallable(CallableDecl callable) {
        return hooks.callable().apply(callable,
                c -> c.withImplementation(c.params(), rewriteBlock(c.body())));
    }

    private static IllegalStateException kindChanged(CallableDecl c) {
        return new IllegalStateException("Callable hook changed the kind of "
                + c.getClass().getSimpleName() + " '" + c.name() + "'");
    }

    // ---------- statements ----------
    public BlockStmt rewriteBlock(BlockStmt block) {
        return hooks.block().apply(block, b -> new BlockStmt(map(b.statements(), this::rewriteStmt)));
    }

    public Stmt rewriteStmt(Stmt s) {
        if (s instanceof BlockStmt b) return rewriteBlock(b);

        if (s instanceof VarDeclStmt v) {
            // initializer first: it cannot see the names it is about to bind
            Expr init = v.initializer() == null ? null : rewriteExpr(v.initializer());
            return new VarDeclStmt(rewritePattern(v.target()), v.type(), init, v.mutable());
        }
        if (s instanceof ExprStmt e) return new ExprStmt(rewriteExpr(e.expr()));
        if (s instanceof ReturnStmt r) {
            return r.value() == null ? r : new ReturnStmt(rewriteExpr(r.value()));
        }
        if (s instanceof IfStmt i) {
            List<IfStmt.Branch> branches = map(i.branches(),
                    br -> new IfStmt.Branch(rewriteExpr(br.condition()), rewriteBlock(br.body())));
            return new IfStmt(branches, rewriteOptionalBlock(i.elseBlock()));
        }
        if (s instanceof WhileStmt w) {
            Expr cond = rewriteExpr(w.condition());
            return new WhileStmt(cond, rewriteBlock(w.body()));
        }
        if (s instanceof ForRangeStmt || s instanceof ForStmt) {
            return hooks.loop().apply(s, this::rewriteLoopChildren);
        }
        if (s instanceof RepeatStmt r) {
            return hooks.repeat().apply(r, this::rewriteRepeatChildren);
        }
        if (s instanceof SwitchStmt sw) {
            Expr subject = rewriteExpr(sw.subject());
            List<SwitchStmt.Case> cases = map(sw.cases(),
                    c -> new SwitchStmt.Case(rewriteExpr(c.match()), rewriteBlock(c.body())));
            return new SwitchStmt(subject, cases, rewriteOptionalBlock(sw.defaultBlock()));
        }
        throw new IllegalStateException("Unhandled statement: " + s.getClass().getSimpleName());
    }

    private Stmt rewriteLoopChildren(Stmt s) {
        if (s instanceof ForRangeStmt fr) {
            Expr from = rewriteExpr(fr.from());
            Expr to = rewriteExpr(fr.to());
            Pattern var = rewritePattern(fr.variable());
            return new ForRangeStmt(var, from, to, rewriteBlock(fr.body()));
        }
        ForStmt f = (ForStmt) s;
        Stmt init = f.init() == null ? null : rewriteStmt(f.init());
        Expr cond = f.condition() == null ? null : rewriteExpr(f.condition());
        BlockStmt body = rewriteBlock(f.body());
        Expr update = f.update() == null ? null : rewriteExpr(f.update());
        return new ForStmt(init, cond, update, body);
    }

    private RepeatStmt rewriteRepeatChildren(RepeatStmt r) {
        BlockStmt body = rewriteBlock(r.body());
        Expr cond = rewriteExpr(r.condition());
        return new RepeatStmt(body, cond, rewriteOptionalBlock(r.fixup()));
    }

    private BlockStmt rewriteOptionalBlock(BlockStmt b) {
        return b == null ? null : rewriteBlock(b);
    }

    // ---------- patterns ----------
    public Pattern rewritePattern(Pattern p) {
        return hooks.pattern().apply(p, q -> q instanceof TuplePattern t
                ? new TuplePattern(map(t.items(), this::rewritePattern))
                : q);
    }

    // ---------- expressions ----------
    public Expr rewriteExpr(Expr e) {
        if (e instanceof VarExpr v) return hooks.variable().apply(v, UnaryOperator.identity());

        if (e instanceof BinaryExpr b) {
            Expr left = rewriteExpr(b.left());
            return new BinaryExpr(left, b.op(), rewriteExpr(b.right()));
        }
        if (e instanceof UnaryExpr u) return new UnaryExpr(u.op(), rewriteExpr(u.expr()));
        if (e instanceof AssignExpr a) {
            Expr target = rewriteExpr(a.target());
            return new AssignExpr(target, rewriteExpr(a.value()));
        }
        if (e instanceof CallExpr c) {
            Expr callee = rewriteExpr(c.callee());
            return new CallExpr(callee, map(c.args(), this::rewriteExpr));
        }
        if (e instanceof ArrayAccessExpr a) {
            Expr array = rewriteExpr(a.array());
            return new ArrayAccessExpr(array, rewriteExpr(a.index()));
        }
        if (e instanceof FieldAccessExpr f) return new FieldAccessExpr(rewriteExpr(f.target()), f.field());
        if (e instanceof ArrayLiteralExpr a) return new ArrayLiteralExpr(map(a.elements(), this::rewriteExpr));
        if (e instanceof TupleExpr t) return new TupleExpr(map(t.items(), this::rewriteExpr));

        // literals
        return e;
    }

    private static <A, B> List<B> map(List<A> items, Function<? super A, ? extends B> f) {
        return items.stream().<B>map(f).toList();
    }
}

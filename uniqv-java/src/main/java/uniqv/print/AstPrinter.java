package uniqv.print;

import uniqv.ast.Program;
import uniqv.ast.decl.*;
import uniqv.ast.expr.*;
import uniqv.ast.pattern.DiscardPattern;
import uniqv.ast.pattern.InvalidPattern;
import uniqv.ast.pattern.NamePattern;
import uniqv.ast.pattern.Pattern;
import uniqv.ast.pattern.TuplePattern;
import uniqv.ast.stmt.*;
import uniqv.ast.type.ArrayTypeRef;
import uniqv.ast.type.NamedTypeRef;
import uniqv.ast.type.PrimitiveTypeRef;
import uniqv.ast.type.TypeRef;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders an AST back to source the parser accepts. Output is canonical:
 * four-space indentation, members grouped as fields, constructors, methods,
 * and only the parentheses precedence requires.
 */
public final class AstPrinter {
    private static final String INDENT = "    ";

    // binding strength, loosest first
    private static final int P_ASSIGN = 1, P_OR = 2, P_AND = 3, P_COMPARE = 4, P_ADD = 5, P_MUL = 6,
            P_UNARY = 7, P_POSTFIX = 8;

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    private AstPrinter() {}

    public static String print(Program program) {
        AstPrinter p = new AstPrinter();
        boolean first = true;
        for (ClassDecl c : program.classes()) {
            if (!first) p.out.append('\n');
            p.classDecl(c);
            first = false;
        }
        for (FunctionDecl f : program.functions()) {
            if (!first) p.out.append('\n');
            p.function(f);
            first = false;
        }
        return p.out.toString();
    }

    public static String print(Stmt stmt) {
        AstPrinter p = new AstPrinter();
        p.stmt(stmt);
        return p.out.toString();
    }

    public static String print(Expr expr) {
        return expr(expr, P_ASSIGN);
    }

    public static String print(Pattern pattern) {
        if (pattern instanceof NamePattern n) return n.name();
        if (pattern instanceof DiscardPattern) return "_";
        if (pattern instanceof TuplePattern t) return "(" + join(t.items(), AstPrinter::print) + ")";
        return "<invalid>";
    }

    public static String print(TypeRef type) {
        if (type instanceof PrimitiveTypeRef p) return p.name();
        if (type instanceof NamedTypeRef n) return n.name();
        ArrayTypeRef a = (ArrayTypeRef) type;
        return print(a.element()) + "[" + (a.size() == null ? "" : a.size()) + "]";
    }

    // ---------- declarations ----------

    private void function(FunctionDecl f) {
        line("fnc " + f.name() + " : " + print(f.returnType()) + params(f.params()) + " ", false);
        block(f.body());
        out.append('\n');
    }

    private void classDecl(ClassDecl c) {
        line("class " + c.name() + " {", true);
        boolean currentPublic = false;
        depth++;
        for (FieldDecl f : c.fields()) {
            currentPublic = accessLabel(currentPublic, f.isPublic());
            line(f.name() + " : " + print(f.type()) + ";", true);
        }
        for (ConstructorDecl ctor : c.constructors()) {
            currentPublic = accessLabel(currentPublic, ctor.isPublic());
            line(c.name() + params(ctor.params()) + " ", false);
            block(ctor.body());
            out.append('\n');
        }
        for (MethodDecl m : c.methods()) {
            currentPublic = accessLabel(currentPublic, m.isPublic());
            line(m.name() + " : " + print(m.returnType()) + params(m.params()) + " ", false);
            block(m.body());
            out.append('\n');
        }
        depth--;
        line("}", true);
    }

    private boolean accessLabel(boolean current, boolean wanted) {
        if (current != wanted) {
            depth--;
            line(wanted ? "public:" : "private:", true);
            depth++;
        }
        return wanted;
    }

    private static String params(ParamTuple.Tuple t) {
        return "(" + join(t.items(), AstPrinter::param) + ")";
    }

    private static String param(ParamTuple p) {
        if (p instanceof ParamTuple.Tuple t) return params(t);
        ParamTuple.Item item = (ParamTuple.Item) p;
        return (item.isNamed() ? item.name() : "_") + ": " + print(item.type());
    }

    // ---------- statements ----------

    // the caller has written the indentation and any prefix on the current line
    private void block(BlockStmt b) {
        out.append("{\n");
        depth++;
        for (Stmt s : b.statements()) stmt(s);
        depth--;
        indent();
        out.append('}');
    }

    private void stmt(Stmt s) {
        if (s instanceof BlockStmt b) {
            indent();
            block(b);
            out.append('\n');
        } else if (s instanceof VarDeclStmt v) {
            line(varDecl(v) + ";", true);
        } else if (s instanceof ExprStmt e) {
            line(print(e.expr()) + ";", true);
        } else if (s instanceof ReturnStmt r) {
            line(r.value() == null ? "return;" : "return " + print(r.value()) + ";", true);
        } else if (s instanceof IfStmt i) {
            indent();
            for (int idx = 0; idx < i.branches().size(); idx++) {
                IfStmt.Branch br = i.branches().get(idx);
                out.append(idx == 0 ? "if (" : " else if (").append(print(br.condition())).append(") ");
                block(br.body());
            }
            if (i.elseBlock() != null) {
                out.append(" else ");
                block(i.elseBlock());
            }
            out.append('\n');
        } else if (s instanceof WhileStmt w) {
            line("while (" + print(w.condition()) + ") ", false);
            block(w.body());
            out.append('\n');
        } else if (s instanceof ForRangeStmt fr) {
            line("for (" + print(fr.variable()) + " in " + print(fr.from()) + "..." + print(fr.to()) + ") ", false);
            block(fr.body());
            out.append('\n');
        } else if (s instanceof ForStmt f) {
            line("for (" + forInit(f.init()) + "; "
                    + (f.condition() == null ? "" : print(f.condition())) + "; "
                    + (f.update() == null ? "" : print(f.update())) + ") ", false);
            block(f.body());
            out.append('\n');
        } else if (s instanceof RepeatStmt r) {
            line("repeat ", false);
            block(r.body());
            out.append(" until (").append(print(r.condition())).append(')');
            if (r.fixup() != null) {
                out.append(" fixup ");
                block(r.fixup());
            }
            out.append(";\n");
        } else if (s instanceof SwitchStmt sw) {
            line("switch (" + print(sw.subject()) + ") {", true);
            depth++;
            for (SwitchStmt.Case c : sw.cases()) {
                line("case " + print(c.match()) + " ", false);
                block(c.body());
                out.append('\n');
            }
            if (sw.defaultBlock() != null) {
                line("default ", false);
                block(sw.defaultBlock());
                out.append('\n');
            }
            depth--;
            line("}", true);
        }
    }

    private static String forInit(Stmt init) {
        if (init == null) return "";
        if (init instanceof VarDeclStmt v) return varDecl(v);
        if (init instanceof ExprStmt e) return print(e.expr());
        throw new IllegalArgumentException("Unsupported for-init: " + init.getClass().getSimpleName());
    }

    private static String varDecl(VarDeclStmt v) {
        String init = v.initializer() == null ? "" : " = " + print(v.initializer());
        if (v.type() != null) {
            return print(v.target()) + ": " + print(v.type()) + init;
        }
        return (v.mutable() ? "mut " : "let ") + print(v.target()) + init;
    }

    // ---------- expressions ----------

    private static String expr(Expr e, int minPrec) {
        int prec = precedence(e);
        String text = exprText(e, prec);
        return prec < minPrec ? "(" + text + ")" : text;
    }

    private static String exprText(Expr e, int prec) {
        if (e instanceof IntLiteral i) return Integer.toString(i.value());
        if (e instanceof FloatLiteral f) return f.text();
        if (e instanceof BoolLiteral b) return b.value() ? "T" : "F";
        if (e instanceof StringLiteral s) return "\"" + s.value() + "\"";
        if (e instanceof VarExpr v) {
            if (v.typeArgs().isEmpty()) return v.name();
            return v.name() + "::<" + join(v.typeArgs(), AstPrinter::print) + ">";
        }
        if (e instanceof BinaryExpr b) {
            // left-associative: an equal-precedence right operand needs parentheses
            return expr(b.left(), prec) + " " + symbol(b.op()) + " " + expr(b.right(), prec + 1);
        }
        if (e instanceof UnaryExpr u) {
            return (u.op() == UnaryExpr.Operator.NEG ? "-" : "!") + expr(u.expr(), P_UNARY);
        }
        if (e instanceof AssignExpr a) return expr(a.target(), P_POSTFIX) + " = " + expr(a.value(), P_ASSIGN);
        if (e instanceof CallExpr c) {
            return expr(c.callee(), P_POSTFIX) + "(" + join(c.args(), AstPrinter::print) + ")";
        }
        if (e instanceof ArrayAccessExpr a) return expr(a.array(), P_POSTFIX) + "[" + print(a.index()) + "]";
        if (e instanceof FieldAccessExpr f) return expr(f.target(), P_POSTFIX) + "." + f.field();
        if (e instanceof ArrayLiteralExpr a) return "[" + join(a.elements(), AstPrinter::print) + "]";
        TupleExpr t = (TupleExpr) e;
        return "(" + join(t.items(), AstPrinter::print) + ")";
    }

    private static int precedence(Expr e) {
        if (e instanceof AssignExpr) return P_ASSIGN;
        if (e instanceof UnaryExpr) return P_UNARY;
        if (e instanceof BinaryExpr b) {
            return switch (b.op()) {
                case OR -> P_OR;
                case AND -> P_AND;
                case EQ, NE, LT, GT, LE, GE -> P_COMPARE;
                case ADD, SUB -> P_ADD;
                case MUL, DIV, MOD -> P_MUL;
            };
        }
        return P_POSTFIX;
    }

    private static String symbol(BinaryExpr.Operator op) {
        return switch (op) {
            case ADD -> "+";
            case SUB -> "-";
            case MUL -> "*";
            case DIV -> "/";
            case MOD -> "%";
            case EQ -> "==";
            case NE -> "!=";
            case LT -> "<";
            case GT -> ">";
            case LE -> "<=";
            case GE -> ">=";
            case AND -> "&&";
            case OR -> "||";
        };
    }

    // ---------- output ----------

    private void line(String text, boolean newline) {
        indent();
        out.append(text);
        if (newline) out.append('\n');
    }

    private void indent() {
        out.append(INDENT.repeat(depth));
    }

    private static <T> String join(List<T> items, Function<T, String> f) {
        return items.stream().map(f).collect(Collectors.joining(", "));
    }
}

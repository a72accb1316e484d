package uniqv.ast.stmt;

import uniqv.ast.expr.Expr;
import uniqv.ast.pattern.Pattern;
import uniqv.ast.type.TypeRef;

/**
 * {@code let p = e;}, {@code mut p = e;} or the typed form {@code x:int = e;}.
 * The typed form is always mutable; {@code type} is null for the other two.
 */
public record VarDeclStmt(
        Pattern target,
        TypeRef type,
        Expr initializer, // null only in the typed form
        boolean mutable
) implements Stmt {}

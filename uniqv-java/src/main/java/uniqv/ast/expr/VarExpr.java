package uniqv.ast.expr;

import uniqv.ast.type.TypeRef;

import java.util.List;

/**
 * Reference to a name, with the explicit type arguments of {@code f::<int>} (empty if none).
 */
public record VarExpr(String name, List<TypeRef> typeArgs) implements Expr {

    public VarExpr(String name) {
        this(name, List.of());
    }

    public VarExpr withName(String newName) {
        return new VarExpr(newName, typeArgs);
    }
}

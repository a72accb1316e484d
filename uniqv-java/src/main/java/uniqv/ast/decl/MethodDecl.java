package uniqv.ast.decl;

import uniqv.ast.stmt.BlockStmt;
import uniqv.ast.type.TypeRef;

public record MethodDecl(
        String name,
        TypeRef returnType,
        ParamTuple.Tuple params,
        BlockStmt body,
        boolean isPublic
) implements CallableDecl {

    @Override
    public MethodDecl withImplementation(ParamTuple.Tuple params, BlockStmt body) {
        return new MethodDecl(name, returnType, params, body, isPublic);
    }
}

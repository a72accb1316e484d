package uniqv.ast.decl;

import uniqv.ast.stmt.BlockStmt;
import uniqv.ast.type.TypeRef;

public record FunctionDecl(
        String name,
        TypeRef returnType,
        ParamTuple.Tuple params,
        BlockStmt body
) implements CallableDecl {

    @Override
    public FunctionDecl withImplementation(ParamTuple.Tuple params, BlockStmt body) {
        return new FunctionDecl(name, returnType, params, body);
    }
}

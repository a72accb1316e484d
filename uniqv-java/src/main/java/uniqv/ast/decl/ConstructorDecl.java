package uniqv.ast.decl;

import uniqv.ast.stmt.BlockStmt;

public record ConstructorDecl(
        String className,
        ParamTuple.Tuple params,
        BlockStmt body,
        boolean isPublic
) implements CallableDecl {

    @Override
    public String name() { return className; }

    @Override
    public ConstructorDecl withImplementation(ParamTuple.Tuple params, BlockStmt body) {
        return new ConstructorDecl(className, params, body, isPublic);
    }
}

package uniqv.ast.decl;

import uniqv.ast.stmt.BlockStmt;

/**
 * Anything with a parameter structure and an implementation body.
 */
public sealed interface CallableDecl permits FunctionDecl, MethodDecl, ConstructorDecl {
    String name();

    ParamTuple.Tuple params();

    BlockStmt body();

    CallableDecl withImplementation(ParamTuple.Tuple params, BlockStmt body);
}

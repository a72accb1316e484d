package uniqv.ast;

import uniqv.ast.decl.*;

import java.util.List;

public record Program(
        List<FunctionDecl> functions,
        List<ClassDecl> classes
) {}

package uniqv.ast.decl;

import uniqv.ast.type.TypeRef;

public record FieldDecl(
        String name,
        TypeRef type,
        boolean isPublic
) {}

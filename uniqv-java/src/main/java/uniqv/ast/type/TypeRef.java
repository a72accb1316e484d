package uniqv.ast.type;

public sealed interface TypeRef permits PrimitiveTypeRef, ArrayTypeRef, NamedTypeRef {}

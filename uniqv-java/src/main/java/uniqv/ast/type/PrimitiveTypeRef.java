package uniqv.ast.type;

public record PrimitiveTypeRef(String name) implements TypeRef {}

package uniqv.ast.type;

public record ArrayTypeRef(
        TypeRef element,
        Integer size // null for []
) implements TypeRef {}

package uniqv.ast.pattern;

public record NamePattern(String name) implements Pattern {}

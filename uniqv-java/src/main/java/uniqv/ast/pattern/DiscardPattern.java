package uniqv.ast.pattern;

/** {@code _} */
public record DiscardPattern() implements Pattern {}

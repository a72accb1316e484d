package uniqv.ast.pattern;

/**
 * Binding target of a declaration or loop header.
 */
public sealed interface Pattern permits NamePattern, TuplePattern, DiscardPattern, InvalidPattern {}

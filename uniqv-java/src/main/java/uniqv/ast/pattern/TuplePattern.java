package uniqv.ast.pattern;

import java.util.List;

public record TuplePattern(List<Pattern> items) implements Pattern {}

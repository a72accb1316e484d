package uniqv.ast.pattern;

// produced by front ends that recover from a bad binding; introduces nothing
public record InvalidPattern() implements Pattern {}

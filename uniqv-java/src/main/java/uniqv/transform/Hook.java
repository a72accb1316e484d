package uniqv.transform;

import java.util.function.UnaryOperator;

/**
 * Replaces the rewrite of one node kind. {@code proceed} performs the default
 * rewrite of the node's children and may be called at most once.
 */
@FunctionalInterface
public interface Hook<T> {
    T apply(T node, UnaryOperator<T> proceed);

    static <T> Hook<T> proceed() {
        return (node, proceed) -> proceed.apply(node);
    }
}

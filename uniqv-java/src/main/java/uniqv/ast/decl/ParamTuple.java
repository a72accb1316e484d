package uniqv.ast.decl;

import uniqv.ast.type.TypeRef;

import java.util.List;

/**
 * Parameter structure of a callable: a single item or a nested tuple of items.
 */
public sealed interface ParamTuple permits ParamTuple.Item, ParamTuple.Tuple {

    /**
     * A single parameter. {@code name} is null for the unnamed placeholder {@code _}.
     */
    record Item(String name, TypeRef type) implements ParamTuple {
        public boolean isNamed() { return name != null; }

        public Item withName(String newName) { return new Item(newName, type); }
    }

    record Tuple(List<ParamTuple> items) implements ParamTuple {}

    static Tuple empty() { return new Tuple(List.of()); }
}

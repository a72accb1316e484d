package uniqv.rename;

import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one renaming traversal: the name registry, the scope stack
 * and the skip-scope flag. Owned by a single traversal at a time.
 */
public final class RenamingContext {
    private final NameGenerator names = new NameGenerator();
    private final ScopeStack scopes = new ScopeStack();
    private boolean skipNextScope;

    public RenamingContext() {
        reset();
    }

    /** Empty registry, a single empty frame, flag cleared. */
    public void reset() {
        names.clear();
        scopes.clear();
        scopes.enter();
        skipNextScope = false;
    }

    /** Allocates a unique name for {@code name} and binds it in the innermost frame. */
    public String declare(String name) {
        String unique = names.generate(name);
        scopes.bind(name, unique);
        return unique;
    }

    public Optional<String> resolve(String name) {
        return scopes.lookup(name);
    }

    public void enterScope() { scopes.enter(); }

    public void exitScope() { scopes.exit(); }

    public int scopeDepth() { return scopes.depth(); }

    /** The next block reuses the current frame instead of pushing its own. */
    public void skipNextScope() { skipNextScope = true; }

    public boolean consumeSkipScope() {
        boolean skip = skipNextScope;
        skipNextScope = false;
        return skip;
    }

    public Set<String> allocatedNames() { return names.allocated(); }
}

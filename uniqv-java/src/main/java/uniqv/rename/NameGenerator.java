package uniqv.rename;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Registry of the names handed out within one callable.
 */
public final class NameGenerator {
    private final Set<String> allocated = new LinkedHashSet<>();

    /**
     * Returns the first of {@code base}, {@code mangle(base, 1)}, {@code mangle(base, 2)}, ...
     * not yet allocated, where {@code base} is the demangled candidate, and records it.
     */
    public String generate(String candidate) {
        String base = Demangler.demangle(candidate);
        String name = base;
        int counter = 0;
        while (allocated.contains(name)) {
            counter++;
            name = Demangler.mangle(base, counter);
        }
        allocated.add(name);
        return name;
    }

    public boolean contains(String name) {
        return allocated.contains(name);
    }

    /** In allocation order. */
    public Set<String> allocated() {
        return Collections.unmodifiableSet(allocated);
    }

    public void clear() {
        allocated.clear();
    }
}

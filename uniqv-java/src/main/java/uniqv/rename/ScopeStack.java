package uniqv.rename;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Frames of original name to generated name, innermost on top.
 */
public final class ScopeStack {
    private final Deque<Map<String, String>> frames = new ArrayDeque<>();

    public void enter() { frames.push(new HashMap<>()); }

    public void exit() {
        if (frames.isEmpty()) throw new IllegalStateException("No scope to exit");
        frames.pop();
    }

    public void bind(String name, String uniqueName) {
        Map<String, String> top = frames.peek();
        if (top == null) throw new IllegalStateException("No scope to define variables in");
        top.put(name, uniqueName);
    }

    public Optional<String> lookup(String name) {
        for (Map<String, String> frame : frames) {
            String unique = frame.get(name);
            if (unique != null) return Optional.of(unique);
        }
        return Optional.empty();
    }

    public int depth() { return frames.size(); }

    public void clear() { frames.clear(); }
}

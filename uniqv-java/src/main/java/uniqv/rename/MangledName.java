package uniqv.rename;

/**
 * A generated name split into its parts: {@code __uqVar<counter>__<base>__}.
 * Counter 0 stands for the bare base name.
 */
public record MangledName(String base, int counter) {

    public MangledName {
        if (base == null || base.isEmpty()) throw new IllegalArgumentException("Empty base name");
        if (counter < 0) throw new IllegalArgumentException("Negative counter: " + counter);
    }

    public String render() {
        return counter == 0 ? base : Demangler.mangle(base, counter);
    }
}

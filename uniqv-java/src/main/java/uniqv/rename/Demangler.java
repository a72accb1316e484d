package uniqv.rename;

import java.util.Optional;

/**
 * Reads and writes the tagged form of generated variable names,
 * {@code __uqVar<counter>__<base>__}.
 */
public final class Demangler {
    static final String TAG = "__uqVar";
    static final String SEPARATOR = "__";

    private Demangler() {}

    public static String mangle(String base, int counter) {
        return TAG + counter + SEPARATOR + base + SEPARATOR;
    }

    /**
     * Splits a tagged name into base and counter. Anything else yields empty, and
     * so does a tag whose counter is too large for an int.
     */
    public static Optional<MangledName> parse(String name) {
        int digitsEnd = digitsEnd(name);
        if (digitsEnd < 0) return Optional.empty();
        try {
            int counter = Integer.parseInt(name.substring(TAG.length(), digitsEnd));
            return Optional.of(new MangledName(base(name, digitsEnd), counter));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** The base name of a tagged name, whatever its counter, or the name itself. */
    public static String demangle(String name) {
        int digitsEnd = digitsEnd(name);
        return digitsEnd < 0 ? name : base(name, digitsEnd);
    }

    public static boolean isMangled(String name) {
        return digitsEnd(name) >= 0;
    }

    // end of the counter digits of a well-formed tag, or -1
    private static int digitsEnd(String name) {
        if (!name.startsWith(TAG) || !name.endsWith(SEPARATOR)) return -1;

        int i = TAG.length();
        while (i < name.length() && name.charAt(i) >= '0' && name.charAt(i) <= '9') i++;
        if (i == TAG.length()) return -1;

        // the base must be non-empty and followed by the closing separator
        int baseStart = i + SEPARATOR.length();
        int baseEnd = name.length() - SEPARATOR.length();
        if (!name.startsWith(SEPARATOR, i) || baseEnd <= baseStart) return -1;
        return i;
    }

    private static String base(String name, int digitsEnd) {
        return name.substring(digitsEnd + SEPARATOR.length(), name.length() - SEPARATOR.length());
    }
}

package work.vaultlogic.sandbox.helpers;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of capability namespaces exposed to scripts under {@code helpers.<key>}.
 */
public enum HelperNamespace {
    STRING,
    NUMBER,
    ARRAY,
    OBJECT,
    MATH,
    DATE,
    /** Bound per invocation to the console buffer; never part of a shared library. */
    CONSOLE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<HelperNamespace> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (HelperNamespace namespace : values()) {
            if (namespace.key().equals(key)) {
                return Optional.of(namespace);
            }
        }
        return Optional.empty();
    }
}

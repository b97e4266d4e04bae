package work.vaultlogic.sandbox.api;

import java.util.Locale;

/**
 * Levels accepted by the sandboxed {@code console} helpers.
 */
public enum ConsoleLevel {
    LOG,
    INFO,
    WARN,
    ERROR;

    /** Member name exposed to scripts, e.g. {@code console.warn}. */
    public String memberName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConsoleLevel from(String value) {
        if (value == null || value.isBlank()) {
            return LOG;
        }
        try {
            return ConsoleLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported console level: " + value);
        }
    }
}

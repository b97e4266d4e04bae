package work.vaultlogic.sandbox.api;

import java.util.Locale;

/**
 * Closed taxonomy of script failures. Only {@link #SANDBOX_UNAVAILABLE} is worth retrying.
 */
public enum ErrorTag {
    COMPILE_ERROR("CompileError", false),
    RUNTIME_ERROR("RuntimeError", false),
    TIMEOUT_ERROR("TimeoutError", false),
    MEMORY_LIMIT_ERROR("MemoryLimitError", false),
    SANDBOX_UNAVAILABLE("SandboxUnavailable", true),
    MARSHALLING_ERROR("MarshallingError", false);

    private final String label;
    private final boolean retryable;

    ErrorTag(String label, boolean retryable) {
        this.label = label;
        this.retryable = retryable;
    }

    public String label() {
        return label;
    }

    public boolean retryable() {
        return retryable;
    }

    public static ErrorTag fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Error tag must not be blank");
        }
        String trimmed = value.trim();
        for (ErrorTag tag : values()) {
            if (tag.label.equalsIgnoreCase(trimmed) || tag.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return tag;
            }
        }
        throw new IllegalArgumentException("Unsupported error tag: " + value);
    }

    @Override
    public String toString() {
        return label;
    }
}

package work.vaultlogic.sandbox.api;

import java.util.Objects;
import java.util.Optional;
import work.vaultlogic.sandbox.helpers.HelperLibrary;

/**
 * Immutable description of one script invocation.
 *
 * <p>{@code input} is any JSON-representable host value (maps, lists, strings, numbers, booleans, null,
 * {@code java.time} values). It is deep-copied into the sandbox and never aliased.</p>
 */
public record ScriptInvocationRequest(
    String code,
    Object input,
    BlockContextView context,
    long timeoutMs,
    boolean consoleEnabled,
    Optional<HelperLibrary> helpers
) {
    public static final long DEFAULT_TIMEOUT_MS = 1000L;

    public ScriptInvocationRequest {
        code = code == null ? "" : code;
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(helpers, "helpers");
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, got " + timeoutMs);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String code = "";
        private Object input;
        private BlockContextView context = BlockContextView.empty();
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private boolean consoleEnabled;
        private HelperLibrary helpers;

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder input(Object input) {
            this.input = input;
            return this;
        }

        public Builder context(BlockContextView context) {
            this.context = context == null ? BlockContextView.empty() : context;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder consoleEnabled(boolean consoleEnabled) {
            this.consoleEnabled = consoleEnabled;
            return this;
        }

        public Builder helpers(HelperLibrary helpers) {
            this.helpers = helpers;
            return this;
        }

        public ScriptInvocationRequest build() {
            return new ScriptInvocationRequest(
                code,
                input,
                context,
                timeoutMs,
                consoleEnabled,
                Optional.ofNullable(helpers)
            );
        }
    }
}

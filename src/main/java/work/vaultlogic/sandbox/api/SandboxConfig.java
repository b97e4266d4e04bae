package work.vaultlogic.sandbox.api;

/**
 * Immutable engine settings shared by every invocation of a {@link ScriptSandbox}.
 */
public record SandboxConfig(
    long memoryLimitBytes,
    long minTimeoutMs,
    long maxTimeoutMs,
    int maxCodeSize,
    int maxInputSize,
    int maxOutputSize,
    int maxConsoleEntries,
    int workerThreads,
    long queueTimeoutMs,
    long setupTimeoutMs,
    long pollIntervalMs
) {
    public static final long DEFAULT_MEMORY_LIMIT_BYTES = 128L * 1024 * 1024;

    public SandboxConfig {
        requirePositive(memoryLimitBytes, "memoryLimitBytes");
        requirePositive(minTimeoutMs, "minTimeoutMs");
        requirePositive(maxTimeoutMs, "maxTimeoutMs");
        if (minTimeoutMs > maxTimeoutMs) {
            throw new IllegalArgumentException("minTimeoutMs (" + minTimeoutMs + ") exceeds maxTimeoutMs (" + maxTimeoutMs + ")");
        }
        requirePositive(maxCodeSize, "maxCodeSize");
        requirePositive(maxInputSize, "maxInputSize");
        requirePositive(maxOutputSize, "maxOutputSize");
        if (maxConsoleEntries < 0) {
            throw new IllegalArgumentException("maxConsoleEntries must not be negative");
        }
        requirePositive(workerThreads, "workerThreads");
        requirePositive(queueTimeoutMs, "queueTimeoutMs");
        requirePositive(setupTimeoutMs, "setupTimeoutMs");
        requirePositive(pollIntervalMs, "pollIntervalMs");
    }

    public static SandboxConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .memoryLimitBytes(memoryLimitBytes)
            .minTimeoutMs(minTimeoutMs)
            .maxTimeoutMs(maxTimeoutMs)
            .maxCodeSize(maxCodeSize)
            .maxInputSize(maxInputSize)
            .maxOutputSize(maxOutputSize)
            .maxConsoleEntries(maxConsoleEntries)
            .workerThreads(workerThreads)
            .queueTimeoutMs(queueTimeoutMs)
            .setupTimeoutMs(setupTimeoutMs)
            .pollIntervalMs(pollIntervalMs);
    }

    /** Clamps a requested timeout into {@code [minTimeoutMs, maxTimeoutMs]}. */
    public long clampTimeout(long requestedMs) {
        return Math.min(Math.max(requestedMs, minTimeoutMs), maxTimeoutMs);
    }

    private static void requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    public static final class Builder {
        private long memoryLimitBytes = DEFAULT_MEMORY_LIMIT_BYTES;
        private long minTimeoutMs = 100L;
        private long maxTimeoutMs = 3_000L;
        private int maxCodeSize = 32 * 1024;
        private int maxInputSize = 64 * 1024;
        private int maxOutputSize = 64 * 1024;
        private int maxConsoleEntries = 1_000;
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private long queueTimeoutMs = 5_000L;
        private long setupTimeoutMs = 10_000L;
        private long pollIntervalMs = 5L;

        public Builder memoryLimitBytes(long memoryLimitBytes) {
            this.memoryLimitBytes = memoryLimitBytes;
            return this;
        }

        public Builder minTimeoutMs(long minTimeoutMs) {
            this.minTimeoutMs = minTimeoutMs;
            return this;
        }

        public Builder maxTimeoutMs(long maxTimeoutMs) {
            this.maxTimeoutMs = maxTimeoutMs;
            return this;
        }

        public Builder maxCodeSize(int maxCodeSize) {
            this.maxCodeSize = maxCodeSize;
            return this;
        }

        public Builder maxInputSize(int maxInputSize) {
            this.maxInputSize = maxInputSize;
            return this;
        }

        public Builder maxOutputSize(int maxOutputSize) {
            this.maxOutputSize = maxOutputSize;
            return this;
        }

        public Builder maxConsoleEntries(int maxConsoleEntries) {
            this.maxConsoleEntries = maxConsoleEntries;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder queueTimeoutMs(long queueTimeoutMs) {
            this.queueTimeoutMs = queueTimeoutMs;
            return this;
        }

        public Builder setupTimeoutMs(long setupTimeoutMs) {
            this.setupTimeoutMs = setupTimeoutMs;
            return this;
        }

        public Builder pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        public SandboxConfig build() {
            return new SandboxConfig(
                memoryLimitBytes,
                minTimeoutMs,
                maxTimeoutMs,
                maxCodeSize,
                maxInputSize,
                maxOutputSize,
                maxConsoleEntries,
                workerThreads,
                queueTimeoutMs,
                setupTimeoutMs,
                pollIntervalMs
            );
        }
    }
}

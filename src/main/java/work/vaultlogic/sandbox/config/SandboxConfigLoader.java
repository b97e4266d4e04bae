package work.vaultlogic.sandbox.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.LongConsumer;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.vaultlogic.sandbox.api.SandboxConfig;
import work.vaultlogic.sandbox.shared.Quantities;

/**
 * Reads {@link SandboxConfig} from the {@code [sandbox]} table of a TOML file and from {@code SANDBOX_*} environment variables.
 *
 * <pre>
 * [sandbox]
 * memory-limit = "128mb"
 * min-timeout = "100ms"
 * max-timeout = "3s"
 * max-code-size = "32kb"
 * worker-threads = 4
 * </pre>
 */
public final class SandboxConfigLoader {
    static final String TABLE = "sandbox";

    private SandboxConfigLoader() {}

    public static SandboxConfig load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new SandboxConfigException("Unable to read sandbox config " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static SandboxConfig parse(String toml) {
        return parse(toml, SandboxConfig.builder());
    }

    public static SandboxConfig parse(String toml, SandboxConfig.Builder builder) {
        TomlParseResult result = Toml.parse(toml == null ? "" : toml);
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new SandboxConfigException("Invalid sandbox config: " + errors);
        }
        TomlTable table = result.getTable(TABLE);
        if (table == null) {
            return build(builder);
        }
        readBytes(table, "memory-limit", builder::memoryLimitBytes);
        readMillis(table, "min-timeout", builder::minTimeoutMs);
        readMillis(table, "max-timeout", builder::maxTimeoutMs);
        readBytes(table, "max-code-size", value -> builder.maxCodeSize(toInt("max-code-size", value)));
        readBytes(table, "max-input-size", value -> builder.maxInputSize(toInt("max-input-size", value)));
        readBytes(table, "max-output-size", value -> builder.maxOutputSize(toInt("max-output-size", value)));
        readCount(table, "max-console-entries", value -> builder.maxConsoleEntries(toInt("max-console-entries", value)));
        readCount(table, "worker-threads", value -> builder.workerThreads(toInt("worker-threads", value)));
        readMillis(table, "queue-timeout", builder::queueTimeoutMs);
        readMillis(table, "setup-timeout", builder::setupTimeoutMs);
        readMillis(table, "poll-interval", builder::pollIntervalMs);
        return build(builder);
    }

    /**
     * Applies {@code SANDBOX_MAX_CODE_SIZE}, {@code SANDBOX_MAX_INPUT_SIZE}, {@code SANDBOX_MAX_OUTPUT_SIZE},
     * {@code SANDBOX_MEMORY_LIMIT} and {@code SANDBOX_WORKER_THREADS} on top of {@code base}.
     */
    public static SandboxConfig applyEnvironment(SandboxConfig base, Map<String, String> env) {
        SandboxConfig.Builder builder = base.toBuilder();
        envBytes(env, "SANDBOX_MAX_CODE_SIZE", value -> builder.maxCodeSize(toInt("SANDBOX_MAX_CODE_SIZE", value)));
        envBytes(env, "SANDBOX_MAX_INPUT_SIZE", value -> builder.maxInputSize(toInt("SANDBOX_MAX_INPUT_SIZE", value)));
        envBytes(env, "SANDBOX_MAX_OUTPUT_SIZE", value -> builder.maxOutputSize(toInt("SANDBOX_MAX_OUTPUT_SIZE", value)));
        envBytes(env, "SANDBOX_MEMORY_LIMIT", builder::memoryLimitBytes);
        String workers = env.get("SANDBOX_WORKER_THREADS");
        if (workers != null && !workers.isBlank()) {
            builder.workerThreads(toInt("SANDBOX_WORKER_THREADS", parseCount("SANDBOX_WORKER_THREADS", workers)));
        }
        return build(builder);
    }

    /** TOML file (when given) overlaid with the process environment. */
    public static SandboxConfig resolve(Path path, Map<String, String> env) {
        SandboxConfig base = path == null ? SandboxConfig.defaults() : load(path);
        return applyEnvironment(base, env);
    }

    private static SandboxConfig build(SandboxConfig.Builder builder) {
        try {
            return builder.build();
        } catch (IllegalArgumentException ex) {
            throw new SandboxConfigException("Invalid sandbox config: " + ex.getMessage(), ex);
        }
    }

    private static void readBytes(TomlTable table, String key, LongConsumer target) {
        Object raw = table.get(key);
        if (raw == null) {
            return;
        }
        if (raw instanceof Long number) {
            target.accept(requireNonNegative(key, number));
        } else if (raw instanceof String text) {
            target.accept(parsing(key, () -> Quantities.parseByteSize(text).orElseThrow()));
        } else {
            throw new SandboxConfigException(key + " must be a size such as \"64kb\" or a number of bytes");
        }
    }

    private static void readMillis(TomlTable table, String key, LongConsumer target) {
        Object raw = table.get(key);
        if (raw == null) {
            return;
        }
        if (raw instanceof Long number) {
            target.accept(requireNonNegative(key, number));
        } else if (raw instanceof String text) {
            target.accept(parsing(key, () -> Quantities.parseDuration(text).map(Duration::toMillis).orElseThrow()));
        } else {
            throw new SandboxConfigException(key + " must be a duration such as \"500ms\" or a number of milliseconds");
        }
    }

    private static void readCount(TomlTable table, String key, LongConsumer target) {
        Object raw = table.get(key);
        if (raw == null) {
            return;
        }
        if (raw instanceof Long number) {
            target.accept(requireNonNegative(key, number));
        } else if (raw instanceof String text) {
            target.accept(parseCount(key, text));
        } else {
            throw new SandboxConfigException(key + " must be an integer");
        }
    }

    private static void envBytes(Map<String, String> env, String name, LongConsumer target) {
        String raw = env.get(name);
        if (raw != null && !raw.isBlank()) {
            target.accept(parsing(name, () -> Quantities.parseByteSize(raw).orElseThrow()));
        }
    }

    private static long parseCount(String key, String text) {
        try {
            return requireNonNegative(key, Long.parseLong(text.trim()));
        } catch (NumberFormatException ex) {
            throw new SandboxConfigException(key + " must be an integer, got \"" + text + "\"", ex);
        }
    }

    private static long requireNonNegative(String key, long value) {
        if (value < 0) {
            throw new SandboxConfigException(key + " must not be negative");
        }
        return value;
    }

    private static int toInt(String key, long value) {
        if (value > Integer.MAX_VALUE) {
            throw new SandboxConfigException(key + " is too large: " + value);
        }
        return (int) value;
    }

    private static long parsing(String key, LongSupplier parser) {
        try {
            return parser.getAsLong();
        } catch (IllegalArgumentException | ArithmeticException | NoSuchElementException ex) {
            throw new SandboxConfigException(key + ": " + ex.getMessage(), ex);
        }
    }
}

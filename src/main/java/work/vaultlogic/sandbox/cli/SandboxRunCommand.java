package work.vaultlogic.sandbox.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.vaultlogic.sandbox.api.BlockContextView;
import work.vaultlogic.sandbox.api.ErrorTag;
import work.vaultlogic.sandbox.api.SandboxConfig;
import work.vaultlogic.sandbox.api.ScriptInvocationRequest;
import work.vaultlogic.sandbox.api.ScriptResult;
import work.vaultlogic.sandbox.api.ScriptSandbox;
import work.vaultlogic.sandbox.api.ScriptValidation;
import work.vaultlogic.sandbox.config.SandboxConfigLoader;
import work.vaultlogic.sandbox.shared.Quantities;

@CommandLine.Command(
    name = "sandbox-run",
    description = "Run a JavaScript transform body in the script sandbox and print the result as JSON.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class SandboxRunCommand implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_RETRYABLE = 75;

    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    private Source source;

    static final class Source {
        @CommandLine.Option(names = {"-e", "--eval"}, description = "Script body given inline.")
        String eval;

        @CommandLine.Option(names = {"-f", "--file"}, description = "File containing the script body.")
        Path file;
    }

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|JSON|-",
        description = "Script input: inline JSON, a JSON file, or '-' for stdin (default: null).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String input;

    @CommandLine.Option(
        names = "--context",
        paramLabel = "PATH|JSON",
        description = "Block context as inline JSON or a JSON file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String context;

    @CommandLine.Option(
        names = "--timeout",
        description = "Execution timeout (e.g. 500ms, 2s); clamped to the configured range.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--memory-limit",
        description = "Memory ceiling per invocation (e.g. 64mb).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String memoryLimitRaw;

    @CommandLine.Option(names = "--console", description = "Capture console output in the result.")
    private boolean console;

    @CommandLine.Option(names = "--validate", description = "Only check that the body compiles.")
    private boolean validateOnly;

    @CommandLine.Option(
        names = "--config",
        description = "TOML file with a [sandbox] table.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configFile;

    private final Map<String, String> environment;
    private final InputStream stdin;

    SandboxRunCommand() {
        this(System.getenv(), System.in);
    }

    SandboxRunCommand(Map<String, String> environment, InputStream stdin) {
        this.environment = environment;
        this.stdin = stdin;
    }

    @Override
    public Integer call() throws Exception {
        String code = loadCode();
        SandboxConfig config = resolveConfig();
        try (ScriptSandbox sandbox = ScriptSandbox.create(config)) {
            if (validateOnly) {
                ScriptValidation validation = sandbox.validate(code);
                ScriptResult result = validation.valid()
                    ? ScriptResult.success(Map.of("valid", true), null, 0L)
                    : ScriptResult.failure(validation.error(), null, 0L);
                return print(result);
            }
            ScriptInvocationRequest request = ScriptInvocationRequest.builder()
                .code(code)
                .input(parseJson(input, "input", true))
                .context(parseContext())
                .timeoutMs(resolveTimeout())
                .consoleEnabled(console)
                .build();
            return print(sandbox.execute(request));
        }
    }

    private int print(ScriptResult result) {
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        if (result.ok()) {
            return EXIT_OK;
        }
        return result.errorTag().map(ErrorTag::retryable).orElse(false) ? EXIT_RETRYABLE : EXIT_SCRIPT_FAILURE;
    }

    private String loadCode() {
        if (source.eval != null) {
            return source.eval;
        }
        try {
            return Files.readString(source.file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read script file: " + source.file);
        }
    }

    private SandboxConfig resolveConfig() {
        SandboxConfig config = SandboxConfigLoader.resolve(configFile, environment);
        if (memoryLimitRaw != null) {
            long bytes = Quantities.parseByteSize(memoryLimitRaw)
                .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(), "--memory-limit must not be blank"));
            config = config.toBuilder().memoryLimitBytes(bytes).build();
        }
        return config;
    }

    private long resolveTimeout() {
        if (timeoutRaw == null) {
            return ScriptInvocationRequest.DEFAULT_TIMEOUT_MS;
        }
        long millis = Quantities.parseDuration(timeoutRaw).map(Duration::toMillis).orElse(0L);
        if (millis <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--timeout must be positive: " + timeoutRaw);
        }
        return millis;
    }

    private BlockContextView parseContext() {
        Object raw = parseJson(context, "context", false);
        if (raw == null) {
            return BlockContextView.empty();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--context must be a JSON object");
        }
        return BlockContextView.fromMap(map);
    }

    private Object parseJson(String value, String label, boolean allowStdin) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String payload;
        if (allowStdin && "-".equals(value)) {
            payload = readStdin();
        } else if (looksLikeJson(value)) {
            payload = value;
        } else {
            Path path = Paths.get(value).toAbsolutePath().normalize();
            try {
                payload = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read " + label + " file: " + path);
            }
        }
        try {
            return JSON.readValue(payload, Object.class);
        } catch (JsonProcessingException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid JSON for " + label + ": " + ex.getOriginalMessage());
        }
    }

    private static boolean looksLikeJson(String value) {
        String trimmed = value.trim();
        return trimmed.startsWith("{") || trimmed.startsWith("[") || trimmed.startsWith("\"")
            || trimmed.equals("null") || trimmed.equals("true") || trimmed.equals("false")
            || trimmed.matches("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");
    }

    private String readStdin() {
        try {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage());
        }
    }
}

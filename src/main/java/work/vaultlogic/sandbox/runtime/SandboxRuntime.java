package work.vaultlogic.sandbox.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.vaultlogic.sandbox.api.ErrorTag;
import work.vaultlogic.sandbox.api.SandboxConfig;
import work.vaultlogic.sandbox.api.ScriptError;
import work.vaultlogic.sandbox.api.ScriptInvocationRequest;
import work.vaultlogic.sandbox.api.ScriptResult;
import work.vaultlogic.sandbox.api.ScriptValidation;
import work.vaultlogic.sandbox.error.ErrorTranslator;
import work.vaultlogic.sandbox.helpers.HelperLibrary;
import work.vaultlogic.sandbox.marshal.MarshallingException;
import work.vaultlogic.sandbox.marshal.ValueMarshaller;

/**
 * Owns the shared polyglot engine and the worker pool; turns requests into isolated invocations.
 */
public final class SandboxRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SandboxRuntime.class);
    private static final String BOOTSTRAP_RESOURCE = "bootstrap.js";

    private final SandboxConfig config;
    private final HelperLibrary helpers;
    private final ErrorTranslator translator = new ErrorTranslator();
    private final Engine engine;
    private final Source bootstrap;
    private final ExecutionController controller;
    private final AtomicBoolean closed = new AtomicBoolean();

    public SandboxRuntime(SandboxConfig config, HelperLibrary helpers) {
        this.config = Objects.requireNonNull(config, "config");
        this.helpers = Objects.requireNonNull(helpers, "helpers");
        this.bootstrap = loadBootstrap();
        this.engine = Engine.newBuilder(SandboxTask.LANGUAGE)
            .option("engine.WarnInterpreterOnly", "false")
            .out(OutputStream.nullOutputStream())
            .err(OutputStream.nullOutputStream())
            .build();
        try {
            warmUp();
        } catch (RuntimeException ex) {
            engine.close(true);
            throw ex;
        }
        this.controller = new ExecutionController(config, translator);
        LOG.info("Script sandbox started: {} workers, memory limit {} bytes, timeout range {}-{}ms",
            config.workerThreads(), config.memoryLimitBytes(), config.minTimeoutMs(), config.maxTimeoutMs());
    }

    public SandboxConfig config() {
        return config;
    }

    public HelperLibrary helpers() {
        return helpers;
    }

    public ScriptResult execute(ScriptInvocationRequest request) {
        try {
            ScriptResult result = run(request);
            if (LOG.isDebugEnabled()) {
                LOG.debug("Script invocation finished ok={} tag={} in {}ms", result.ok(),
                    result.errorTag().map(ErrorTag::label).orElse("-"), result.executionTimeMs());
            }
            return result;
        } catch (RuntimeException | Error unexpected) {
            return ScriptResult.failure(translator.translate(unexpected), List.of(), 0L);
        }
    }

    /** Compile-only check; no script code runs. */
    public ScriptValidation validate(String code) {
        String body = code == null ? "" : code;
        try {
            ScriptError oversized = checkCodeSize(body);
            if (oversized != null) {
                return ScriptValidation.invalid(oversized);
            }
            var invocation = new PreparedInvocation(body, "null", "null", HelperLibrary.builder().build(),
                new ConsoleBuffer(0), false, config.maxTimeoutMs(), config.maxOutputSize(), config.memoryLimitBytes(), true);
            ScriptResult result = dispatch(invocation);
            return result.ok() ? ScriptValidation.ok() : ScriptValidation.invalid(result.error());
        } catch (RuntimeException unexpected) {
            return ScriptValidation.invalid(translator.translate(unexpected));
        }
    }

    private ScriptResult run(ScriptInvocationRequest request) {
        ScriptError oversized = checkCodeSize(request.code());
        if (oversized != null) {
            return ScriptResult.failure(oversized, List.of(), 0L);
        }
        String inputJson;
        String contextJson;
        try {
            inputJson = ValueMarshaller.toJson(request.input());
            contextJson = ValueMarshaller.toJson(request.context().toScriptContext());
        } catch (MarshallingException ex) {
            return ScriptResult.failure(translator.translate(ex), List.of(), 0L);
        }
        long inputSize = (long) inputJson.length() + contextJson.length();
        if (inputSize > config.maxInputSize()) {
            return ScriptResult.failure(ErrorTag.MARSHALLING_ERROR,
                "Input size " + inputSize + " exceeds limit of " + config.maxInputSize() + " characters");
        }
        var invocation = new PreparedInvocation(
            request.code(),
            inputJson,
            contextJson,
            request.helpers().orElse(helpers),
            new ConsoleBuffer(config.maxConsoleEntries()),
            request.consoleEnabled(),
            config.clampTimeout(request.timeoutMs()),
            config.maxOutputSize(),
            config.memoryLimitBytes(),
            false
        );
        return dispatch(invocation);
    }

    private ScriptResult dispatch(PreparedInvocation invocation) {
        if (closed.get()) {
            return ScriptResult.failure(ErrorTag.SANDBOX_UNAVAILABLE, "Script sandbox is closed");
        }
        return controller.execute(engine, bootstrap, invocation);
    }

    private ScriptError checkCodeSize(String code) {
        if (code.length() > config.maxCodeSize()) {
            return new ScriptError(ErrorTag.COMPILE_ERROR,
                "Code size " + code.length() + " exceeds limit of " + config.maxCodeSize() + " characters");
        }
        return null;
    }

    // first context on a fresh engine pays for parsing and initializing the JS realm; do it before any invocation
    private void warmUp() {
        long started = System.nanoTime();
        try (Context context = SandboxTask.newContext(engine)) {
            Value kit = context.eval(bootstrap);
            kit.getMember("guardAllocations").execute(config.memoryLimitBytes(), (ProxyExecutable) arguments -> null);
            Value function = kit.getMember("compile").execute("input", "context", "helpers", "return [input, context, helpers];");
            function.execute(kit.getMember("parse").execute("{\"warm\":true}"), kit.getMember("object").execute(), kit.getMember("object").execute());
        }
        LOG.debug("Sandbox engine warmed up in {}ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    }

    private static Source loadBootstrap() {
        try (InputStream in = SandboxRuntime.class.getResourceAsStream(BOOTSTRAP_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing sandbox bootstrap resource " + BOOTSTRAP_RESOURCE);
            }
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return Source.newBuilder(SandboxTask.LANGUAGE, text, "sandbox-bootstrap.js").buildLiteral();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read sandbox bootstrap", ex);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        controller.close();
        engine.close(true);
        LOG.info("Script sandbox stopped");
    }
}

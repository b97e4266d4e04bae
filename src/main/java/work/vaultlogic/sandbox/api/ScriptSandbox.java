package work.vaultlogic.sandbox.api;

import work.vaultlogic.sandbox.helpers.HelperLibrary;
import work.vaultlogic.sandbox.runtime.SandboxRuntime;

/**
 * Public entry point for embedding the script sandbox.
 *
 * <p>One instance is shared by the whole process. Every call to {@link #execute} runs in its own fresh context
 * and returns a {@link ScriptResult}; failures never escape as exceptions.</p>
 */
public final class ScriptSandbox implements AutoCloseable {
    private final SandboxRuntime runtime;

    public ScriptSandbox(SandboxConfig config, HelperLibrary helpers) {
        this.runtime = new SandboxRuntime(config, helpers);
    }

    public static ScriptSandbox create() {
        return create(SandboxConfig.defaults());
    }

    public static ScriptSandbox create(SandboxConfig config) {
        return new ScriptSandbox(config, HelperLibrary.standard());
    }

    public ScriptResult execute(ScriptInvocationRequest request) {
        if (request == null) {
            return ScriptResult.failure(ErrorTag.RUNTIME_ERROR, "No invocation request given");
        }
        return runtime.execute(request);
    }

    /**
     * Flat form of {@link #execute(ScriptInvocationRequest)}. A null {@code helpers} uses the sandbox library;
     * a non-positive timeout falls back to {@link ScriptInvocationRequest#DEFAULT_TIMEOUT_MS}.
     */
    public ScriptResult execute(String code, Object input, BlockContextView context, HelperLibrary helpers,
                                long timeoutMs, boolean consoleEnabled) {
        var request = ScriptInvocationRequest.builder()
            .code(code)
            .input(input)
            .context(context)
            .helpers(helpers)
            .timeoutMs(timeoutMs > 0 ? timeoutMs : ScriptInvocationRequest.DEFAULT_TIMEOUT_MS)
            .consoleEnabled(consoleEnabled)
            .build();
        return runtime.execute(request);
    }

    public ScriptValidation validate(String code) {
        return runtime.validate(code);
    }

    public HelperLibrary helpers() {
        return runtime.helpers();
    }

    public SandboxConfig config() {
        return runtime.config();
    }

    @Override
    public void close() {
        runtime.close();
    }
}

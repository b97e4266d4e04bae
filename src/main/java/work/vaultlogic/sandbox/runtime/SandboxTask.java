package work.vaultlogic.sandbox.runtime;

import java.util.concurrent.Callable;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.io.IOAccess;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import work.vaultlogic.sandbox.api.ErrorTag;
import work.vaultlogic.sandbox.api.ScriptError;
import work.vaultlogic.sandbox.error.ErrorTranslator;
import work.vaultlogic.sandbox.error.ScriptFailure;
import work.vaultlogic.sandbox.marshal.MarshallingException;
import work.vaultlogic.sandbox.marshal.ValueMarshaller;

/**
 * Worker-side body of one invocation: build the context, copy data in, compile, run, copy the result out.
 */
final class SandboxTask implements Callable<ExecutionOutcome> {
    static final String LANGUAGE = "js";
    private static final String[] PARAMETERS = {"input", "context", "helpers"};

    private final Engine engine;
    private final Source bootstrap;
    private final PreparedInvocation invocation;
    private final InvocationMonitor monitor;
    private final AllocationMeter meter;
    private final ErrorTranslator translator;

    SandboxTask(Engine engine, Source bootstrap, PreparedInvocation invocation, InvocationMonitor monitor,
                AllocationMeter meter, ErrorTranslator translator) {
        this.engine = engine;
        this.bootstrap = bootstrap;
        this.invocation = invocation;
        this.monitor = monitor;
        this.meter = meter;
        this.translator = translator;
    }

    @Override
    public ExecutionOutcome call() {
        monitor.workerStarted(Thread.currentThread().getId());
        try {
            ExecutionOutcome outcome = run();
            if (outcome.ok()) {
                monitor.interrupt(ExecutionState.COMPLETED);
            } else {
                monitor.interrupt(ExecutionState.FAILED);
            }
            return outcome;
        } catch (Throwable error) {
            monitor.interrupt(ExecutionState.FAILED);
            return ExecutionOutcome.failure(translator.translate(error));
        } finally {
            monitor.finished(meter);
            monitor.handle().release();
        }
    }

    private ExecutionOutcome run() {
        Context context = newContext(engine);
        if (!monitor.handle().attach(context)) {
            return ExecutionOutcome.failure(new ScriptError(ErrorTag.SANDBOX_UNAVAILABLE, "Invocation was cancelled before it started"));
        }
        Value kit = context.eval(bootstrap);
        kit.getMember("guardAllocations").execute(invocation.memoryLimitBytes(), allocationRefusal());
        Value parse = kit.getMember("parse");
        Value deepFreeze = kit.getMember("deepFreeze");
        Value input = deepFreeze.execute(parse.execute(invocation.inputJson()));
        Value scriptContext = deepFreeze.execute(parse.execute(invocation.contextJson()));
        Value helpers = new HelperBridge(kit).build(invocation.helpers(), invocation.console(), invocation.consoleEnabled());

        if (!monitor.beginCompile(meter)) {
            return ExecutionOutcome.failure(new ScriptError(ErrorTag.SANDBOX_UNAVAILABLE, "Invocation was cancelled before it started"));
        }
        Value function = compile(kit.getMember("compile"));
        if (invocation.compileOnly()) {
            return ExecutionOutcome.success(null);
        }
        if (!monitor.transition(ExecutionState.COMPILING, ExecutionState.RUNNING)) {
            return ExecutionOutcome.failure(translator.terminated(ErrorTag.TIMEOUT_ERROR, invocation.timeoutMs()));
        }
        Value raw = function.execute(input, scriptContext, helpers);
        Object output = ValueMarshaller.marshalOut(raw);
        int size = ValueMarshaller.jsonLength(output);
        if (size > invocation.maxOutputSize()) {
            throw new MarshallingException("Output size " + size + " exceeds limit of " + invocation.maxOutputSize() + " characters");
        }
        return ExecutionOutcome.success(output);
    }

    // called by the guarded buffer constructors; the state change stands even if the script catches the error
    private ProxyExecutable allocationRefusal() {
        return arguments -> {
            monitor.interrupt(ExecutionState.MEMORY_EXCEEDED);
            long requested = arguments.length > 0 && arguments[0].fitsInLong() ? arguments[0].asLong() : -1L;
            throw new AllocationRefused(requested, invocation.memoryLimitBytes());
        };
    }

    private Value compile(Value functionConstructor) {
        try {
            return functionConstructor.execute((Object[]) arguments());
        } catch (PolyglotException ex) {
            if (ex.isCancelled() || ex.isInterrupted() || ex.isInternalError() || ex.isResourceExhausted() || ex.isHostException()) {
                throw ex;
            }
            ScriptError translated = translator.translate(ex);
            throw new CompileFailure(translated.message(), ex);
        }
    }

    private String[] arguments() {
        String[] arguments = new String[PARAMETERS.length + 1];
        System.arraycopy(PARAMETERS, 0, arguments, 0, PARAMETERS.length);
        arguments[PARAMETERS.length] = invocation.code();
        return arguments;
    }

    static Context newContext(Engine engine) {
        return Context.newBuilder(LANGUAGE)
            .engine(engine)
            .allowHostAccess(HostAccess.NONE)
            .allowHostClassLookup(className -> false)
            .allowIO(IOAccess.NONE)
            .allowCreateThread(false)
            .allowCreateProcess(false)
            .allowNativeAccess(false)
            .allowEnvironmentAccess(EnvironmentAccess.NONE)
            .allowPolyglotAccess(PolyglotAccess.NONE)
            .option("js.ecmascript-version", "2022")
            .build();
    }

    static final class AllocationRefused extends ScriptFailure {
        AllocationRefused(long requestedBytes, long limitBytes) {
            super(ErrorTag.MEMORY_LIMIT_ERROR, "RangeError: Allocation of " + requestedBytes
                + " bytes exceeds memory limit of " + (limitBytes / (1024 * 1024)) + "MB");
        }
    }

    /** Guest error raised while compiling the body; reported as {@code CompileError}. */
    static final class CompileFailure extends ScriptFailure {
        CompileFailure(String message, Throwable cause) {
            super(ErrorTag.COMPILE_ERROR, message, cause);
        }
    }
}

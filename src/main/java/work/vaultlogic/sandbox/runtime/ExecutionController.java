package work.vaultlogic.sandbox.runtime;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.vaultlogic.sandbox.api.ConsoleEntry;
import work.vaultlogic.sandbox.api.ErrorTag;
import work.vaultlogic.sandbox.api.SandboxConfig;
import work.vaultlogic.sandbox.api.ScriptError;
import work.vaultlogic.sandbox.api.ScriptResult;
import work.vaultlogic.sandbox.error.ErrorTranslator;

/**
 * Runs invocations on a bounded worker pool while the calling thread supervises the time and memory budgets.
 *
 * <p>The caller polls its worker every {@code pollIntervalMs}. Once the timeout has elapsed since compile
 * start, or the allocation budget is exhausted, the state moves to a terminal failure and the context is
 * closed with cancellation, which stops guest code even inside a tight loop.</p>
 */
final class ExecutionController implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionController.class);
    private static final long TERMINATION_GRACE_MS = 2_000L;

    private final SandboxConfig config;
    private final ThreadPoolExecutor workers;
    private final AllocationMeter meter = new AllocationMeter();
    private final ErrorTranslator translator;

    ExecutionController(SandboxConfig config, ErrorTranslator translator) {
        this.config = config;
        this.translator = translator;
        this.workers = new ThreadPoolExecutor(
            config.workerThreads(),
            config.workerThreads(),
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            new WorkerThreadFactory()
        );
    }

    ScriptResult execute(Engine engine, Source bootstrap, PreparedInvocation invocation) {
        InvocationMonitor monitor = new InvocationMonitor();
        SandboxTask task = new SandboxTask(engine, bootstrap, invocation, monitor, meter, translator);
        Future<ExecutionOutcome> future;
        try {
            future = workers.submit(task);
        } catch (RejectedExecutionException ex) {
            return ScriptResult.failure(ErrorTag.SANDBOX_UNAVAILABLE, "Script sandbox is shutting down");
        }
        return supervise(future, monitor, invocation);
    }

    private ScriptResult supervise(Future<ExecutionOutcome> future, InvocationMonitor monitor, PreparedInvocation invocation) {
        while (true) {
            try {
                ExecutionOutcome outcome = future.get(config.pollIntervalMs(), TimeUnit.MILLISECONDS);
                return finish(outcome, monitor, invocation);
            } catch (TimeoutException pending) {
                ScriptResult stopped = check(future, monitor, invocation);
                if (stopped != null) {
                    return stopped;
                }
            } catch (ExecutionException failed) {
                monitor.interrupt(ExecutionState.FAILED);
                return ScriptResult.failure(translator.translate(failed.getCause()), invocation.console().snapshot(), monitor.executionMs());
            } catch (CancellationException cancelled) {
                return ScriptResult.failure(ErrorTag.SANDBOX_UNAVAILABLE, "Invocation was cancelled");
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                monitor.interrupt(ExecutionState.FAILED);
                monitor.handle().terminate();
                future.cancel(true);
                return ScriptResult.failure(ErrorTag.SANDBOX_UNAVAILABLE, "Invocation was interrupted");
            }
        }
    }

    /** One supervision tick. Returns the final result when the invocation had to be stopped, otherwise null. */
    private ScriptResult check(Future<ExecutionOutcome> future, InvocationMonitor monitor, PreparedInvocation invocation) {
        if (!monitor.workerStarted()) {
            if (monitor.queuedMs() > config.queueTimeoutMs() && future.cancel(false)) {
                LOG.warn("No sandbox worker became available within {}ms", config.queueTimeoutMs());
                return ScriptResult.failure(ErrorTag.SANDBOX_UNAVAILABLE, "No sandbox worker became available");
            }
            return null;
        }
        ExecutionState state = monitor.state();
        if (state == ExecutionState.CREATED) {
            if (monitor.setupMs() > config.setupTimeoutMs() && monitor.interrupt(ExecutionState.FAILED)) {
                LOG.warn("Sandbox context setup exceeded {}ms", config.setupTimeoutMs());
                stop(future, monitor);
                return ScriptResult.failure(ErrorTag.SANDBOX_UNAVAILABLE, "Sandbox context setup timed out");
            }
            return null;
        }
        if (state == ExecutionState.MEMORY_EXCEEDED) {
            // raised by the allocation guard on the worker; the script may have caught it and carried on
            long elapsedMs = monitor.executionMs();
            stop(future, monitor);
            return ScriptResult.failure(translator.terminated(ErrorTag.MEMORY_LIMIT_ERROR, config.memoryLimitBytes()),
                invocation.console().snapshot(), elapsedMs);
        }
        if (state.isTerminal()) {
            return null;
        }
        if (monitor.executionMs() >= invocation.timeoutMs()) {
            return terminate(future, monitor, invocation, ExecutionState.TIMED_OUT,
                translator.terminated(ErrorTag.TIMEOUT_ERROR, invocation.timeoutMs()));
        }
        if (meter.exceeds(monitor, config.memoryLimitBytes())) {
            return terminate(future, monitor, invocation, ExecutionState.MEMORY_EXCEEDED,
                translator.terminated(ErrorTag.MEMORY_LIMIT_ERROR, config.memoryLimitBytes()));
        }
        return null;
    }

    private ScriptResult terminate(Future<ExecutionOutcome> future, InvocationMonitor monitor, PreparedInvocation invocation,
                                   ExecutionState target, ScriptError error) {
        if (!monitor.interrupt(target)) {
            // the worker reached a terminal state first; its outcome wins
            return null;
        }
        long elapsedMs = monitor.executionMs();
        stop(future, monitor);
        return ScriptResult.failure(error, invocation.console().snapshot(), elapsedMs);
    }

    // force-close the context, then give the worker a bounded window to unwind
    private void stop(Future<ExecutionOutcome> future, InvocationMonitor monitor) {
        monitor.handle().terminate();
        try {
            future.get(TERMINATION_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            LOG.warn("Sandbox worker did not stop within {}ms after termination", TERMINATION_GRACE_MS);
            future.cancel(true);
        } catch (ExecutionException ex) {
            LOG.debug("Terminated sandbox worker ended with {}", ex.getCause().toString());
        } catch (CancellationException ex) {
            LOG.debug("Terminated sandbox worker was cancelled");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private ScriptResult finish(ExecutionOutcome outcome, InvocationMonitor monitor, PreparedInvocation invocation) {
        List<ConsoleEntry> logs = invocation.console().snapshot();
        int dropped = invocation.console().dropped();
        if (dropped > 0) {
            LOG.debug("Console capture full: dropped {} entries beyond the first {}", dropped, logs.size());
        }
        // a single large allocation can start and finish between two polls
        if (outcome.ok() && monitor.compileStarted() && meter.exceeds(monitor, config.memoryLimitBytes())) {
            return ScriptResult.failure(translator.terminated(ErrorTag.MEMORY_LIMIT_ERROR, config.memoryLimitBytes()), logs, monitor.executionMs());
        }
        ExecutionState state = monitor.state();
        if (state == ExecutionState.TIMED_OUT) {
            return ScriptResult.failure(translator.terminated(ErrorTag.TIMEOUT_ERROR, invocation.timeoutMs()), logs, monitor.executionMs());
        }
        if (state == ExecutionState.MEMORY_EXCEEDED) {
            return ScriptResult.failure(translator.terminated(ErrorTag.MEMORY_LIMIT_ERROR, config.memoryLimitBytes()), logs, monitor.executionMs());
        }
        if (outcome.ok()) {
            return ScriptResult.success(outcome.output(), logs, monitor.executionMs());
        }
        return ScriptResult.failure(outcome.error(), logs, monitor.executionMs());
    }

    @Override
    public void close() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Sandbox workers still running after shutdown");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "sandbox-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

package work.vaultlogic.sandbox.runtime;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared view of one invocation between its worker and the supervising caller thread.
 */
final class InvocationMonitor {
    private final AtomicReference<ExecutionState> state = new AtomicReference<>(ExecutionState.CREATED);
    private final IsolateHandle handle = new IsolateHandle();
    private final long submittedNanos = System.nanoTime();

    private volatile long workerThreadId = -1L;
    private volatile long setupStartNanos;
    private volatile long compileStartNanos;
    private volatile long finishNanos;
    private volatile long allocationBaseline = AllocationMeter.UNSUPPORTED;
    private volatile long heapFloor;
    private volatile long allocationAtFinish = AllocationMeter.UNSUPPORTED;
    private volatile long heapAtFinish;

    ExecutionState state() {
        return state.get();
    }

    IsolateHandle handle() {
        return handle;
    }

    boolean transition(ExecutionState from, ExecutionState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal transition " + from + " -> " + to);
        }
        return state.compareAndSet(from, to);
    }

    /** Moves any non-terminal state to {@code target}; false when a terminal state was reached first. */
    boolean interrupt(ExecutionState target) {
        while (true) {
            ExecutionState current = state.get();
            if (current.isTerminal() || !current.canTransitionTo(target)) {
                return false;
            }
            if (state.compareAndSet(current, target)) {
                return true;
            }
        }
    }

    void workerStarted(long threadId) {
        this.workerThreadId = threadId;
        this.setupStartNanos = System.nanoTime();
    }

    /** Records the clock and allocation baselines, then enters COMPILING. */
    boolean beginCompile(AllocationMeter meter) {
        allocationBaseline = meter.allocatedBytes(workerThreadId);
        heapFloor = meter.heapUsedBytes();
        compileStartNanos = System.nanoTime();
        return transition(ExecutionState.CREATED, ExecutionState.COMPILING);
    }

    /** Called on the worker thread before its context is released, so the samples still see guest data. */
    void finished(AllocationMeter meter) {
        if (finishNanos == 0L) {
            allocationAtFinish = meter.allocatedBytes(workerThreadId);
            heapAtFinish = meter.heapUsedBytes();
            finishNanos = System.nanoTime();
        }
    }

    boolean isFinished() {
        return finishNanos != 0L;
    }

    long allocationAtFinish() {
        return allocationAtFinish;
    }

    long heapAtFinish() {
        return heapAtFinish;
    }

    boolean workerStarted() {
        return setupStartNanos != 0L;
    }

    boolean compileStarted() {
        return compileStartNanos != 0L;
    }

    long workerThreadId() {
        return workerThreadId;
    }

    long allocationBaseline() {
        return allocationBaseline;
    }

    /** Lowers the heap floor to {@code usedBytes} when smaller and returns the floor. */
    long observeHeap(long usedBytes) {
        if (usedBytes < heapFloor) {
            heapFloor = usedBytes;
        }
        return heapFloor;
    }

    long queuedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - submittedNanos);
    }

    long setupMs() {
        return setupStartNanos == 0L ? 0L : TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - setupStartNanos);
    }

    /** Milliseconds since compile start; frozen once the invocation finished, 0 if it never compiled. */
    long executionMs() {
        long start = compileStartNanos;
        if (start == 0L) {
            return 0L;
        }
        long end = finishNanos == 0L ? System.nanoTime() : finishNanos;
        return TimeUnit.NANOSECONDS.toMillis(end - start);
    }
}

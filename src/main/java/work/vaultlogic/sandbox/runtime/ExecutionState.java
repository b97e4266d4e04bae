package work.vaultlogic.sandbox.runtime;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one invocation. Terminal states are final.
 */
public enum ExecutionState {
    CREATED,
    COMPILING,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMED_OUT,
    MEMORY_EXCEEDED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMED_OUT || this == MEMORY_EXCEEDED;
    }

    public boolean canTransitionTo(ExecutionState next) {
        return successors().contains(next);
    }

    private Set<ExecutionState> successors() {
        return switch (this) {
            case CREATED -> EnumSet.of(COMPILING, FAILED, TIMED_OUT, MEMORY_EXCEEDED);
            case COMPILING -> EnumSet.of(RUNNING, COMPLETED, FAILED, TIMED_OUT, MEMORY_EXCEEDED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, TIMED_OUT, MEMORY_EXCEEDED);
            default -> EnumSet.noneOf(ExecutionState.class);
        };
    }
}

package work.vaultlogic.sandbox.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ExecutionStateTest {
    @Test
    void happyPathTransitions() {
        assertTrue(ExecutionState.CREATED.canTransitionTo(ExecutionState.COMPILING));
        assertTrue(ExecutionState.COMPILING.canTransitionTo(ExecutionState.RUNNING));
        assertTrue(ExecutionState.RUNNING.canTransitionTo(ExecutionState.COMPLETED));
    }

    @Test
    void terminalStatesAreFinal() {
        for (ExecutionState terminal : new ExecutionState[] {
            ExecutionState.COMPLETED, ExecutionState.FAILED, ExecutionState.TIMED_OUT, ExecutionState.MEMORY_EXCEEDED}) {
            assertTrue(terminal.isTerminal());
            for (ExecutionState next : ExecutionState.values()) {
                assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
            }
        }
    }

    @Test
    void cannotSkipBackwards() {
        assertFalse(ExecutionState.RUNNING.canTransitionTo(ExecutionState.COMPILING));
        assertFalse(ExecutionState.CREATED.canTransitionTo(ExecutionState.RUNNING));
    }

    @Test
    void monitorTransitionsByCompareAndSet() {
        var monitor = new InvocationMonitor();
        assertTrue(monitor.transition(ExecutionState.CREATED, ExecutionState.COMPILING));
        assertFalse(monitor.transition(ExecutionState.CREATED, ExecutionState.COMPILING));
        assertThrows(IllegalStateException.class, () -> monitor.transition(ExecutionState.COMPLETED, ExecutionState.RUNNING));
    }

    @Test
    void firstTerminalStateWins() {
        var monitor = new InvocationMonitor();
        monitor.transition(ExecutionState.CREATED, ExecutionState.COMPILING);
        monitor.transition(ExecutionState.COMPILING, ExecutionState.RUNNING);
        assertTrue(monitor.interrupt(ExecutionState.TIMED_OUT));
        assertFalse(monitor.interrupt(ExecutionState.COMPLETED));
        assertFalse(monitor.interrupt(ExecutionState.MEMORY_EXCEEDED));
        assertEquals(ExecutionState.TIMED_OUT, monitor.state());
    }

    @Test
    void executionTimeIsZeroBeforeCompile() {
        var monitor = new InvocationMonitor();
        assertEquals(0L, monitor.executionMs());
        assertFalse(monitor.compileStarted());
    }
}

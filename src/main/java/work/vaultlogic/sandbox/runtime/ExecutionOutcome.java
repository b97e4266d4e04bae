package work.vaultlogic.sandbox.runtime;

import work.vaultlogic.sandbox.api.ScriptError;

/**
 * What the worker produced: an output value or a classified error.
 */
record ExecutionOutcome(Object output, ScriptError error) {
    static ExecutionOutcome success(Object output) {
        return new ExecutionOutcome(output, null);
    }

    static ExecutionOutcome failure(ScriptError error) {
        return new ExecutionOutcome(null, error);
    }

    boolean ok() {
        return error == null;
    }
}

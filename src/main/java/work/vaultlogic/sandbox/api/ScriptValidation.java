package work.vaultlogic.sandbox.api;

import java.util.Optional;

/**
 * Result of a compile-only check of a script body.
 */
public record ScriptValidation(boolean valid, ScriptError error) {
    public static ScriptValidation ok() {
        return new ScriptValidation(true, null);
    }

    public static ScriptValidation invalid(ScriptError error) {
        return new ScriptValidation(false, error);
    }

    public Optional<ScriptError> errorIfAny() {
        return Optional.ofNullable(error);
    }
}

package work.vaultlogic.sandbox.helpers;

import work.vaultlogic.sandbox.api.ErrorTag;
import work.vaultlogic.sandbox.error.ScriptFailure;

/**
 * Bad arguments passed to a helper. Surfaces to the caller as a {@code RuntimeError}.
 */
public class HelperException extends ScriptFailure {
    public HelperException(String message) {
        super(ErrorTag.RUNTIME_ERROR, message);
    }
}

package work.vaultlogic.sandbox.marshal;

import work.vaultlogic.sandbox.api.ErrorTag;
import work.vaultlogic.sandbox.error.ScriptFailure;

/**
 * Raised when a value cannot cross the sandbox boundary in either direction.
 */
public class MarshallingException extends ScriptFailure {
    public MarshallingException(String message) {
        super(ErrorTag.MARSHALLING_ERROR, message);
    }

    public MarshallingException(String message, Throwable cause) {
        super(ErrorTag.MARSHALLING_ERROR, message, cause);
    }
}

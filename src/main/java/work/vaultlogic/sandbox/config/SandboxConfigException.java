package work.vaultlogic.sandbox.config;

/**
 * Invalid or unreadable sandbox configuration.
 */
public final class SandboxConfigException extends RuntimeException {
    public SandboxConfigException(String message) {
        super(message);
    }

    public SandboxConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

package work.vaultlogic.sandbox.error;

import java.util.Objects;
import work.vaultlogic.sandbox.api.ErrorTag;

/**
 * Exception carrying a taxonomy tag. Thrown inside the engine and turned into data at the boundary.
 */
public class ScriptFailure extends RuntimeException {
    private final ErrorTag tag;

    public ScriptFailure(ErrorTag tag, String message) {
        super(message);
        this.tag = Objects.requireNonNull(tag, "tag");
    }

    public ScriptFailure(ErrorTag tag, String message, Throwable cause) {
        super(message, cause);
        this.tag = Objects.requireNonNull(tag, "tag");
    }

    public ErrorTag tag() {
        return tag;
    }
}

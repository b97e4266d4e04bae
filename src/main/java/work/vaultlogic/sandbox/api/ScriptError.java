package work.vaultlogic.sandbox.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Classified failure: taxonomy tag plus a sanitized, user-presentable message.
 */
public record ScriptError(ErrorTag tag, String message) {
    public ScriptError {
        Objects.requireNonNull(tag, "tag");
        message = message == null ? "" : message;
    }

    public boolean retryable() {
        return tag.retryable();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("tag", tag.label());
        map.put("message", message);
        map.put("retryable", tag.retryable());
        return map;
    }

    @Override
    public String toString() {
        return tag.label() + ": " + message;
    }
}

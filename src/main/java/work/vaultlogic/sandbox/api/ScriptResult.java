package work.vaultlogic.sandbox.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a single sandbox invocation. Failures are data: {@code ok=false} plus a classified {@link ScriptError}.
 */
public record ScriptResult(
    boolean ok,
    Object output,
    ScriptError error,
    List<ConsoleEntry> consoleLogs,
    long executionTimeMs
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ScriptResult {
        consoleLogs = consoleLogs == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(consoleLogs));
        executionTimeMs = Math.max(0L, executionTimeMs);
        if (ok && error != null) {
            throw new IllegalArgumentException("Successful result cannot carry an error");
        }
        if (!ok && error == null) {
            throw new IllegalArgumentException("Failed result requires an error");
        }
        if (!ok) {
            output = null;
        }
    }

    public static ScriptResult success(Object output, List<ConsoleEntry> consoleLogs, long executionTimeMs) {
        return new ScriptResult(true, output, null, consoleLogs, executionTimeMs);
    }

    public static ScriptResult failure(ScriptError error, List<ConsoleEntry> consoleLogs, long executionTimeMs) {
        return new ScriptResult(false, null, error, consoleLogs, executionTimeMs);
    }

    public static ScriptResult failure(ErrorTag tag, String message) {
        return failure(new ScriptError(tag, message), List.of(), 0L);
    }

    public Optional<ErrorTag> errorTag() {
        return error == null ? Optional.empty() : Optional.of(error.tag());
    }

    /** True when the failure is an infrastructure fault the caller may retry. */
    public boolean retryable() {
        return error != null && error.retryable();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("ok", ok);
        if (ok) {
            serializable.put("output", output);
        } else {
            serializable.put("error", error.toSerializableMap());
        }
        List<Map<String, Object>> logs = new ArrayList<>(consoleLogs.size());
        for (ConsoleEntry entry : consoleLogs) {
            logs.add(entry.toSerializableMap());
        }
        serializable.put("consoleLogs", logs);
        serializable.put("executionTimeMs", executionTimeMs);
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"ok\":false,\"error\":{\"tag\":\"MarshallingError\",\"message\":\"Result is not serializable\"}}";
        }
    }
}

package work.vaultlogic.sandbox.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whitelists run data going into a script and script output flowing back into run data.
 */
public final class DataProjection {
    private DataProjection() {}

    /**
     * Builds a script input from run data keyed by step id. Each input key is resolved through
     * {@code aliasMap} (alias to step id) first, then looked up directly. Missing keys are left out.
     */
    public static Map<String, Object> selectInput(Map<String, ?> data, List<String> inputKeys, Map<String, String> aliasMap) {
        Map<String, Object> input = new LinkedHashMap<>();
        if (data == null || inputKeys == null) {
            return input;
        }
        Map<String, String> aliases = aliasMap == null ? Map.of() : aliasMap;
        for (String key : inputKeys) {
            if (key == null || key.isBlank()) continue;
            String stepId = aliases.get(key);
            if (stepId != null && data.containsKey(stepId)) {
                input.put(key, data.get(stepId));
            } else if (data.containsKey(key)) {
                input.put(key, data.get(key));
            }
        }
        return input;
    }

    /**
     * Merges a script output into a copy of {@code data}, keeping only keys listed in {@code outputKeys}.
     * Outputs that are not objects merge nothing.
     */
    public static MergeResult mergeOutput(Map<String, ?> data, Object output, List<String> outputKeys) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (data != null) {
            merged.putAll(data);
        }
        List<String> rejected = new ArrayList<>();
        if (!(output instanceof Map<?, ?> map) || outputKeys == null) {
            return new MergeResult(merged, rejected);
        }
        for (var entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (outputKeys.contains(key)) {
                merged.put(key, entry.getValue());
            } else {
                rejected.add(key);
            }
        }
        return new MergeResult(merged, rejected);
    }

    /** Merged run data plus output keys that were dropped for not being whitelisted. */
    public record MergeResult(Map<String, Object> data, List<String> rejectedKeys) {
        public MergeResult {
            data = Collections.unmodifiableMap(data);
            rejectedKeys = List.copyOf(rejectedKeys);
        }
    }
}

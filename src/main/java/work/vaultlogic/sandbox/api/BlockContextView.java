package work.vaultlogic.sandbox.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only execution metadata handed to a script as {@code context}. Produced by the workflow runner.
 */
public record BlockContextView(
    String workflowId,
    String runId,
    String phase,
    Optional<String> sectionId,
    Optional<String> userId,
    Map<String, Object> answers,
    Map<String, Object> metadata
) {
    public BlockContextView {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(sectionId, "sectionId");
        Objects.requireNonNull(userId, "userId");
        answers = answers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(answers));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static BlockContextView empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shape seen by scripts: {@code {workflow:{id}, run:{id}, phase, section?:{id}, user?:{id}, answers, metadata}}.
     */
    public Map<String, Object> toScriptContext() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("workflow", Map.of("id", workflowId));
        view.put("run", Map.of("id", runId));
        view.put("phase", phase);
        sectionId.ifPresent(id -> view.put("section", Map.of("id", id)));
        userId.ifPresent(id -> view.put("user", Map.of("id", id)));
        view.put("answers", answers);
        view.put("metadata", metadata);
        return view;
    }

    /**
     * Reads either the flat form ({@code workflowId}, {@code runId}, ...) or the script shape.
     */
    public static BlockContextView fromMap(Map<?, ?> raw) {
        Builder builder = builder();
        if (raw == null) {
            return builder.build();
        }
        builder.workflowId(firstString(raw.get("workflowId"), nestedId(raw.get("workflow"))));
        builder.runId(firstString(raw.get("runId"), nestedId(raw.get("run"))));
        builder.phase(firstString(raw.get("phase"), null));
        builder.sectionId(firstString(raw.get("sectionId"), nestedId(raw.get("section"))));
        builder.userId(firstString(raw.get("userId"), nestedId(raw.get("user"))));
        builder.answers(stringKeyed(raw.get("answers")));
        builder.metadata(stringKeyed(raw.get("metadata")));
        return builder.build();
    }

    private static String nestedId(Object value) {
        if (value instanceof Map<?, ?> map && map.get("id") != null) {
            return String.valueOf(map.get("id"));
        }
        return null;
    }

    private static String firstString(Object primary, String fallback) {
        if (primary != null && !String.valueOf(primary).isBlank()) {
            return String.valueOf(primary);
        }
        return fallback;
    }

    private static Map<String, Object> stringKeyed(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    public static final class Builder {
        private String workflowId = "";
        private String runId = "";
        private String phase = "";
        private String sectionId;
        private String userId;
        private Map<String, Object> answers = Map.of();
        private Map<String, Object> metadata = Map.of();

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId == null ? "" : workflowId;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId == null ? "" : runId;
            return this;
        }

        public Builder phase(String phase) {
            this.phase = phase == null ? "" : phase;
            return this;
        }

        public Builder sectionId(String sectionId) {
            this.sectionId = sectionId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder answers(Map<String, Object> answers) {
            this.answers = answers;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public BlockContextView build() {
            return new BlockContextView(
                workflowId,
                runId,
                phase,
                Optional.ofNullable(sectionId).filter(id -> !id.isBlank()),
                Optional.ofNullable(userId).filter(id -> !id.isBlank()),
                answers,
                metadata
            );
        }
    }
}

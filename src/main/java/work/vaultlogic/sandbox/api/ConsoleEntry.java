package work.vaultlogic.sandbox.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One captured {@code console.*} call. Arguments are already marshalled out of the sandbox.
 */
public record ConsoleEntry(ConsoleLevel level, List<Object> args) {
    private static final ObjectMapper JSON = new ObjectMapper();

    public ConsoleEntry {
        Objects.requireNonNull(level, "level");
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    /** Arguments rendered as a JSON array. */
    public String serializedArgs() {
        try {
            return JSON.writeValueAsString(args);
        } catch (JsonProcessingException ex) {
            return String.valueOf(args);
        }
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("level", level.memberName());
        map.put("args", args);
        return map;
    }
}

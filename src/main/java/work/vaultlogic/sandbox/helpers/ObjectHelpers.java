package work.vaultlogic.sandbox.helpers;

import static work.vaultlogic.sandbox.helpers.HelperArgs.jsString;
import static work.vaultlogic.sandbox.helpers.HelperArgs.list;
import static work.vaultlogic.sandbox.helpers.HelperArgs.object;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code helpers.object}: keys, values, pick, omit and shallow merge.
 */
public final class ObjectHelpers {
    private ObjectHelpers() {}

    public static HelperLibrary.Builder register(HelperLibrary.Builder builder) {
        builder.register(HelperNamespace.OBJECT, "keys", args -> new ArrayList<>(object(args, 0, "object.keys").keySet()));
        builder.register(HelperNamespace.OBJECT, "values", args -> new ArrayList<>(object(args, 0, "object.values").values()));
        builder.register(HelperNamespace.OBJECT, "pick", ObjectHelpers::pick);
        builder.register(HelperNamespace.OBJECT, "omit", ObjectHelpers::omit);
        builder.register(HelperNamespace.OBJECT, "merge", ObjectHelpers::merge);
        return builder;
    }

    private static Object pick(List<Object> args) {
        Map<String, Object> source = object(args, 0, "object.pick");
        Map<String, Object> picked = new LinkedHashMap<>();
        for (Object key : list(args, 1, "object.pick")) {
            String name = jsString(key);
            if (source.containsKey(name)) {
                picked.put(name, source.get(name));
            }
        }
        return picked;
    }

    private static Object omit(List<Object> args) {
        Map<String, Object> result = new LinkedHashMap<>(object(args, 0, "object.omit"));
        for (Object key : list(args, 1, "object.omit")) {
            result.remove(jsString(key));
        }
        return result;
    }

    private static Object merge(List<Object> args) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Object arg : args) {
            if (arg instanceof Map<?, ?> map) {
                map.forEach((k, v) -> merged.put(String.valueOf(k), v));
            }
        }
        return merged;
    }
}

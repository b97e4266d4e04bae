package work.vaultlogic.sandbox.helpers;

import static work.vaultlogic.sandbox.helpers.HelperArgs.integer;
import static work.vaultlogic.sandbox.helpers.HelperArgs.list;
import static work.vaultlogic.sandbox.helpers.HelperArgs.string;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * {@code helpers.array}: unique, deep flatten, chunk and sortBy. Callback-taking helpers are left to native array methods.
 */
public final class ArrayHelpers {
    private static final Comparator<Object> SORT_KEY_ORDER = ArrayHelpers::compareKeys;

    private ArrayHelpers() {}

    public static HelperLibrary.Builder register(HelperLibrary.Builder builder) {
        builder.register(HelperNamespace.ARRAY, "unique", args -> new ArrayList<>(new LinkedHashSet<>(list(args, 0, "array.unique"))));
        builder.register(HelperNamespace.ARRAY, "flatten", args -> flatten(list(args, 0, "array.flatten"), new ArrayList<>()));
        builder.register(HelperNamespace.ARRAY, "chunk", ArrayHelpers::chunk);
        builder.register(HelperNamespace.ARRAY, "sortBy", ArrayHelpers::sortBy);
        return builder;
    }

    private static List<Object> flatten(List<?> items, List<Object> out) {
        for (Object item : items) {
            if (item instanceof List<?> nested) {
                flatten(nested, out);
            } else {
                out.add(item);
            }
        }
        return out;
    }

    private static Object chunk(List<Object> args) {
        List<Object> items = list(args, 0, "array.chunk");
        int size = integer(args, 1, "array.chunk");
        if (size <= 0) {
            throw new HelperException("array.chunk: size must be a positive integer");
        }
        List<List<Object>> chunks = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            chunks.add(new ArrayList<>(items.subList(i, Math.min(items.size(), i + size))));
        }
        return chunks;
    }

    private static Object sortBy(List<Object> args) {
        List<Object> items = new ArrayList<>(list(args, 0, "array.sortBy"));
        String key = string(args, 1, "array.sortBy");
        items.sort(Comparator.comparing(item -> item instanceof Map<?, ?> map ? map.get(key) : null, SORT_KEY_ORDER));
        return items;
    }

    // numbers, then strings, then everything else; missing keys last
    private static int compareKeys(Object left, Object right) {
        int rank = Integer.compare(rank(left), rank(right));
        if (rank != 0) {
            return rank;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        if (left instanceof Boolean a && right instanceof Boolean b) {
            return Boolean.compare(a, b);
        }
        return 0;
    }

    private static int rank(Object value) {
        if (value instanceof Number) return 0;
        if (value instanceof String) return 1;
        if (value instanceof Boolean) return 2;
        if (value == null) return 4;
        return 3;
    }
}

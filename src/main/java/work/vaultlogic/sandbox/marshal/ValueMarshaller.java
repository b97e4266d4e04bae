package work.vaultlogic.sandbox.marshal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Value;

/**
 * Moves values across the sandbox boundary.
 *
 * <p>Host values are normalized to a canonical JSON tree, serialized with Jackson and re-parsed inside the
 * guest, so the script always receives a deep copy. Guest values are walked through the polyglot
 * {@link Value} API and rebuilt as plain host maps, lists and scalars.</p>
 */
public final class ValueMarshaller {
    public static final int MAX_DEPTH = 64;
    private static final String PLAIN_OBJECT = "Object";

    private static final ObjectMapper JSON = new ObjectMapper();

    private ValueMarshaller() {
    }

    /**
     * Converts a host value to the canonical tree: {@code null}, {@link Boolean}, {@link Number}, {@link String},
     * {@link List} and {@link LinkedHashMap} with string keys.
     */
    public static Object normalize(Object value) {
        return normalize(value, Collections.newSetFromMap(new IdentityHashMap<>()), 0);
    }

    private static Object normalize(Object value, Set<Object> ancestors, int depth) {
        if (depth > MAX_DEPTH) {
            throw new MarshallingException("Value nesting exceeds " + MAX_DEPTH + " levels");
        }
        if (value == null) {
            return null;
        }
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof CharSequence || value instanceof Character || value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof Number number) {
            return normalizeNumber(number);
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof Optional<?> optional) {
            return normalize(optional.orElse(null), ancestors, depth);
        }
        String temporal = temporalText(value);
        if (temporal != null) {
            return temporal;
        }
        if (value instanceof JsonNode node) {
            return normalize(JSON.convertValue(node, Object.class), ancestors, depth);
        }
        if (isFunctional(value)) {
            throw new MarshallingException("Functions cannot cross the sandbox boundary");
        }
        if (value instanceof Map<?, ?> map) {
            enter(value, ancestors);
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(keyOf(entry.getKey()), normalize(entry.getValue(), ancestors, depth + 1));
            }
            ancestors.remove(value);
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            enter(value, ancestors);
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(normalize(item, ancestors, depth + 1));
            }
            ancestors.remove(value);
            return copy;
        }
        if (value.getClass().isArray()) {
            enter(value, ancestors);
            int length = Array.getLength(value);
            List<Object> copy = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                copy.add(normalize(Array.get(value, i), ancestors, depth + 1));
            }
            ancestors.remove(value);
            return copy;
        }
        throw new MarshallingException("Unsupported value of type " + value.getClass().getSimpleName() + " cannot cross the sandbox boundary");
    }

    private static Object normalizeNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d) ? null : number;
        }
        if (number instanceof Byte || number instanceof Short) {
            return number.intValue();
        }
        if (number instanceof Integer || number instanceof Long || number instanceof BigInteger || number instanceof BigDecimal) {
            return number;
        }
        double d = number.doubleValue();
        return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
    }

    private static String temporalText(Object value) {
        if (value instanceof Instant || value instanceof LocalDate || value instanceof LocalDateTime
            || value instanceof LocalTime || value instanceof OffsetDateTime || value instanceof OffsetTime) {
            return value.toString();
        }
        if (value instanceof ZonedDateTime zoned) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(zoned);
        }
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        return null;
    }

    private static boolean isFunctional(Object value) {
        if (value instanceof Function<?, ?> || value instanceof Supplier<?> || value instanceof Consumer<?>
            || value instanceof Runnable || value instanceof Callable<?>) {
            return true;
        }
        Class<?> type = value.getClass();
        return type.isSynthetic() || type.getName().contains("$$Lambda");
    }

    private static String keyOf(Object key) {
        if (key instanceof String text) {
            return text;
        }
        if (key instanceof CharSequence || key instanceof Number || key instanceof Boolean
            || key instanceof Character || key instanceof Enum<?> || key instanceof UUID) {
            return key instanceof Enum<?> constant ? constant.name() : key.toString();
        }
        String type = key == null ? "null" : key.getClass().getSimpleName();
        throw new MarshallingException("Map keys must be strings or scalars, got " + type);
    }

    /**
     * Null for plain objects (constructor {@code Object}, or none as with {@code Object.create(null)}),
     * otherwise the constructor name: {@code Map}, {@code Set}, {@code Promise}, {@code Error}, class instances.
     */
    private static String objectKind(Value value) {
        Value meta = value.getMetaObject();
        if (meta == null) {
            return null;
        }
        String name = meta.getMetaQualifiedName();
        return PLAIN_OBJECT.equals(name) ? null : name;
    }

    private static void enter(Object value, Set<Object> ancestors) {
        if (!ancestors.add(value)) {
            throw new MarshallingException("Circular reference cannot cross the sandbox boundary");
        }
    }

    /** JSON text of a host value after normalization. */
    public static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(normalize(value));
        } catch (JsonProcessingException ex) {
            throw new MarshallingException("Value is not JSON-serializable", ex);
        }
    }

    /** Length of the JSON text of a host value; used for boundary size limits. */
    public static int jsonLength(Object value) {
        return toJson(value).length();
    }

    /** Deep-copies a host value into the guest using the given guest {@code JSON.parse}. */
    public static Value marshalIn(Value jsonParse, Object value) {
        return jsonParse.execute(toJson(value));
    }

    public static Value marshalIn(Context context, Object value) {
        return marshalIn(context.eval("js", "JSON.parse"), value);
    }

    /**
     * Rebuilds a guest value as host data. Integral numbers come back as {@link Integer} or {@link Long},
     * others as {@link Double}; {@code undefined} and non-finite numbers become {@code null}.
     *
     * <p>A round trip is equal in JSON terms, not in Java types: {@code 2.0} comes back as {@code Integer 2}
     * and {@code 5L} as {@code Integer 5}. Only arrays and plain objects are copied; {@code Map}, {@code Set},
     * {@code Promise}, {@code RegExp}, errors and class instances are rejected.</p>
     */
    public static Object marshalOut(Value value) {
        return marshalOut(value, new ArrayList<>(), 0);
    }

    private static Object marshalOut(Value value, List<Value> ancestors, int depth) {
        if (depth > MAX_DEPTH) {
            throw new MarshallingException("Value nesting exceeds " + MAX_DEPTH + " levels (circular reference?)");
        }
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isString()) {
            return value.asString();
        }
        if (value.isNumber()) {
            if (value.fitsInInt()) return value.asInt();
            if (value.fitsInLong()) return value.asLong();
            if (value.fitsInDouble()) {
                double d = value.asDouble();
                return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
            }
            throw new MarshallingException("Number cannot be represented outside the sandbox");
        }
        if (value.isInstant()) {
            return value.asInstant().toString();
        }
        if (value.canExecute() || value.canInstantiate()) {
            throw new MarshallingException("Functions cannot cross the sandbox boundary");
        }
        if (value.hasArrayElements()) {
            enter(value, ancestors);
            long size = value.getArraySize();
            List<Object> list = new ArrayList<>((int) Math.min(size, 1024));
            for (long i = 0; i < size; i++) {
                list.add(marshalOut(value.getArrayElement(i), ancestors, depth + 1));
            }
            ancestors.remove(ancestors.size() - 1);
            return list;
        }
        if (value.isHostObject() || value.isProxyObject()) {
            throw new MarshallingException("Host objects cannot cross the sandbox boundary");
        }
        if (value.hasMembers() && !value.isMetaObject()) {
            String kind = objectKind(value);
            if (kind != null) {
                throw new MarshallingException("Value of type " + kind + " cannot cross the sandbox boundary");
            }
            enter(value, ancestors);
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys()) {
                map.put(key, marshalOut(value.getMember(key), ancestors, depth + 1));
            }
            ancestors.remove(ancestors.size() - 1);
            return map;
        }
        throw new MarshallingException("Value of this kind cannot cross the sandbox boundary");
    }

    private static void enter(Value value, List<Value> ancestors) {
        for (Value ancestor : ancestors) {
            if (ancestor.equals(value)) {
                throw new MarshallingException("Circular reference cannot cross the sandbox boundary");
            }
        }
        ancestors.add(value);
    }
}

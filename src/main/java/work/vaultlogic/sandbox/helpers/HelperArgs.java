package work.vaultlogic.sandbox.helpers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Argument coercion shared by the helper namespaces.
 */
final class HelperArgs {
    private HelperArgs() {}

    static Object arg(List<Object> args, int index) {
        return args != null && index < args.size() ? args.get(index) : null;
    }

    static boolean present(List<Object> args, int index) {
        return arg(args, index) != null;
    }

    static String string(List<Object> args, int index, String helper) {
        Object value = arg(args, index);
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return jsString(value);
        }
        throw new HelperException(helper + ": argument " + (index + 1) + " must be a string");
    }

    static String string(List<Object> args, int index, String helper, String fallback) {
        return present(args, index) ? string(args, index, helper) : fallback;
    }

    static double number(List<Object> args, int index, String helper) {
        Object value = arg(args, index);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new HelperException(helper + ": argument " + (index + 1) + " must be a number");
    }

    static double number(List<Object> args, int index, String helper, double fallback) {
        return present(args, index) ? number(args, index, helper) : fallback;
    }

    static int integer(List<Object> args, int index, String helper) {
        double value = number(args, index, helper);
        if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
            throw new HelperException(helper + ": argument " + (index + 1) + " must be an integer");
        }
        return (int) value;
    }

    static int integer(List<Object> args, int index, String helper, int fallback) {
        return present(args, index) ? integer(args, index, helper) : fallback;
    }

    static List<Object> list(List<Object> args, int index, String helper) {
        Object value = arg(args, index);
        if (value instanceof List<?> list) {
            return new ArrayList<Object>(list);
        }
        throw new HelperException(helper + ": argument " + (index + 1) + " must be an array");
    }

    static Map<String, Object> object(List<Object> args, int index, String helper) {
        Object value = arg(args, index);
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, entry) -> copy.put(String.valueOf(key), entry));
            return copy;
        }
        throw new HelperException(helper + ": argument " + (index + 1) + " must be an object");
    }

    /** Narrows a double to Integer or Long when it is integral, the way a script sees numbers. */
    static Number numeric(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)
            || (value == 0.0 && 1 / value < 0)) {
            return value;
        }
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return (int) value;
        }
        if (Math.abs(value) <= 9_007_199_254_740_992d) {
            return (long) value;
        }
        return value;
    }

    /** String conversion matching how a script would print the value. */
    static String jsString(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d) {
            Number narrowed = numeric(d);
            if (narrowed instanceof Double) {
                return Double.isNaN(d) ? "NaN" : Double.isInfinite(d) ? (d > 0 ? "Infinity" : "-Infinity") : d.toString();
            }
            return narrowed.toString();
        }
        if (value instanceof Map<?, ?>) {
            return "[object Object]";
        }
        if (value instanceof List<?> list) {
            StringBuilder builder = new StringBuilder();
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    builder.append(',');
                }
                builder.append(jsString(list.get(i)));
            }
            return builder.toString();
        }
        return String.valueOf(value);
    }
}

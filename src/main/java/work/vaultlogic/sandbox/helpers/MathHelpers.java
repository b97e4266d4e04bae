package work.vaultlogic.sandbox.helpers;

import static work.vaultlogic.sandbox.helpers.HelperArgs.list;
import static work.vaultlogic.sandbox.helpers.HelperArgs.number;
import static work.vaultlogic.sandbox.helpers.HelperArgs.numeric;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@code helpers.math}: aggregates over numeric arrays plus random numbers.
 */
public final class MathHelpers {
    private MathHelpers() {}

    public static HelperLibrary.Builder register(HelperLibrary.Builder builder) {
        builder.register(HelperNamespace.MATH, "sum", args -> numeric(sum(numbers(args, "math.sum"))));
        builder.register(HelperNamespace.MATH, "avg", MathHelpers::avg);
        builder.register(HelperNamespace.MATH, "min", args -> extreme(numbers(args, "math.min"), true));
        builder.register(HelperNamespace.MATH, "max", args -> extreme(numbers(args, "math.max"), false));
        builder.register(HelperNamespace.MATH, "random", MathHelpers::random);
        builder.register(HelperNamespace.MATH, "randomInt", MathHelpers::randomInt);
        return builder;
    }

    private static double[] numbers(List<Object> args, String helper) {
        List<Object> items = list(args, 0, helper);
        double[] values = new double[items.size()];
        for (int i = 0; i < values.length; i++) {
            if (!(items.get(i) instanceof Number number)) {
                throw new HelperException(helper + ": element " + i + " is not a number");
            }
            values[i] = number.doubleValue();
        }
        return values;
    }

    private static double sum(double[] values) {
        double total = 0;
        for (double value : values) {
            total += value;
        }
        return total;
    }

    private static Object avg(List<Object> args) {
        double[] values = numbers(args, "math.avg");
        return values.length == 0 ? 0 : numeric(sum(values) / values.length);
    }

    private static Object extreme(double[] values, boolean min) {
        if (values.length == 0) {
            return null;
        }
        double best = values[0];
        for (double value : values) {
            best = min ? Math.min(best, value) : Math.max(best, value);
        }
        return numeric(best);
    }

    private static Object random(List<Object> args) {
        double min = number(args, 0, "math.random", 0);
        double max = number(args, 1, "math.random", 1);
        return ThreadLocalRandom.current().nextDouble() * (max - min) + min;
    }

    private static Object randomInt(List<Object> args) {
        double min = Math.ceil(number(args, 0, "math.randomInt"));
        double max = Math.floor(number(args, 1, "math.randomInt"));
        if (max < min) {
            throw new HelperException("math.randomInt: max must not be less than min");
        }
        return numeric(Math.floor(ThreadLocalRandom.current().nextDouble() * (max - min + 1)) + min);
    }
}

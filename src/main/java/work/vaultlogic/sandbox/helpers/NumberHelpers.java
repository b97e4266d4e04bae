package work.vaultlogic.sandbox.helpers;

import static work.vaultlogic.sandbox.helpers.HelperArgs.arg;
import static work.vaultlogic.sandbox.helpers.HelperArgs.integer;
import static work.vaultlogic.sandbox.helpers.HelperArgs.number;
import static work.vaultlogic.sandbox.helpers.HelperArgs.numeric;
import static work.vaultlogic.sandbox.helpers.HelperArgs.string;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Currency;
import java.util.List;
import java.util.Locale;

/**
 * {@code helpers.number}: rounding, clamping and en-US currency/percent formatting.
 */
public final class NumberHelpers {
    private static final int MAX_DECIMALS = 100;

    private NumberHelpers() {}

    public static HelperLibrary.Builder register(HelperLibrary.Builder builder) {
        builder.register(HelperNamespace.NUMBER, "round", NumberHelpers::round);
        builder.register(HelperNamespace.NUMBER, "ceil", args -> numeric(Math.ceil(number(args, 0, "number.ceil"))));
        builder.register(HelperNamespace.NUMBER, "floor", args -> numeric(Math.floor(number(args, 0, "number.floor"))));
        builder.register(HelperNamespace.NUMBER, "abs", args -> numeric(Math.abs(number(args, 0, "number.abs"))));
        builder.register(HelperNamespace.NUMBER, "clamp", NumberHelpers::clamp);
        builder.register(HelperNamespace.NUMBER, "currency", NumberHelpers::currency);
        builder.register(HelperNamespace.NUMBER, "formatCurrency", NumberHelpers::currency);
        builder.register(HelperNamespace.NUMBER, "percent", NumberHelpers::percent);
        return builder;
    }

    private static Object round(List<Object> args) {
        if (!(arg(args, 0) instanceof Number)) {
            return Double.NaN;
        }
        double value = number(args, 0, "number.round");
        int decimals = decimals(args, 1, 0, "number.round");
        return numeric(fixed(value, decimals).doubleValue());
    }

    private static Object clamp(List<Object> args) {
        double value = number(args, 0, "number.clamp");
        double min = number(args, 1, "number.clamp");
        double max = number(args, 2, "number.clamp");
        return numeric(Math.max(min, Math.min(max, value)));
    }

    private static Object currency(List<Object> args) {
        double value = number(args, 0, "number.currency");
        String code = string(args, 1, "number.currency", "USD");
        NumberFormat format = NumberFormat.getCurrencyInstance(Locale.US);
        try {
            Currency currency = Currency.getInstance(code.toUpperCase(Locale.ROOT));
            format.setCurrency(currency);
            format.setMinimumFractionDigits(currency.getDefaultFractionDigits());
            format.setMaximumFractionDigits(currency.getDefaultFractionDigits());
        } catch (IllegalArgumentException ex) {
            throw new HelperException("number.currency: invalid currency code " + code);
        }
        return format.format(value);
    }

    private static Object percent(List<Object> args) {
        double value = number(args, 0, "number.percent");
        int decimals = decimals(args, 1, 2, "number.percent");
        return fixed(value * 100, decimals).toPlainString() + "%";
    }

    private static int decimals(List<Object> args, int index, int fallback, String helper) {
        int decimals = integer(args, index, helper, fallback);
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new HelperException(helper + ": decimals must be between 0 and " + MAX_DECIMALS);
        }
        return decimals;
    }

    /** Fixed-point rendering of the exact binary value, like {@code Number.prototype.toFixed}. */
    static BigDecimal fixed(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new HelperException("value must be a finite number");
        }
        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_UP);
    }
}

package work.vaultlogic.sandbox.helpers;

import static work.vaultlogic.sandbox.helpers.HelperArgs.arg;
import static work.vaultlogic.sandbox.helpers.HelperArgs.integer;
import static work.vaultlogic.sandbox.helpers.HelperArgs.jsString;
import static work.vaultlogic.sandbox.helpers.HelperArgs.list;
import static work.vaultlogic.sandbox.helpers.HelperArgs.string;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * {@code helpers.string}: case, trimming, literal replace, split/join and slug helpers.
 */
public final class StringHelpers {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9-]");

    private StringHelpers() {}

    public static HelperLibrary.Builder register(HelperLibrary.Builder builder) {
        builder.register(HelperNamespace.STRING, "upper", StringHelpers::upper);
        builder.register(HelperNamespace.STRING, "lower", args -> string(args, 0, "string.lower").toLowerCase(Locale.ROOT));
        builder.register(HelperNamespace.STRING, "trim", args -> string(args, 0, "string.trim").strip());
        builder.register(HelperNamespace.STRING, "replace", StringHelpers::replace);
        builder.register(HelperNamespace.STRING, "split", StringHelpers::split);
        builder.register(HelperNamespace.STRING, "join", StringHelpers::join);
        builder.register(HelperNamespace.STRING, "slug", StringHelpers::slug);
        builder.register(HelperNamespace.STRING, "capitalize", StringHelpers::capitalize);
        builder.register(HelperNamespace.STRING, "truncate", StringHelpers::truncate);
        return builder;
    }

    private static Object upper(List<Object> args) {
        Object value = arg(args, 0);
        if (value == null || "".equals(value)) {
            return "";
        }
        return string(args, 0, "string.upper").toUpperCase(Locale.ROOT);
    }

    private static Object replace(List<Object> args) {
        String text = string(args, 0, "string.replace");
        String search = string(args, 1, "string.replace");
        String replacement = string(args, 2, "string.replace", "undefined");
        return text.replace(search, replacement);
    }

    static List<String> split(List<Object> args) {
        String text = string(args, 0, "string.split");
        List<String> parts = new ArrayList<>();
        if (arg(args, 1) == null) {
            parts.add(text);
            return parts;
        }
        String separator = string(args, 1, "string.split");
        if (separator.isEmpty()) {
            for (int i = 0; i < text.length(); i++) {
                parts.add(String.valueOf(text.charAt(i)));
            }
            return parts;
        }
        int start = 0;
        int next;
        while ((next = text.indexOf(separator, start)) >= 0) {
            parts.add(text.substring(start, next));
            start = next + separator.length();
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static Object join(List<Object> args) {
        List<Object> items = list(args, 0, "string.join");
        String separator = string(args, 1, "string.join", ",");
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                builder.append(separator);
            }
            builder.append(jsString(items.get(i)));
        }
        return builder.toString();
    }

    private static Object slug(List<Object> args) {
        String lowered = string(args, 0, "string.slug").toLowerCase(Locale.ROOT);
        String dashed = WHITESPACE.matcher(lowered).replaceAll("-");
        return NON_SLUG.matcher(dashed).replaceAll("");
    }

    private static Object capitalize(List<Object> args) {
        Object value = arg(args, 0);
        if (value == null || "".equals(value)) {
            return value;
        }
        String text = string(args, 0, "string.capitalize");
        return text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1).toLowerCase(Locale.ROOT);
    }

    private static Object truncate(List<Object> args) {
        String text = string(args, 0, "string.truncate");
        int length = Math.max(0, integer(args, 1, "string.truncate"));
        if (text.length() <= length) {
            return text;
        }
        return text.substring(0, length) + "...";
    }
}

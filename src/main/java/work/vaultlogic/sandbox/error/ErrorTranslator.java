package work.vaultlogic.sandbox.error;

import java.util.regex.Pattern;
import org.graalvm.polyglot.PolyglotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.vaultlogic.sandbox.api.ErrorTag;
import work.vaultlogic.sandbox.api.ScriptError;

/**
 * Maps anything thrown while running a script onto the closed {@link ErrorTag} taxonomy with a sanitized message.
 */
public final class ErrorTranslator {
    private static final Logger LOG = LoggerFactory.getLogger(ErrorTranslator.class);
    static final int MAX_MESSAGE_LENGTH = 500;
    // a frame names a source file, either by path or by extension: "at fn (/x/y.js:3:11)", "at <js> fn(bootstrap.js:3)"
    private static final Pattern STACK_FRAME = Pattern.compile(
        "\\s+at\\s+(?:\\S+\\s+){0,2}?\\S*?\\(?[^\\s()]*(?:[\\\\/][^\\s()]*|\\.(?:m?js|cjs|java))(?::\\d+){1,2}\\)?.*$");
    // absolute paths only, starting a word: not the tail of a date, a fraction or a URL
    private static final Pattern HOST_PATH = Pattern.compile("(?<![\\w:/.\\\\])(?:[A-Za-z]:[\\\\/]|/)(?:[\\w.\\-@]+[\\\\/])+[\\w.\\-@]*");
    private static final Pattern HOST_CLASS = Pattern.compile("\\b(?:java|javax|jdk|sun|com\\.oracle|org\\.graalvm|work\\.vaultlogic)\\.[\\w.$]+");

    public ScriptError translate(Throwable error) {
        if (error == null) {
            return new ScriptError(ErrorTag.SANDBOX_UNAVAILABLE, defaultMessage(ErrorTag.SANDBOX_UNAVAILABLE));
        }
        if (error instanceof ScriptFailure failure) {
            return classified(failure.tag(), failure.getMessage());
        }
        if (error instanceof PolyglotException polyglot) {
            return translatePolyglot(polyglot);
        }
        if (error instanceof OutOfMemoryError) {
            return classified(ErrorTag.MEMORY_LIMIT_ERROR, null);
        }
        if (error instanceof StackOverflowError) {
            return classified(ErrorTag.RUNTIME_ERROR, "RangeError: Maximum call stack size exceeded");
        }
        LOG.warn("Unclassified sandbox failure", error);
        return classified(ErrorTag.SANDBOX_UNAVAILABLE, null);
    }

    /** Failure decided by the supervisor (timeout or memory ceiling) rather than by the script. */
    public ScriptError terminated(ErrorTag tag, long limit) {
        return switch (tag) {
            case TIMEOUT_ERROR -> new ScriptError(tag, "Execution exceeded time limit of " + limit + "ms");
            case MEMORY_LIMIT_ERROR -> new ScriptError(tag, "Execution exceeded memory limit of " + (limit / (1024 * 1024)) + "MB");
            default -> classified(tag, null);
        };
    }

    private ScriptError translatePolyglot(PolyglotException ex) {
        if (ex.isCancelled() || ex.isInterrupted()) {
            return classified(ErrorTag.TIMEOUT_ERROR, null);
        }
        if (ex.isResourceExhausted()) {
            return classified(ErrorTag.MEMORY_LIMIT_ERROR, null);
        }
        if (ex.isInternalError()) {
            LOG.warn("Internal sandbox engine error", ex);
            return classified(ErrorTag.SANDBOX_UNAVAILABLE, null);
        }
        if (ex.isHostException()) {
            Throwable host = ex.asHostException();
            if (host instanceof ScriptFailure failure) {
                return classified(failure.tag(), failure.getMessage());
            }
            return translate(host);
        }
        if (ex.isExit()) {
            return classified(ErrorTag.RUNTIME_ERROR, "Script attempted to exit the sandbox");
        }
        if (ex.isSyntaxError()) {
            return guest(ErrorTag.COMPILE_ERROR, ex.getMessage());
        }
        return guest(ErrorTag.RUNTIME_ERROR, ex.getMessage());
    }

    // guest errors carry text the script author wrote; only the first line is kept, frames dropped
    private ScriptError guest(ErrorTag tag, String message) {
        String text = cap(STACK_FRAME.matcher(firstLine(message)).replaceAll("").strip());
        return new ScriptError(tag, text.isEmpty() ? defaultMessage(tag) : text);
    }

    private ScriptError classified(ErrorTag tag, String message) {
        String sanitized = sanitize(message);
        return new ScriptError(tag, sanitized.isEmpty() ? defaultMessage(tag) : sanitized);
    }

    /**
     * Keeps the first line, drops stack frames, host paths and host class names, and caps the length.
     */
    public static String sanitize(String message) {
        if (message == null) {
            return "";
        }
        String text = STACK_FRAME.matcher(firstLine(message)).replaceAll("");
        text = HOST_PATH.matcher(text).replaceAll("<path>");
        text = HOST_CLASS.matcher(text).replaceAll("<internal>");
        return cap(text.strip());
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        String text = message.strip();
        int newline = text.indexOf('\n');
        return newline >= 0 ? text.substring(0, newline) : text;
    }

    private static String cap(String text) {
        return text.length() > MAX_MESSAGE_LENGTH ? text.substring(0, MAX_MESSAGE_LENGTH) : text;
    }

    static String defaultMessage(ErrorTag tag) {
        return switch (tag) {
            case COMPILE_ERROR -> "Script could not be compiled";
            case RUNTIME_ERROR -> "Script failed";
            case TIMEOUT_ERROR -> "Execution exceeded time limit";
            case MEMORY_LIMIT_ERROR -> "Execution exceeded memory limit";
            case SANDBOX_UNAVAILABLE -> "Script sandbox is temporarily unavailable";
            case MARSHALLING_ERROR -> "Value cannot cross the sandbox boundary";
        };
    }
}

package work.vaultlogic.sandbox.cli;

import picocli.CommandLine;
import work.vaultlogic.sandbox.config.SandboxConfigException;

/**
 * Prints one line naming the root cause instead of a stack trace. Set {@code -Dsandbox.debug=true} for the trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        Throwable root = rootCause(ex);
        String prefix = root instanceof SandboxConfigException ? "Invalid sandbox configuration: " : "sandbox-run failed: ";
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            message = root.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(prefix + message));
        if (Boolean.getBoolean("sandbox.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return SandboxRunCommand.EXIT_USAGE;
    }

    private static Throwable rootCause(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            if (current instanceof SandboxConfigException) {
                break;
            }
            current = current.getCause();
        }
        return current;
    }
}

package work.vaultlogic.sandbox.runtime;

import work.vaultlogic.sandbox.helpers.HelperLibrary;

/**
 * Invocation after host-side checks: code within size, input and context already serialized.
 */
record PreparedInvocation(
    String code,
    String inputJson,
    String contextJson,
    HelperLibrary helpers,
    ConsoleBuffer console,
    boolean consoleEnabled,
    long timeoutMs,
    int maxOutputSize,
    long memoryLimitBytes,
    boolean compileOnly
) {}

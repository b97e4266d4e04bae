package work.vaultlogic.sandbox.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.vaultlogic.sandbox.api.ErrorTag;

class ErrorTranslatorTest {
    private final ErrorTranslator translator = new ErrorTranslator();

    @Test
    void taggedFailureKeepsItsTag() {
        var error = translator.translate(new ScriptFailure(ErrorTag.MARSHALLING_ERROR, "Functions cannot cross the sandbox boundary"));
        assertEquals(ErrorTag.MARSHALLING_ERROR, error.tag());
        assertEquals("Functions cannot cross the sandbox boundary", error.message());
        assertFalse(error.retryable());
    }

    @Test
    void outOfMemoryIsMemoryLimit() {
        assertEquals(ErrorTag.MEMORY_LIMIT_ERROR, translator.translate(new OutOfMemoryError("Java heap space")).tag());
    }

    @Test
    void stackOverflowIsRuntimeError() {
        var error = translator.translate(new StackOverflowError());
        assertEquals(ErrorTag.RUNTIME_ERROR, error.tag());
        assertTrue(error.message().contains("call stack"));
    }

    @Test
    void unknownHostFailureIsRetryableUnavailable() {
        var error = translator.translate(new IllegalStateException("pool broken"));
        assertEquals(ErrorTag.SANDBOX_UNAVAILABLE, error.tag());
        assertTrue(error.retryable());
        assertFalse(error.message().contains("pool broken"));
    }

    @Test
    void terminatedMessagesNameTheLimit() {
        assertEquals("Execution exceeded time limit of 100ms", translator.terminated(ErrorTag.TIMEOUT_ERROR, 100).message());
        assertEquals("Execution exceeded memory limit of 32MB",
            translator.terminated(ErrorTag.MEMORY_LIMIT_ERROR, 32L * 1024 * 1024).message());
    }

    @Test
    void sanitizeKeepsFirstLineWithoutFrames() {
        String raw = "Error: boom\n    at inner (/srv/app/scripts/transform.js:3:11)\n    at outer (/srv/app/scripts/transform.js:7:3)";
        assertEquals("Error: boom", ErrorTranslator.sanitize(raw));
    }

    @Test
    void sanitizeStripsInlineFramesAndPaths() {
        assertEquals("Error: boom", ErrorTranslator.sanitize("Error: boom at run (/srv/app/file.js:1:2)"));
        assertEquals("ENOENT: cannot open <path>", ErrorTranslator.sanitize("ENOENT: cannot open /home/runner/secrets/key.pem"));
        assertEquals("Look at this value", ErrorTranslator.sanitize("Look at this value"));
    }

    @Test
    void sanitizeHidesHostClassNames() {
        assertEquals("<internal>: oops", ErrorTranslator.sanitize("java.lang.IllegalStateException: oops"));
    }

    @Test
    void sanitizeCapsLength() {
        String sanitized = ErrorTranslator.sanitize("x".repeat(2_000));
        assertEquals(ErrorTranslator.MAX_MESSAGE_LENGTH, sanitized.length());
    }

    @Test
    void blankMessageFallsBackToDefault() {
        var error = translator.translate(new ScriptFailure(ErrorTag.RUNTIME_ERROR, "   "));
        assertEquals("Script failed", error.message());
    }

    @Test
    void sanitizeLeavesOrdinaryProseAlone() {
        assertEquals("Error: Meeting at 10:30 is full", ErrorTranslator.sanitize("Error: Meeting at 10:30 is full"));
        assertEquals("Error: Date must look like 12/05/2024 or 1/2/3",
            ErrorTranslator.sanitize("Error: Date must look like 12/05/2024 or 1/2/3"));
        assertEquals("Error: see https://docs.example.com/errors/E42 for help",
            ErrorTranslator.sanitize("Error: see https://docs.example.com/errors/E42 for help"));
    }

    @Test
    void sanitizeStripsEngineStyleFrames() {
        assertEquals("TypeError: x is not a function",
            ErrorTranslator.sanitize("TypeError: x is not a function at <js> inner(transform.js:3:11)"));
        assertEquals("Error: <path> missing", ErrorTranslator.sanitize("Error: C:\\Users\\ci\\build.log missing"));
    }
}

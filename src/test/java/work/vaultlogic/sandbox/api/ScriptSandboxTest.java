package work.vaultlogic.sandbox.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import work.vaultlogic.sandbox.helpers.HelperLibrary;
import work.vaultlogic.sandbox.helpers.HelperNamespace;

class ScriptSandboxTest {
    private static ScriptSandbox sandbox;

    @BeforeAll
    static void startSandbox() {
        sandbox = ScriptSandbox.create(SandboxConfig.builder().workerThreads(2).build());
    }

    @AfterAll
    static void stopSandbox() {
        sandbox.close();
    }

    private static ScriptResult run(String code) {
        return run(code, null);
    }

    private static ScriptResult run(String code, Object input) {
        return sandbox.execute(ScriptInvocationRequest.builder().code(code).input(input).build());
    }

    @Test
    void returnsComputedValue() {
        ScriptResult result = run("return 1 + 1");
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(2, result.output());
        assertTrue(result.executionTimeMs() >= 0);
    }

    @Test
    void emptyBodyReturnsNull() {
        ScriptResult result = run("");
        assertTrue(result.ok());
        assertNull(result.output());
    }

    @Test
    void readsInputAndBuildsObjects() {
        ScriptResult result = run(
            "return { name: input.user.name.toUpperCase(), total: input.items.length, ratio: 1.5 }",
            Map.of("user", Map.of("name", "ada"), "items", List.of(1, 2, 3))
        );
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(Map.of("name", "ADA", "total", 3, "ratio", 1.5), result.output());
    }

    @Test
    void readsBlockContext() {
        var context = BlockContextView.builder()
            .workflowId("wf-1")
            .runId("run-9")
            .phase("collect")
            .userId("u-7")
            .answers(Map.of("q1", "yes"))
            .build();
        ScriptResult result = sandbox.execute(ScriptInvocationRequest.builder()
            .code("return [context.workflow.id, context.run.id, context.phase, context.user.id, context.answers.q1, typeof context.section]")
            .context(context)
            .build());
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(List.of("wf-1", "run-9", "collect", "u-7", "yes", "undefined"), result.output());
    }

    @Test
    void thrownErrorIsRuntimeError() {
        ScriptResult result = run("throw new Error('boom')");
        assertFalse(result.ok());
        assertEquals(ErrorTag.RUNTIME_ERROR, result.error().tag());
        assertTrue(result.error().message().contains("boom"), result.error().message());
        assertFalse(result.retryable());
        assertNull(result.output());
    }

    @Test
    void scriptMessagesReachTheAuthorIntact() {
        for (String message : List.of(
            "Meeting at 10:30 is full",
            "Date must look like 12/05/2024 or 1/2/3",
            "see https://docs.example.com/errors/E42 for help")) {
            ScriptResult result = run("throw new Error(input)", message);
            assertEquals(ErrorTag.RUNTIME_ERROR, result.error().tag());
            assertTrue(result.error().message().endsWith(message), result.error().message());
        }
    }

    @Test
    void thrownNonErrorValueIsRuntimeError() {
        ScriptResult result = run("throw 'plain string'");
        assertEquals(ErrorTag.RUNTIME_ERROR, result.error().tag());
    }

    @Test
    void syntaxErrorIsCompileError() {
        ScriptResult result = run("return (1 + ;");
        assertFalse(result.ok());
        assertEquals(ErrorTag.COMPILE_ERROR, result.error().tag());
    }

    @Test
    void callsStandardHelpers() {
        ScriptResult result = run(
            "return { sum: helpers.math.sum(input.nums), slug: helpers.string.slug('Hello World'), chunks: helpers.array.chunk(input.nums, 2) }",
            Map.of("nums", List.of(1, 2, 3))
        );
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(Map.of("sum", 6, "slug", "hello-world", "chunks", List.of(List.of(1, 2), List.of(3))), result.output());
    }

    @Test
    void helperResultsAreOrdinaryGuestValues() {
        ScriptResult result = run("const parts = helpers.string.split('a,b', ','); parts.push('c'); return Array.isArray(parts) ? parts : null");
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(List.of("a", "b", "c"), result.output());
    }

    @Test
    void missingHelperIsRuntimeError() {
        ScriptResult result = run("return helpers.nonexistent.method()");
        assertEquals(ErrorTag.RUNTIME_ERROR, result.error().tag());
    }

    @Test
    void helperFailureIsRuntimeError() {
        ScriptResult result = run("return helpers.array.chunk([1, 2], 0)");
        assertEquals(ErrorTag.RUNTIME_ERROR, result.error().tag());
    }

    @Test
    void helpersAreFrozen() {
        ScriptResult result = run("helpers.math.sum = () => 0; helpers.extra = {}; return [helpers.math.sum([1, 2]), typeof helpers.extra, Object.isFrozen(helpers)]");
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(List.of(3, "undefined", true), result.output());
    }

    @Test
    void inputIsFrozen() {
        ScriptResult result = run("input.count = 99; input.list.push; return [input.count, Object.isFrozen(input.list)]", Map.of("count", 1, "list", List.of()));
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(List.of(1, true), result.output());
    }

    @Test
    void inputMutationInStrictModeFails() {
        ScriptResult result = run("'use strict'; input.count = 99; return input.count", Map.of("count", 1));
        assertEquals(ErrorTag.RUNTIME_ERROR, result.error().tag());
    }

    @Test
    void customHelperLibraryReplacesStandardOne() {
        HelperLibrary library = HelperLibrary.builder()
            .register(HelperNamespace.STRING, "shout", args -> String.valueOf(args.get(0)).toUpperCase() + "!")
            .build();
        ScriptResult result = sandbox.execute(ScriptInvocationRequest.builder()
            .code("return [helpers.string.shout('hi'), typeof helpers.math]")
            .helpers(library)
            .build());
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(List.of("HI!", "undefined"), result.output());
    }

    @Test
    void capturesConsoleInOrder() {
        ScriptResult result = sandbox.execute(ScriptInvocationRequest.builder()
            .code("console.log('start', 1); helpers.console.warn({a: 1}); console.error('end'); return null")
            .consoleEnabled(true)
            .build());
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(
            List.of(
                new ConsoleEntry(ConsoleLevel.LOG, List.of("start", 1)),
                new ConsoleEntry(ConsoleLevel.WARN, List.of(Map.of("a", 1))),
                new ConsoleEntry(ConsoleLevel.ERROR, List.of("end"))
            ),
            result.consoleLogs()
        );
    }

    @Test
    void consoleIsSilentWhenDisabled() {
        ScriptResult result = run("console.log('hidden'); return 'done'");
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals("done", result.output());
        assertTrue(result.consoleLogs().isEmpty());
    }

    @Test
    void consoleEntriesSurviveFailure() {
        ScriptResult result = sandbox.execute(ScriptInvocationRequest.builder()
            .code("console.info('before'); throw new Error('after')")
            .consoleEnabled(true)
            .build());
        assertEquals(ErrorTag.RUNTIME_ERROR, result.error().tag());
        assertEquals(List.of(new ConsoleEntry(ConsoleLevel.INFO, List.of("before"))), result.consoleLogs());
    }

    @Test
    void returningFunctionIsMarshallingError() {
        ScriptResult result = run("return { fn: () => 1 }");
        assertEquals(ErrorTag.MARSHALLING_ERROR, result.error().tag());
    }

    @Test
    void nonPlainObjectsAreMarshallingErrors() {
        for (String code : List.of("return new Map([['a', 1]])", "return new Set([1, 2])", "return Promise.resolve(1)",
            "return /re/g", "return new Error('x')", "return { nested: new Map() }")) {
            ScriptResult result = run(code);
            assertFalse(result.ok(), () -> code + " returned " + result.output());
            assertEquals(ErrorTag.MARSHALLING_ERROR, result.error().tag(), code);
        }
    }

    @Test
    void nonFiniteNumbersBecomeNull() {
        ScriptResult result = run("return [NaN, Infinity, 0.5]");
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(java.util.Arrays.asList(null, null, 0.5), result.output());
    }

    @Test
    void undefinedBecomesNull() {
        ScriptResult result = run("return undefined");
        assertTrue(result.ok());
        assertNull(result.output());
    }

    @Test
    void hostAndShellGlobalsAreAbsent() {
        ScriptResult result = run("return [typeof Java, typeof Polyglot, typeof load, typeof print, typeof quit, typeof require, typeof process]");
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(List.of("undefined", "undefined", "undefined", "undefined", "undefined", "undefined", "undefined"), result.output());
    }

    @Test
    void consoleCannotBeReplaced() {
        ScriptResult result = run("console = null; return typeof console.log");
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals("function", result.output());
    }

    @Test
    void flatExecuteUsesDefaults() {
        ScriptResult result = sandbox.execute("return input * 2", 21, null, null, 0, false);
        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(42, result.output());
    }

    @Test
    void nullRequestIsReportedAsFailure() {
        ScriptResult result = sandbox.execute(null);
        assertFalse(result.ok());
        assertEquals(ErrorTag.RUNTIME_ERROR, result.error().tag());
    }

    @Test
    void validateAcceptsWellFormedBody() {
        assertTrue(sandbox.validate("const x = input; return x").valid());
    }

    @Test
    void validateDoesNotRunTheBody() {
        ScriptValidation validation = sandbox.validate("while (true) {}");
        assertTrue(validation.valid());
    }

    @Test
    void validateReportsCompileError() {
        ScriptValidation validation = sandbox.validate("return {");
        assertFalse(validation.valid());
        assertEquals(ErrorTag.COMPILE_ERROR, validation.error().tag());
    }
}

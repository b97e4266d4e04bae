package work.vaultlogic.sandbox.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class SandboxRunCommandTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String stdin, String... args) {
        var command = new SandboxRunCommand(Map.of("SANDBOX_WORKER_THREADS", "1"),
            new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));
        CommandLine commandLine = new CommandLine(command).setExecutionExceptionHandler(new ShortErrorHandler());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private JsonNode printed() throws Exception {
        return mapper.readTree(out.toString());
    }

    @Test
    void evaluatesInlineBodyWithInlineInput() throws Exception {
        int exit = run("", "-e", "return helpers.math.sum(input.nums)", "-i", "{\"nums\":[1,2,3]}");
        assertEquals(SandboxRunCommand.EXIT_OK, exit, err::toString);
        JsonNode json = printed();
        assertTrue(json.get("ok").asBoolean());
        assertEquals(6, json.get("output").asInt());
    }

    @Test
    void readsScriptAndInputFromFiles(@TempDir Path dir) throws Exception {
        Path script = Files.writeString(dir.resolve("transform.js"), "console.log('seen'); return context.workflow.id + ':' + input.name");
        Path input = Files.writeString(dir.resolve("input.json"), "{\"name\":\"ada\"}");
        int exit = run("", "-f", script.toString(), "-i", input.toString(), "--context", "{\"workflowId\":\"wf-3\"}", "--console");
        assertEquals(SandboxRunCommand.EXIT_OK, exit, err::toString);
        JsonNode json = printed();
        assertEquals("wf-3:ada", json.get("output").asText());
        assertEquals("seen", json.at("/consoleLogs/0/args/0").asText());
    }

    @Test
    void readsInputFromStdin() throws Exception {
        int exit = run("[4, 5]", "-e", "return input.length", "-i", "-");
        assertEquals(SandboxRunCommand.EXIT_OK, exit, err::toString);
        assertEquals(2, printed().get("output").asInt());
    }

    @Test
    void scriptFailureExitsWithOne() throws Exception {
        int exit = run("", "-e", "throw new Error('nope')");
        assertEquals(SandboxRunCommand.EXIT_SCRIPT_FAILURE, exit);
        JsonNode json = printed();
        assertEquals("RuntimeError", json.at("/error/tag").asText());
        assertTrue(json.at("/error/message").asText().contains("nope"));
    }

    @Test
    void timeoutIsReported() throws Exception {
        int exit = run("", "-e", "while (true) {}", "--timeout", "150ms");
        assertEquals(SandboxRunCommand.EXIT_SCRIPT_FAILURE, exit);
        assertEquals("TimeoutError", printed().at("/error/tag").asText());
    }

    @Test
    void validateOnlyChecksCompilation() throws Exception {
        assertEquals(SandboxRunCommand.EXIT_OK, run("", "-e", "while (true) {}", "--validate"), err::toString);
        assertTrue(printed().at("/output/valid").asBoolean());
    }

    @Test
    void validateReportsCompileError() throws Exception {
        assertEquals(SandboxRunCommand.EXIT_SCRIPT_FAILURE, run("", "-e", "return (", "--validate"));
        assertEquals("CompileError", printed().at("/error/tag").asText());
    }

    @Test
    void evalAndFileAreExclusive(@TempDir Path dir) throws Exception {
        Path script = Files.writeString(dir.resolve("s.js"), "return 1");
        assertEquals(SandboxRunCommand.EXIT_USAGE, run("", "-e", "return 1", "-f", script.toString()));
    }

    @Test
    void invalidInputJsonIsUsageError() {
        assertEquals(SandboxRunCommand.EXIT_USAGE, run("", "-e", "return input", "-i", "{broken"));
        assertTrue(err.toString().contains("Invalid JSON for input"), err::toString);
    }

    @Test
    void nonPositiveTimeoutIsUsageError() {
        assertEquals(SandboxRunCommand.EXIT_USAGE, run("", "-e", "return 1", "--timeout", "0ms"));
    }

    @Test
    void versionIsPrinted() {
        assertEquals(0, run("", "--version"));
        assertTrue(out.toString().startsWith("sandbox-run "));
    }

    @Test
    void unreadableConfigIsReportedOnOneLine(@TempDir Path dir) {
        int exit = run("", "-e", "return 1", "--config", dir.resolve("absent.toml").toString());
        assertEquals(SandboxRunCommand.EXIT_USAGE, exit);
        String message = err.toString().trim();
        assertTrue(message.startsWith("Invalid sandbox configuration: Unable to read sandbox config"), message);
        assertEquals(1, message.lines().count(), message);
    }

    @Test
    void configFileSettingsApply(@TempDir Path dir) throws Exception {
        Path config = Files.writeString(dir.resolve("sandbox.toml"), "[sandbox]\nmax-code-size = 8\n");
        assertEquals(SandboxRunCommand.EXIT_SCRIPT_FAILURE, run("", "-e", "return 'too long'", "--config", config.toString()));
        assertEquals("CompileError", printed().at("/error/tag").asText());
    }
}

package work.vaultlogic.sandbox.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.vaultlogic.sandbox.api.SandboxConfig;

class SandboxConfigLoaderTest {
    @Test
    void loadsSandboxTableFromFile() {
        var config = SandboxConfigLoader.load(Path.of("src", "test", "resources", "sandbox-test.toml"));
        assertEquals(64L * 1024 * 1024, config.memoryLimitBytes());
        assertEquals(50L, config.minTimeoutMs());
        assertEquals(2_000L, config.maxTimeoutMs());
        assertEquals(16 * 1024, config.maxCodeSize());
        assertEquals(4096, config.maxInputSize());
        assertEquals(10, config.maxConsoleEntries());
        assertEquals(3, config.workerThreads());
        assertEquals(2L, config.pollIntervalMs());
        assertEquals(SandboxConfig.defaults().maxOutputSize(), config.maxOutputSize());
    }

    @Test
    void missingTableKeepsDefaults() {
        var config = SandboxConfigLoader.parse("[other]\nkey = 1\n");
        assertEquals(SandboxConfig.defaults().memoryLimitBytes(), config.memoryLimitBytes());
        assertEquals(3_000L, config.maxTimeoutMs());
    }

    @Test
    void rejectsMalformedToml() {
        assertThrows(SandboxConfigException.class, () -> SandboxConfigLoader.parse("[sandbox\nmemory-limit = "));
    }

    @Test
    void rejectsWrongValueTypes() {
        assertThrows(SandboxConfigException.class, () -> SandboxConfigLoader.parse("[sandbox]\nmax-timeout = true\n"));
        assertThrows(SandboxConfigException.class, () -> SandboxConfigLoader.parse("[sandbox]\nmemory-limit = \"lots\"\n"));
    }

    @Test
    void rejectsInconsistentTimeoutRange() {
        assertThrows(SandboxConfigException.class,
            () -> SandboxConfigLoader.parse("[sandbox]\nmin-timeout = \"5s\"\nmax-timeout = \"1s\"\n"));
    }

    @Test
    void environmentOverridesLimits() {
        var env = Map.of(
            "SANDBOX_MAX_CODE_SIZE", "1000",
            "SANDBOX_MAX_INPUT_SIZE", "2kb",
            "SANDBOX_MAX_OUTPUT_SIZE", "3kb",
            "SANDBOX_MEMORY_LIMIT", "32mb",
            "SANDBOX_WORKER_THREADS", "5"
        );
        var config = SandboxConfigLoader.applyEnvironment(SandboxConfig.defaults(), env);
        assertEquals(1000, config.maxCodeSize());
        assertEquals(2048, config.maxInputSize());
        assertEquals(3072, config.maxOutputSize());
        assertEquals(32L * 1024 * 1024, config.memoryLimitBytes());
        assertEquals(5, config.workerThreads());
    }

    @Test
    void resolveWithoutFileUsesEnvironmentOnly() {
        var config = SandboxConfigLoader.resolve(null, Map.of("SANDBOX_MAX_CODE_SIZE", "2048"));
        assertEquals(2048, config.maxCodeSize());
    }

    @Test
    void invalidEnvironmentValueFails() {
        assertThrows(SandboxConfigException.class,
            () -> SandboxConfigLoader.applyEnvironment(SandboxConfig.defaults(), Map.of("SANDBOX_WORKER_THREADS", "many")));
    }
}

package me.golemcore.bridge.domain.service;

import me.golemcore.bridge.domain.model.ExecutionResult;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ShellCommandRunnerTest {

    private static final String EXECUTOR = "test";

    @TempDir
    Path tempDir;

    private ShellCommandRunner runner;

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.shutdown();
        }
    }

    private ShellCommandRunner createRunner(BridgeProperties properties) {
        runner = new ShellCommandRunner(properties);
        return runner;
    }

    @Test
    void shouldRunThroughShell() {
        ExecutionResult result = createRunner(new BridgeProperties()).run(EXECUTOR, "echo one | tr a-z A-Z");

        assertTrue(result.isSuccess());
        assertEquals("ONE\n", result.getStdout());
    }

    @Test
    void shouldKeepStderrOutOfStdout() {
        ExecutionResult result = createRunner(new BridgeProperties()).run(EXECUTOR, "echo out; echo err >&2");

        assertTrue(result.isSuccess());
        assertEquals("out\n", result.getStdout());
    }

    @Test
    void shouldReportExitStatusAndStderrOnFailure() {
        ExecutionResult result = createRunner(new BridgeProperties()).run(EXECUTOR, "echo nope >&2; exit 7");

        assertFalse(result.isSuccess());
        assertEquals(7, result.getExitStatus());
        assertEquals("Command failed with exit status 7: nope", result.getError());
    }

    @Test
    void shouldUseConfiguredWorkingDirectory() throws Exception {
        Files.writeString(tempDir.resolve("marker.txt"), "content");
        BridgeProperties properties = new BridgeProperties();
        properties.getExecution().setWorkingDirectory(tempDir.toString());

        ExecutionResult result = createRunner(properties).run(EXECUTOR, "ls");

        assertTrue(result.getStdout().contains("marker.txt"));
    }

    @Test
    void shouldKillCommandAfterTimeout() {
        BridgeProperties properties = new BridgeProperties();
        properties.getExecution().setTimeoutSeconds(1);

        ExecutionResult result = createRunner(properties).run(EXECUTOR, "exec sleep 30");

        assertFalse(result.isSuccess());
        assertTrue(result.isTimedOut());
        assertNull(result.getExitStatus());
        assertTrue(result.getError().contains("timed out"));
    }

    @Test
    void shouldTruncateLongOutput() {
        BridgeProperties properties = new BridgeProperties();
        properties.getExecution().setMaxOutputLength(10);

        ExecutionResult result = createRunner(properties).run(EXECUTOR, "printf '%050d' 0");

        assertTrue(result.isSuccess());
        assertTrue(result.isTruncated());
        assertEquals(10, result.getStdout().length());
    }

    @Test
    void shouldCaptureSpawnFailureInResult() {
        BridgeProperties properties = new BridgeProperties();
        properties.getExecution().setShell(tempDir.resolve("missing-shell").toString());

        ExecutionResult result = createRunner(properties).run(EXECUTOR, "echo hi");

        assertFalse(result.isSuccess());
        assertNull(result.getExitStatus());
        assertTrue(result.getError().startsWith("Failed to start command"));
        assertEquals("", result.getStdout());
    }

    @Test
    void shouldCaptureStreamUpToLimit() throws Exception {
        byte[] data = "abcdefghij".getBytes(StandardCharsets.UTF_8);

        ShellCommandRunner.CapturedOutput captured = ShellCommandRunner.capture(new ByteArrayInputStream(data), 4);

        assertEquals("abcd", captured.text());
        assertTrue(captured.truncated());
    }
}

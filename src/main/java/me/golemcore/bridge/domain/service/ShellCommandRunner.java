/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.bridge.domain.service;

import me.golemcore.bridge.domain.model.ExecutionResult;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a rendered command line through the system shell
 * ({@code /bin/sh -c <line>} by default), capturing standard output, standard
 * error and the exit status.
 *
 * <p>
 * The call blocks until the process exits. With
 * {@code bridge.execution.timeout-seconds} above zero the process is destroyed
 * once the timeout elapses; zero waits indefinitely. Captured output beyond
 * {@code bridge.execution.max-output-length} characters is dropped and the
 * result is flagged as truncated.
 *
 * <p>
 * No sandboxing is applied: the command runs with the privileges and
 * environment of the bridge process.
 */
@Service
@Slf4j
public class ShellCommandRunner {

    private static final long STREAM_DRAIN_TIMEOUT_SECONDS = 5;

    private final BridgeProperties.ExecutionProperties config;
    private final ExecutorService streamReaders;

    public ShellCommandRunner(BridgeProperties properties) {
        this.config = properties.getExecution();
        this.streamReaders = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "shell-stream-reader");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        streamReaders.shutdownNow();
        try {
            if (!streamReaders.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Exec] Stream readers did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public ExecutionResult run(String executor, String commandLine) {
        ProcessBuilder pb = new ProcessBuilder(List.of(config.getShell(), config.getShellFlag(), commandLine));
        if (config.getWorkingDirectory() != null && !config.getWorkingDirectory().isBlank()) {
            pb.directory(new File(config.getWorkingDirectory()));
        }

        long startTime = System.currentTimeMillis();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("[Exec] Failed to start '{}': {}", executor, e.getMessage());
            return ExecutionResult.spawnFailure(executor, commandLine, "Failed to start command: " + e.getMessage());
        }

        int limit = config.getMaxOutputLength();
        Future<CapturedOutput> stdoutFuture = streamReaders.submit(() -> capture(process.getInputStream(), limit));
        Future<CapturedOutput> stderrFuture = streamReaders.submit(() -> capture(process.getErrorStream(), limit));

        try {
            boolean completed = waitFor(process);
            long duration = System.currentTimeMillis() - startTime;

            if (!completed) {
                process.destroyForcibly();
                CapturedOutput stdout = collect(stdoutFuture);
                log.warn("[Exec] '{}' timed out after {}s", executor, config.getTimeoutSeconds());
                return ExecutionResult.builder()
                        .executor(executor)
                        .command(commandLine)
                        .stdout(stdout.text())
                        .truncated(stdout.truncated())
                        .durationMs(duration)
                        .timedOut(true)
                        .error("Command timed out after " + config.getTimeoutSeconds() + " seconds")
                        .build();
            }

            CapturedOutput stdout = collect(stdoutFuture);
            CapturedOutput stderr = collect(stderrFuture);
            int exitStatus = process.exitValue();
            log.info("[Exec] '{}' exited with status {} in {}ms", executor, exitStatus, duration);

            ExecutionResult.ExecutionResultBuilder result = ExecutionResult.builder()
                    .executor(executor)
                    .command(commandLine)
                    .stdout(stdout.text())
                    .truncated(stdout.truncated())
                    .exitStatus(exitStatus)
                    .durationMs(duration);
            if (exitStatus != 0) {
                String detail = stderr.text().strip();
                result.error("Command failed with exit status " + exitStatus
                        + (detail.isEmpty() ? "" : ": " + detail));
            }
            return result.build();

        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return ExecutionResult.spawnFailure(executor, commandLine, "Command execution interrupted");
        }
    }

    private boolean waitFor(Process process) throws InterruptedException {
        if (config.getTimeoutSeconds() > 0) {
            return process.waitFor(config.getTimeoutSeconds(), TimeUnit.SECONDS);
        }
        process.waitFor();
        return true;
    }

    private CapturedOutput collect(Future<CapturedOutput> future) throws InterruptedException {
        try {
            return future.get(STREAM_DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return new CapturedOutput("[Output read timeout]", false);
        } catch (ExecutionException e) {
            return new CapturedOutput("[Output read failed: " + e.getCause().getMessage() + "]", false);
        }
    }

    static CapturedOutput capture(InputStream stream, int limit) throws IOException {
        StringBuilder output = new StringBuilder();
        boolean truncated = false;
        char[] buffer = new char[4096];
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            int read = reader.read(buffer);
            while (read != -1) {
                int room = limit - output.length();
                if (room >= read) {
                    output.append(buffer, 0, read);
                } else {
                    if (room > 0) {
                        output.append(buffer, 0, room);
                    }
                    truncated = true;
                }
                read = reader.read(buffer);
            }
        }
        return new CapturedOutput(output.toString(), truncated);
    }

    record CapturedOutput(String text, boolean truncated) {
    }
}

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

package me.golemcore.bridge.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of running a rendered command line. Failures of the process itself
 * (non-zero exit, spawn failure, timeout) are carried in {@link #error} instead
 * of being thrown, so callers decide how to surface them.
 */
@Data
@Builder
public class ExecutionResult {

    private String executor;
    private String command;
    private String stdout;
    /** Process exit status, {@code null} when the process never started or was killed. */
    private Integer exitStatus;
    private String error;
    private long durationMs;
    private boolean timedOut;
    private boolean truncated;

    public boolean isSuccess() {
        return error == null && exitStatus != null && exitStatus == 0;
    }

    /**
     * Creates a result for a process that could not be started.
     */
    public static ExecutionResult spawnFailure(String executor, String command, String error) {
        return ExecutionResult.builder()
                .executor(executor)
                .command(command)
                .stdout("")
                .error(error)
                .build();
    }
}

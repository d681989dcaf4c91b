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

import me.golemcore.bridge.domain.exception.CommandException;
import me.golemcore.bridge.domain.model.ExecutionResult;
import org.springframework.stereotype.Component;

/**
 * Formats chat replies for execution results and failures. Output is wrapped
 * in a code block and capped to what a single chat message can carry.
 */
@Component
public class ReplyFormatter {

    static final int MAX_REPLY_LENGTH = 39_000;
    private static final String FENCE = "```";
    private static final String TRUNCATED_MARKER = "\n[Output truncated...]";

    public String success(ExecutionResult result) {
        StringBuilder reply = new StringBuilder();
        reply.append(":white_check_mark: `").append(result.getExecutor()).append("` finished");
        appendOutput(reply, result);
        return cap(reply.toString());
    }

    public String failure(ExecutionResult result) {
        StringBuilder reply = new StringBuilder();
        reply.append(":x: `").append(result.getExecutor()).append("` failed: ").append(result.getError());
        appendOutput(reply, result);
        return cap(reply.toString());
    }

    public String rejected(CommandException error) {
        return ":warning: " + error.getMessage() + " (" + error.getCode() + ")";
    }

    public String unauthorized() {
        return ":no_entry: You are not allowed to run executors here.";
    }

    public String busy() {
        return ":hourglass: Too many commands are running, try again later.";
    }

    public String internalError(String detail) {
        return ":x: Command failed unexpectedly: " + detail;
    }

    private void appendOutput(StringBuilder reply, ExecutionResult result) {
        String stdout = result.getStdout();
        if (stdout == null || stdout.isEmpty()) {
            if (result.isSuccess()) {
                reply.append(" (no output)");
            }
            return;
        }
        String body = stdout.replace(FENCE, "'''");
        if (result.isTruncated()) {
            body = body + TRUNCATED_MARKER;
        }
        if (!body.endsWith("\n")) {
            body = body + "\n";
        }
        reply.append('\n').append(FENCE).append('\n').append(body).append(FENCE);
    }

    private String cap(String reply) {
        if (reply.length() <= MAX_REPLY_LENGTH) {
            return reply;
        }
        int cut = MAX_REPLY_LENGTH;
        if (Character.isHighSurrogate(reply.charAt(cut - 1))) {
            cut--;
        }
        return reply.substring(0, cut) + TRUNCATED_MARKER + "\n" + FENCE;
    }
}

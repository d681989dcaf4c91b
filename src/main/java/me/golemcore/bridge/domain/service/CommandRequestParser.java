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

import me.golemcore.bridge.domain.exception.DirectiveSyntaxException;
import me.golemcore.bridge.domain.exception.NoCodeBlockException;
import me.golemcore.bridge.domain.exception.UnrecognizedDirectiveException;
import me.golemcore.bridge.domain.model.ParsedCommandRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts a command request from chat message text.
 *
 * <p>
 * The request lives in the first fenced block of the message:
 *
 * <pre>
 * ```
 * # executor: psql
 * select 1;
 * ```
 * </pre>
 *
 * <p>
 * Inside the block every line is trimmed. Lines starting with {@code #} are
 * directives of the form {@code key: value}, split on the last colon. Only
 * {@code executor} is recognized; any other key is rejected. All remaining
 * lines are concatenated, without separators, into the payload.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class CommandRequestParser {

    static final String FENCE = "```";
    static final String DIRECTIVE_PREFIX = "#";
    static final String EXECUTOR_KEY = "executor";

    public ParsedCommandRequest extractRequest(String rawText) {
        return parseBlock(extractBlock(rawText));
    }

    /**
     * Returns the text between the first fence and the next one after it.
     */
    public String extractBlock(String rawText) {
        if (rawText == null) {
            throw new NoCodeBlockException();
        }
        int open = rawText.indexOf(FENCE);
        if (open < 0) {
            throw new NoCodeBlockException();
        }
        int start = open + FENCE.length();
        int close = rawText.indexOf(FENCE, start);
        if (close < 0) {
            throw new NoCodeBlockException();
        }
        return rawText.substring(start, close);
    }

    /**
     * Parses directive and payload lines of an already extracted block.
     */
    public ParsedCommandRequest parseBlock(String block) {
        String name = "";
        StringBuilder payload = new StringBuilder();

        for (String rawLine : block.split("\\R", -1)) {
            String line = rawLine.trim();
            if (!line.startsWith(DIRECTIVE_PREFIX)) {
                payload.append(line);
                continue;
            }

            String directive = line.substring(DIRECTIVE_PREFIX.length()).trim();
            int separator = directive.lastIndexOf(':');
            if (separator < 0) {
                throw new DirectiveSyntaxException(directive);
            }
            String key = directive.substring(0, separator).trim();
            String value = directive.substring(separator + 1).trim();

            if (EXECUTOR_KEY.equals(key)) {
                name = value;
            } else {
                throw new UnrecognizedDirectiveException(key);
            }
        }

        log.debug("[Parser] Parsed request: executor='{}', payload length={}", name, payload.length());
        return new ParsedCommandRequest(name, payload.toString());
    }
}

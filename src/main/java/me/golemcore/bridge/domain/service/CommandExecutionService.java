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

import me.golemcore.bridge.domain.exception.NoAvailableExecutorsException;
import me.golemcore.bridge.domain.exception.UnknownExecutorException;
import me.golemcore.bridge.domain.model.CommandTemplate;
import me.golemcore.bridge.domain.model.ExecutionResult;
import me.golemcore.bridge.domain.model.ParsedCommandRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves a parsed request against the command registry, renders the
 * template and runs the resulting command line.
 *
 * <p>
 * Resolution and template problems are thrown
 * ({@link NoAvailableExecutorsException}, {@link UnknownExecutorException},
 * {@link me.golemcore.bridge.domain.exception.TemplateException}). Problems
 * with the process itself come back inside the {@link ExecutionResult}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommandExecutionService {

    private final CommandRegistry registry;
    private final TemplateRenderer renderer;
    private final ShellCommandRunner runner;

    public ExecutionResult run(ParsedCommandRequest request) {
        return run(request, registry);
    }

    public ExecutionResult run(ParsedCommandRequest request, CommandRegistry executors) {
        if (executors.isEmpty()) {
            throw new NoAvailableExecutorsException();
        }
        CommandTemplate template = executors.lookup(request.name())
                .orElseThrow(() -> new UnknownExecutorException(request.name()));

        String commandLine = renderer.render(template.template(), request.payload());
        log.info("[Exec] Running executor '{}'", template.name());
        log.debug("[Exec] Command line: {}", commandLine);
        return runner.run(template.name(), commandLine);
    }
}

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

package me.golemcore.bridge.adapter.inbound.slack;

import me.golemcore.bridge.adapter.inbound.slack.event.InboundEvent;
import me.golemcore.bridge.domain.exception.CommandException;
import me.golemcore.bridge.domain.exception.NoCodeBlockException;
import me.golemcore.bridge.domain.model.ExecutionResult;
import me.golemcore.bridge.domain.model.ParsedCommandRequest;
import me.golemcore.bridge.domain.service.CommandExecutionService;
import me.golemcore.bridge.domain.service.CommandRequestParser;
import me.golemcore.bridge.domain.service.ReplyFormatter;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.outbound.ChatPoster;
import me.golemcore.bridge.security.AllowlistValidator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns a command-carrying chat message into a shell run and a reply.
 *
 * <p>
 * {@link #handle(InboundEvent.CommandMessage)} runs the whole path on the
 * calling thread: authorize, parse, execute, reply. It never throws; every
 * failure is logged and reported back in the message thread. The one silent
 * case is a plain channel message without a code block, which is ordinary
 * conversation rather than a command.
 *
 * <p>
 * {@link #submit(InboundEvent.CommandMessage)} hands the same work to a
 * bounded worker pool ({@code bridge.execution.workers} threads,
 * {@code bridge.execution.queue-capacity} waiting tasks). When the queue is
 * full the message is answered with a busy reply instead.
 */
@Component
@Slf4j
public class SlackCommandHandler {

    private final CommandRequestParser parser;
    private final CommandExecutionService executionService;
    private final ChatPoster chatPoster;
    private final ReplyFormatter replyFormatter;
    private final AllowlistValidator allowlistValidator;
    private final ThreadPoolExecutor workers;

    public SlackCommandHandler(CommandRequestParser parser, CommandExecutionService executionService,
            ChatPoster chatPoster, ReplyFormatter replyFormatter, AllowlistValidator allowlistValidator,
            BridgeProperties properties) {
        this.parser = parser;
        this.executionService = executionService;
        this.chatPoster = chatPoster;
        this.replyFormatter = replyFormatter;
        this.allowlistValidator = allowlistValidator;

        BridgeProperties.ExecutionProperties execution = properties.getExecution();
        int poolSize = Math.max(1, execution.getWorkers());
        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, execution.getQueueCapacity())),
                runnable -> {
                    Thread thread = new Thread(runnable, "command-worker-" + threadCounter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("[Exec] Command workers did not finish within timeout, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public void submit(InboundEvent.CommandMessage message) {
        try {
            workers.execute(() -> handle(message));
        } catch (RejectedExecutionException e) {
            log.warn("[Exec] Worker pool saturated, rejecting message {} in {}", message.ts(), message.channel());
            reply(message, replyFormatter.busy());
        }
    }

    public void handle(InboundEvent.CommandMessage message) {
        if (!allowlistValidator.isAllowed(message.user())) {
            reply(message, replyFormatter.unauthorized());
            return;
        }

        ParsedCommandRequest request;
        try {
            request = parser.extractRequest(message.text());
        } catch (NoCodeBlockException e) {
            if (message instanceof InboundEvent.Mention) {
                log.info("[Exec] Mention {} carries no code block", message.ts());
                reply(message, replyFormatter.rejected(e));
            } else {
                log.debug("[Exec] Message {} carries no code block, ignoring", message.ts());
            }
            return;
        } catch (CommandException e) {
            log.warn("[Exec] Rejected message {}: {}", message.ts(), e.getMessage());
            reply(message, replyFormatter.rejected(e));
            return;
        }

        ExecutionResult result;
        try {
            result = executionService.run(request);
        } catch (CommandException e) {
            log.warn("[Exec] Cannot run executor '{}': {}", request.name(), e.getMessage());
            reply(message, replyFormatter.rejected(e));
            return;
        } catch (RuntimeException e) {
            log.error("[Exec] Unexpected failure running executor '{}'", request.name(), e);
            reply(message, replyFormatter.internalError(e.getMessage()));
            return;
        }

        if (result.isSuccess()) {
            reply(message, replyFormatter.success(result));
        } else {
            log.warn("[Exec] Executor '{}' failed: {}", request.name(), result.getError());
            reply(message, replyFormatter.failure(result));
        }
    }

    private void reply(InboundEvent.CommandMessage message, String text) {
        try {
            chatPoster.post(message.channel(), text, message.replyThread()).join();
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.warn("[Slack] Failed to post reply to {}: {}", message.channel(), cause.getMessage());
        }
    }
}

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

import me.golemcore.bridge.adapter.inbound.slack.SocketModeFrameParser.ParsedFrame;
import me.golemcore.bridge.adapter.inbound.slack.dto.SocketModeFrame;
import me.golemcore.bridge.adapter.inbound.slack.event.InboundEvent;
import me.golemcore.bridge.adapter.inbound.slack.event.SlackEventClassifier;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.inbound.ChannelPort;
import me.golemcore.bridge.port.outbound.ConnectionProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Slack Socket Mode channel: owns the WebSocket connection and dispatches
 * every received frame.
 *
 * <p>
 * Frames are handled one at a time in arrival order:
 * <ul>
 * <li>{@code hello} and {@code disconnect} notices are logged, nothing is
 * sent back</li>
 * <li>mentions and channel messages go to the {@link SlackCommandHandler}</li>
 * <li>reactions, deletions, thread replies and unrecognized events are logged
 * only</li>
 * <li>a frame that fails typed parsing is acknowledged if an
 * {@code envelope_id} can still be recovered from it</li>
 * </ul>
 * Every envelope is acknowledged exactly once with
 * {@code {"envelope_id": "..."}}, whether or not its content was understood or
 * its command succeeded. Frames are dispatched one at a time by a single thread
 * per mode, so acknowledgements leave in the order frames arrived.
 *
 * <p>
 * With {@code bridge.execution.async=true} frames are handled on the transport
 * reader thread: the envelope is acknowledged first and the command runs on the
 * handler's worker pool. Otherwise frames are queued to a single dispatch
 * thread that runs each command and acknowledges it after the reply, so later
 * envelopes wait for the running command while the transport keeps answering
 * pings.
 *
 * <p>
 * A failure to obtain the endpoint, a transport error, an unexpected close or
 * a failed acknowledgement write moves the connection to
 * {@link ConnectionState#CLOSED} and fails {@link #awaitTermination()}. There
 * is no reconnect; the process is expected to be restarted by its supervisor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlackSocketModeAdapter implements ChannelPort, SocketModeListener {

    private static final String CHANNEL_TYPE = "slack";
    private static final int NORMAL_CLOSURE = 1000;

    private final ConnectionProvider connectionProvider;
    private final SocketModeTransport transport;
    private final SocketModeFrameParser frameParser;
    private final SlackEventClassifier eventClassifier;
    private final SlackCommandHandler commandHandler;
    private final BridgeProperties properties;
    private final ObjectMapper objectMapper;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private final Object lifecycleLock = new Object();
    private volatile SocketConnection connection;
    private volatile boolean stopRequested = false;

    private final ExecutorService sequentialDispatcher = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "socket-mode-dispatch");
        thread.setDaemon(true);
        return thread;
    });

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (!state.compareAndSet(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING)) {
                log.debug("[Slack] Start ignored in state {}", state.get());
                return;
            }

            String appToken = properties.getSlack().getAppToken();
            String url;
            try {
                url = connectionProvider.open(appToken);
            } catch (RuntimeException e) {
                fail(new SocketModeException("Could not obtain Socket Mode endpoint", e));
                throw e;
            }

            log.info("[Slack] Connecting to Socket Mode endpoint");
            connection = transport.connect(url, this);
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            stopRequested = true;
            ConnectionState previous = state.getAndSet(ConnectionState.CLOSED);
            SocketConnection current = connection;
            if (current != null && previous != ConnectionState.CLOSED) {
                current.close(NORMAL_CLOSURE, "shutdown");
                log.info("[Slack] Socket Mode connection closed");
            }
            termination.complete(null);
            sequentialDispatcher.shutdown();
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        ConnectionState current = state.get();
        return current == ConnectionState.CONNECTED || current == ConnectionState.DISPATCHING;
    }

    @Override
    public void awaitTermination() {
        try {
            termination.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    public ConnectionState getState() {
        return state.get();
    }

    // ==================== transport callbacks ====================

    @Override
    public void onOpen(int httpStatus, List<String> headerNames) {
        if (!state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.CONNECTED)) {
            log.warn("[Slack] Connection opened in unexpected state {}", state.get());
            return;
        }
        log.info("[Slack] Connected to the server");
        log.info("[Slack] Response HTTP code: {}", httpStatus);
        log.info("[Slack] Response contains the following headers:");
        for (String header : headerNames) {
            log.info("[Slack] * {}", header);
        }
    }

    @Override
    public void onText(String text) {
        if (!isRunning()) {
            log.warn("[Slack] Dropping frame received in state {}", state.get());
            return;
        }
        if (properties.getExecution().isAsync()) {
            dispatchFrame(text);
            return;
        }
        try {
            sequentialDispatcher.execute(() -> dispatchFrame(text));
        } catch (RejectedExecutionException e) {
            log.warn("[Slack] Dropping frame, dispatcher is shut down");
        }
    }

    private void dispatchFrame(String text) {
        if (!state.compareAndSet(ConnectionState.CONNECTED, ConnectionState.DISPATCHING)) {
            log.warn("[Slack] Dropping frame dispatched in state {}", state.get());
            return;
        }
        try {
            handleFrame(text);
        } catch (SocketModeException e) {
            fail(e);
            SocketConnection current = connection;
            if (current != null) {
                current.close(NORMAL_CLOSURE, "acknowledgement failed");
            }
        } finally {
            state.compareAndSet(ConnectionState.DISPATCHING, ConnectionState.CONNECTED);
        }
    }

    @Override
    public void onFailure(Throwable error) {
        log.error("[Slack] Socket Mode transport failed: {}", error.getMessage());
        fail(new SocketModeException("Socket Mode transport failed", error));
    }

    @Override
    public void onClosed(int code, String reason) {
        if (stopRequested) {
            state.set(ConnectionState.CLOSED);
            termination.complete(null);
            return;
        }
        log.warn("[Slack] Connection closed by server: {} {}", code, reason);
        fail(new SocketModeException("Socket Mode connection closed by server: " + code + " " + reason));
    }

    // ==================== dispatch ====================

    void handleFrame(String text) {
        ParsedFrame parsed = frameParser.parse(text);
        if (parsed.isMalformed()) {
            handleMalformed(parsed, text);
            return;
        }

        SocketModeFrame frame = parsed.frame();
        if (frame.isHello()) {
            log.info("[Slack] Received hello: connections={}, connection_info={}",
                    frame.getNumConnections(), frame.getConnectionInfo());
            return;
        }
        if (frame.isDisconnect()) {
            log.info("[Slack] Received disconnect notice: reason={}", frame.getReason());
            return;
        }

        String envelopeId = frame.getEnvelopeId();
        if (frame.getRetryAttempt() != null && frame.getRetryAttempt() > 0) {
            log.info("[Slack] Envelope [{}] is retry #{} ({})", envelopeId, frame.getRetryAttempt(),
                    frame.getRetryReason());
        }

        InboundEvent event = eventClassifier.classify(frame.getPayload().getEvent());
        dispatch(envelopeId, event);
    }

    private void dispatch(String envelopeId, InboundEvent event) {
        if (event instanceof InboundEvent.CommandMessage message) {
            log.info("[Slack] Received channel message [{}]: {}", envelopeId, message.text());
            if (properties.getExecution().isAsync()) {
                acknowledge(envelopeId);
                commandHandler.submit(message);
            } else {
                handleInline(envelopeId, message);
                acknowledge(envelopeId);
            }
        } else if (event instanceof InboundEvent.ReactionUpdated reaction) {
            log.info("[Slack] Received reaction update [{}]: {} - {}", envelopeId, reaction.type(),
                    reaction.reaction());
            acknowledge(envelopeId);
        } else if (event instanceof InboundEvent.MessageDeleted deleted) {
            log.info("[Slack] Received message deletion [{}]: {} in {}", envelopeId, deleted.deletedTs(),
                    deleted.channel());
            acknowledge(envelopeId);
        } else if (event instanceof InboundEvent.ThreadReply reply) {
            log.debug("[Slack] Ignoring thread reply [{}] in {}", envelopeId, reply.channel());
            acknowledge(envelopeId);
        } else {
            InboundEvent.Unrecognized unrecognized = (InboundEvent.Unrecognized) event;
            log.warn("[Slack] Unhandled event [{}]: type={}, subtype={}", envelopeId, unrecognized.type(),
                    unrecognized.subtype());
            acknowledge(envelopeId);
        }
    }

    private void handleInline(String envelopeId, InboundEvent.CommandMessage message) {
        try {
            commandHandler.handle(message);
        } catch (RuntimeException e) {
            log.error("[Slack] Command handling failed for envelope [{}]", envelopeId, e);
        }
    }

    private void handleMalformed(ParsedFrame parsed, String text) {
        if (parsed.recoveredEnvelopeId() == null) {
            log.warn("[Slack] Unexpected frame format ({}), nothing to acknowledge. Raw frame: {}",
                    parsed.failure(), text);
            return;
        }
        log.warn("[Slack] Unexpected frame format ({}), acknowledging recovered envelope [{}]",
                parsed.failure(), parsed.recoveredEnvelopeId());
        acknowledge(parsed.recoveredEnvelopeId());
    }

    void acknowledge(String envelopeId) {
        SocketConnection current = connection;
        if (current == null) {
            throw new SocketModeException("Cannot acknowledge envelope [" + envelopeId + "]: not connected");
        }

        String ack;
        try {
            ObjectNode node = objectMapper.createObjectNode();
            node.put(SocketModeFrameParser.ENVELOPE_ID, envelopeId);
            ack = objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new SocketModeException("Cannot encode acknowledgement for [" + envelopeId + "]", e);
        }

        if (!current.send(ack)) {
            throw new SocketModeException("Failed to send acknowledgement for [" + envelopeId + "]");
        }
        log.info("[Slack] Acked envelope [{}]", envelopeId);
    }

    private void fail(SocketModeException error) {
        state.set(ConnectionState.CLOSED);
        if (termination.completeExceptionally(error)) {
            log.error("[Slack] Socket Mode session terminated: {}", error.getMessage());
        }
    }
}

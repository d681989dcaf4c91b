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

import me.golemcore.bridge.adapter.inbound.slack.dto.SocketModeFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parses Socket Mode text frames.
 *
 * <p>
 * The typed attempt binds the frame onto {@link SocketModeFrame}. An enveloped
 * frame (anything but {@code hello}/{@code disconnect}) additionally needs an
 * {@code envelope_id} and a {@code payload}. When the typed attempt fails, a
 * second untyped read looks for a top-level {@code envelope_id} so the frame
 * can still be acknowledged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SocketModeFrameParser {

    static final String ENVELOPE_ID = "envelope_id";

    private final ObjectMapper objectMapper;

    public ParsedFrame parse(String text) {
        String typedFailure;
        try {
            SocketModeFrame frame = objectMapper.readValue(text, SocketModeFrame.class);
            if (frame == null) {
                typedFailure = "empty frame";
            } else if (frame.isHello() || frame.isDisconnect()) {
                return ParsedFrame.typed(frame);
            } else if (frame.getEnvelopeId() == null) {
                typedFailure = "missing envelope_id";
            } else if (frame.getPayload() == null) {
                typedFailure = "missing payload";
            } else {
                return ParsedFrame.typed(frame);
            }
        } catch (JsonProcessingException e) {
            typedFailure = e.getOriginalMessage();
        }

        log.debug("[Slack] Typed frame parse failed ({}), trying untyped lookup", typedFailure);
        return ParsedFrame.malformed(recoverEnvelopeId(text), typedFailure);
    }

    String recoverEnvelopeId(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node == null) {
                return null;
            }
            JsonNode envelopeId = node.path(ENVELOPE_ID);
            if (envelopeId.isTextual() && !envelopeId.asText().isEmpty()) {
                return envelopeId.asText();
            }
            return null;
        } catch (JsonProcessingException e) {
            log.debug("[Slack] Frame is not structured text: {}", e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Result of parsing one frame: either a typed frame, or the reason the
     * typed attempt failed plus an envelope id recovered from the raw text.
     */
    public record ParsedFrame(SocketModeFrame frame, String recoveredEnvelopeId, String failure) {

        static ParsedFrame typed(SocketModeFrame frame) {
            return new ParsedFrame(frame, null, null);
        }

        static ParsedFrame malformed(String recoveredEnvelopeId, String failure) {
            return new ParsedFrame(null, recoveredEnvelopeId, failure);
        }

        public boolean isMalformed() {
            return frame == null;
        }
    }
}

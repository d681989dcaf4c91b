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

package me.golemcore.bridge.adapter.inbound.slack.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A text frame received over the Socket Mode WebSocket.
 *
 * <p>
 * {@code hello} and {@code disconnect} frames are connection notices; every
 * other type ({@code events_api}, {@code slash_commands}, {@code interactive})
 * is an envelope carrying {@code envelope_id} and a {@code payload}, and must
 * be acknowledged. Properties not modelled here are kept in
 * {@link #getAdditional()}.
 */
@Data
@NoArgsConstructor
public class SocketModeFrame {

    public static final String TYPE_HELLO = "hello";
    public static final String TYPE_DISCONNECT = "disconnect";
    public static final String TYPE_EVENTS_API = "events_api";

    private String type;

    @JsonProperty("envelope_id")
    private String envelopeId;

    private EventsApiPayload payload;

    @JsonProperty("accepts_response_payload")
    private Boolean acceptsResponsePayload;

    @JsonProperty("retry_attempt")
    private Integer retryAttempt;

    @JsonProperty("retry_reason")
    private String retryReason;

    @JsonProperty("num_connections")
    private Integer numConnections;

    @JsonProperty("debug_info")
    private Map<String, Object> debugInfo;

    @JsonProperty("connection_info")
    private Map<String, Object> connectionInfo;

    /** Set on {@code disconnect} frames: refresh_requested, warning, link_disabled. */
    private String reason;

    @Getter(AccessLevel.NONE)
    private Map<String, Object> additional = new LinkedHashMap<>();

    public boolean isHello() {
        return TYPE_HELLO.equals(type);
    }

    public boolean isDisconnect() {
        return TYPE_DISCONNECT.equals(type);
    }

    @JsonAnySetter
    public void putAdditional(String name, Object value) {
        additional.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditional() {
        return additional;
    }
}

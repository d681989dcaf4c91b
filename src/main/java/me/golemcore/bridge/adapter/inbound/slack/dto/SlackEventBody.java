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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Union of the event fields the bridge reads from {@code app_mention},
 * {@code message} (including the {@code message_deleted} subtype) and
 * {@code reaction_added}/{@code reaction_removed} events. Fields that do not
 * apply to an event type stay {@code null}; anything else lands in
 * {@link #getAdditional()}.
 */
@Data
@NoArgsConstructor
public class SlackEventBody {

    private String type;
    private String subtype;
    private String text;
    private String user;
    private String channel;
    private String team;
    private String ts;

    @JsonProperty("thread_ts")
    private String threadTs;

    @JsonProperty("parent_user_id")
    private String parentUserId;

    @JsonProperty("event_ts")
    private String eventTs;

    @JsonProperty("channel_type")
    private String channelType;

    @JsonProperty("client_msg_id")
    private String clientMsgId;

    @JsonProperty("bot_id")
    private String botId;

    private Boolean hidden;

    @JsonProperty("deleted_ts")
    private String deletedTs;

    @JsonProperty("previous_message")
    private JsonNode previousMessage;

    private String reaction;
    private ReactionItem item;

    @JsonProperty("item_user")
    private String itemUser;

    @Getter(AccessLevel.NONE)
    private Map<String, Object> additional = new LinkedHashMap<>();

    @JsonAnySetter
    public void putAdditional(String name, Object value) {
        additional.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditional() {
        return additional;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReactionItem {
        private String type;
        private String channel;
        private String ts;
    }
}

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

package me.golemcore.bridge.adapter.inbound.slack.event;

import me.golemcore.bridge.adapter.inbound.slack.dto.SlackEventBody;

/**
 * Closed set of event shapes the dispatcher routes on. Anything that does not
 * match a known shape becomes {@link Unrecognized} and is acknowledged without
 * further processing.
 */
public sealed interface InboundEvent {

    /** Raw event as received, including fields not modelled here. */
    SlackEventBody body();

    /**
     * An event whose text may carry a command block.
     */
    sealed interface CommandMessage extends InboundEvent {

        String channel();

        String user();

        String text();

        String ts();

        String threadTs();

        /**
         * Thread the reply belongs in: the existing thread if the message was
         * posted in one, otherwise a new thread under the message itself.
         */
        default String replyThread() {
            return threadTs() != null ? threadTs() : ts();
        }
    }

    record Mention(String channel, String user, String text, String ts, String threadTs,
            SlackEventBody body) implements CommandMessage {
    }

    record ChannelMessage(String channel, String user, String text, String ts, String threadTs,
            SlackEventBody body) implements CommandMessage {
    }

    record MessageDeleted(String channel, String deletedTs, SlackEventBody body) implements InboundEvent {
    }

    record ReactionUpdated(String type, String user, String reaction, String itemChannel, String itemTs,
            SlackEventBody body) implements InboundEvent {
    }

    record ThreadReply(String channel, String user, String ts, String threadTs,
            SlackEventBody body) implements InboundEvent {
    }

    record Unrecognized(String type, String subtype, SlackEventBody body) implements InboundEvent {
    }
}

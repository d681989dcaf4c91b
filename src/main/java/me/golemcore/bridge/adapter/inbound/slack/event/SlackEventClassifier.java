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
import org.springframework.stereotype.Component;

/**
 * Maps a raw Events API event onto an {@link InboundEvent} variant by its
 * {@code type} and {@code subtype}.
 *
 * <p>
 * Messages posted by bots (including this one) and replies inside a thread
 * classify as {@link InboundEvent.ThreadReply}, so replies to a command never
 * trigger another run.
 */
@Component
public class SlackEventClassifier {

    static final String APP_MENTION = "app_mention";
    static final String MESSAGE = "message";
    static final String REACTION_ADDED = "reaction_added";
    static final String REACTION_REMOVED = "reaction_removed";
    static final String SUBTYPE_DELETED = "message_deleted";
    static final String SUBTYPE_BOT = "bot_message";
    static final String SUBTYPE_REPLIED = "message_replied";
    static final String SUBTYPE_THREAD_BROADCAST = "thread_broadcast";

    public InboundEvent classify(SlackEventBody event) {
        if (event == null || event.getType() == null) {
            return new InboundEvent.Unrecognized(null, null, event);
        }

        switch (event.getType()) {
            case APP_MENTION:
                if (event.getText() == null) {
                    return unrecognized(event);
                }
                return new InboundEvent.Mention(event.getChannel(), event.getUser(), unescape(event.getText()),
                        event.getTs(), event.getThreadTs(), event);
            case MESSAGE:
                return classifyMessage(event);
            case REACTION_ADDED:
            case REACTION_REMOVED:
                SlackEventBody.ReactionItem item = event.getItem();
                return new InboundEvent.ReactionUpdated(event.getType(), event.getUser(), event.getReaction(),
                        item != null ? item.getChannel() : null, item != null ? item.getTs() : null, event);
            default:
                return unrecognized(event);
        }
    }

    private InboundEvent classifyMessage(SlackEventBody event) {
        String subtype = event.getSubtype();
        if (SUBTYPE_DELETED.equals(subtype)) {
            return new InboundEvent.MessageDeleted(event.getChannel(), event.getDeletedTs(), event);
        }
        if (event.getBotId() != null || SUBTYPE_BOT.equals(subtype) || SUBTYPE_REPLIED.equals(subtype)
                || SUBTYPE_THREAD_BROADCAST.equals(subtype) || isInThread(event)) {
            return new InboundEvent.ThreadReply(event.getChannel(), event.getUser(), event.getTs(),
                    event.getThreadTs(), event);
        }
        if (subtype != null || event.getText() == null) {
            return unrecognized(event);
        }
        return new InboundEvent.ChannelMessage(event.getChannel(), event.getUser(), unescape(event.getText()),
                event.getTs(), event.getThreadTs(), event);
    }

    private boolean isInThread(SlackEventBody event) {
        return event.getThreadTs() != null && !event.getThreadTs().equals(event.getTs());
    }

    private InboundEvent unrecognized(SlackEventBody event) {
        return new InboundEvent.Unrecognized(event.getType(), event.getSubtype(), event);
    }

    /**
     * Reverses Slack's escaping of {@code &}, {@code <} and {@code >} in
     * message text.
     */
    static String unescape(String text) {
        return text.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&amp;", "&");
    }
}

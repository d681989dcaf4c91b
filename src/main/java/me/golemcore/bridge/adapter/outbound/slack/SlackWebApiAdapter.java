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

package me.golemcore.bridge.adapter.outbound.slack;

import me.golemcore.bridge.adapter.outbound.slack.dto.ChatPostMessageRequest;
import me.golemcore.bridge.adapter.outbound.slack.dto.ChatPostMessageResponse;
import me.golemcore.bridge.adapter.outbound.slack.dto.ConnectionsOpenResponse;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.infrastructure.http.FeignClientFactory;
import me.golemcore.bridge.port.outbound.ChatPoster;
import me.golemcore.bridge.port.outbound.ConnectionProvider;
import feign.FeignException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Slack Web API adapter backing both outbound ports.
 *
 * <p>
 * {@code apps.connections.open} is called with the app-level token to obtain a
 * Socket Mode endpoint; {@code chat.postMessage} is called with the bot token
 * to post replies. Slack reports most failures as HTTP 200 with
 * {@code "ok": false}; both those and HTTP errors surface as
 * {@link SlackApiException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlackWebApiAdapter implements ConnectionProvider, ChatPoster {

    static final String OPEN_METHOD = "apps.connections.open";
    static final String POST_METHOD = "chat.postMessage";

    private final FeignClientFactory feignClientFactory;
    private final BridgeProperties properties;

    private SlackWebApi api;

    @PostConstruct
    public void init() {
        String baseUrl = properties.getSlack().getApiBaseUrl();
        this.api = feignClientFactory.create(SlackWebApi.class, baseUrl);
        log.debug("[Slack] Web API client targets {}", baseUrl);
    }

    @Override
    public String open(String credential) {
        ConnectionsOpenResponse response;
        try {
            response = api.openConnection(credential);
        } catch (FeignException e) {
            throw new SlackApiException(OPEN_METHOD, "HTTP " + e.status(), e);
        }
        if (response == null || !response.isOk()) {
            throw new SlackApiException(OPEN_METHOD, response != null ? response.getError() : "empty response");
        }
        if (response.getUrl() == null || response.getUrl().isBlank()) {
            throw new SlackApiException(OPEN_METHOD, "response carried no url");
        }

        String url = response.getUrl();
        if (properties.getSlack().isDebugReconnects()) {
            url = url + (url.contains("?") ? "&" : "?") + "debug_reconnects=true";
        }
        log.info("[Slack] Obtained Socket Mode endpoint");
        return url;
    }

    @Override
    public CompletableFuture<String> post(String channel, String text, String threadId) {
        ChatPostMessageRequest request = ChatPostMessageRequest.builder()
                .channel(channel)
                .text(text)
                .threadTs(threadId)
                .build();
        return CompletableFuture.supplyAsync(() -> {
            ChatPostMessageResponse response;
            try {
                response = api.postMessage(properties.getSlack().getBotToken(), request);
            } catch (FeignException e) {
                throw new SlackApiException(POST_METHOD, "HTTP " + e.status(), e);
            }
            if (response == null || !response.isOk()) {
                throw new SlackApiException(POST_METHOD, response != null ? response.getError() : "empty response");
            }
            log.debug("[Slack] Posted reply to {} (thread={}): ts={}", channel, threadId, response.getTs());
            return response.getTs();
        });
    }
}

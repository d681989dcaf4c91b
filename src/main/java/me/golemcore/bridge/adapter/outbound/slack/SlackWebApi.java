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
import feign.Headers;
import feign.Param;
import feign.RequestLine;

/**
 * Slack Web API methods used by the bridge.
 */
interface SlackWebApi {

    @RequestLine("POST /apps.connections.open")
    @Headers({
            "Authorization: Bearer {token}",
            "Content-Type: application/x-www-form-urlencoded"
    })
    ConnectionsOpenResponse openConnection(@Param("token") String token);

    @RequestLine("POST /chat.postMessage")
    @Headers({
            "Authorization: Bearer {token}",
            "Content-Type: application/json; charset=utf-8"
    })
    ChatPostMessageResponse postMessage(@Param("token") String token, ChatPostMessageRequest request);
}

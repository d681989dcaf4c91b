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

package me.golemcore.bridge.port.outbound;

/**
 * Port for obtaining a streaming connection endpoint from the chat platform.
 * Wraps the platform's authenticated "open a connection" call.
 */
public interface ConnectionProvider {

    /**
     * Requests a fresh WebSocket endpoint URL for the given app-level
     * credential.
     *
     * @param credential
     *            app-level token
     * @return single-use endpoint URL
     * @throws me.golemcore.bridge.adapter.outbound.slack.SlackApiException
     *             if the platform rejects the credential or the call fails
     */
    String open(String credential);
}

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

/**
 * An open Socket Mode connection, owned by the dispatcher.
 */
public interface SocketConnection {

    /**
     * Queues a text frame.
     *
     * @return {@code false} if the connection is closing or its outgoing
     *         buffer is full
     */
    boolean send(String text);

    void close(int code, String reason);
}

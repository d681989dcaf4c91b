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

package me.golemcore.bridge.port.inbound;

/**
 * Inbound chat channel delivering command messages. Implementations own the
 * connection lifecycle.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "slack").
     */
    String getChannelType();

    /**
     * Connects and starts receiving events.
     */
    void start();

    /**
     * Closes the connection. Idempotent.
     */
    void stop();

    /**
     * Checks if the channel is currently connected.
     */
    boolean isRunning();

    /**
     * Blocks until the channel has terminated. Returns normally after
     * {@link #stop()}; throws the fatal error if the connection failed.
     */
    void awaitTermination();
}

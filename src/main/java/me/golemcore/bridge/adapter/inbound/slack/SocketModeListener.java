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

import java.util.List;

/**
 * Callbacks from a Socket Mode transport. Text frames are delivered one at a
 * time; the next frame is not read until {@link #onText(String)} returns.
 */
public interface SocketModeListener {

    void onOpen(int httpStatus, List<String> headerNames);

    void onText(String text);

    /**
     * Hard transport failure (handshake rejected, connection reset, read
     * error). No further callbacks follow.
     */
    void onFailure(Throwable error);

    void onClosed(int code, String reason);
}

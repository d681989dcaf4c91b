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
 * Fatal Socket Mode failure: the endpoint could not be obtained, the
 * connection broke, or an acknowledgement could not be written.
 */
public class SocketModeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SocketModeException(String message) {
        super(message);
    }

    public SocketModeException(String message, Throwable cause) {
        super(message, cause);
    }
}

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

import lombok.Getter;

/**
 * Failure of a Slack Web API call: either a non-2xx HTTP status or a 200
 * response with {@code "ok": false}.
 */
@Getter
public class SlackApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String method;
    /** Slack error string such as {@code invalid_auth}, or {@code null} for HTTP failures. */
    private final String error;

    public SlackApiException(String method, String error) {
        super(method + " failed: " + error);
        this.method = method;
        this.error = error;
    }

    public SlackApiException(String method, String message, Throwable cause) {
        super(method + " failed: " + message, cause);
        this.method = method;
        this.error = null;
    }
}

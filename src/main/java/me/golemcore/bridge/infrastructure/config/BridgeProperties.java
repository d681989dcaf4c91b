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

package me.golemcore.bridge.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the bridge, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code bridge.*} prefix:
 * <ul>
 * <li>{@link SlackProperties} - Socket Mode and Web API credentials</li>
 * <li>{@code executors} - executor name to command template</li>
 * <li>{@link ExecutionProperties} - shell invocation and worker pool</li>
 * <li>{@link SecurityProperties} - sender allowlist</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bridge")
@Data
public class BridgeProperties {

    private SlackProperties slack = new SlackProperties();
    private Map<String, String> executors = new LinkedHashMap<>();
    private ExecutionProperties execution = new ExecutionProperties();
    private SecurityProperties security = new SecurityProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class SlackProperties {
        private String appToken;
        private String botToken;
        private String apiBaseUrl = "https://slack.com/api";
        private long pingInterval = 30000;
        private boolean debugReconnects = false;
    }

    @Data
    public static class ExecutionProperties {
        private boolean async = true;
        private int workers = 2;
        private int queueCapacity = 16;
        /** Zero disables the timeout. */
        private int timeoutSeconds = 0;
        private String shell = "/bin/sh";
        private String shellFlag = "-c";
        private String workingDirectory;
        private int maxOutputLength = 100_000;
    }

    @Data
    public static class SecurityProperties {
        private List<String> allowedUsers = new ArrayList<>();
        private List<String> blockedUsers = new ArrayList<>();
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}

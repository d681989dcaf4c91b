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

package me.golemcore.bridge.security;

import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides whether a Slack user may trigger executors.
 *
 * <p>
 * Blocked users are always denied. With an empty allowlist every user who can
 * post in a channel the app is in is allowed (fail-open, Slack workspace
 * membership is the only gate); otherwise only listed user IDs are.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AllowlistValidator {

    private final BridgeProperties properties;

    public boolean isAllowed(String userId) {
        log.trace("[Security] Allowlist check: user={}", userId);
        if (isBlocked(userId)) {
            return false;
        }

        List<String> allowedUsers = properties.getSecurity().getAllowedUsers();
        if (allowedUsers == null || allowedUsers.isEmpty()) {
            return true;
        }

        boolean allowed = userId != null && allowedUsers.contains(userId);
        if (!allowed) {
            log.warn("[Security] Unauthorized user: {}", userId);
        }
        return allowed;
    }

    public boolean isBlocked(String userId) {
        List<String> blockedUsers = properties.getSecurity().getBlockedUsers();
        if (blockedUsers == null || blockedUsers.isEmpty() || userId == null) {
            return false;
        }
        boolean blocked = blockedUsers.contains(userId);
        if (blocked) {
            log.warn("[Security] Blocked user: {}", userId);
        }
        return blocked;
    }
}

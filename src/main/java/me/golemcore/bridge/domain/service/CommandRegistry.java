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

package me.golemcore.bridge.domain.service;

import me.golemcore.bridge.domain.model.CommandTemplate;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup of named command templates.
 *
 * <p>
 * Built once from configuration and never mutated afterwards, so concurrent
 * reads from execution workers need no locking. When the same name is loaded
 * twice the later template wins.
 *
 * @since 1.0
 */
@Slf4j
public final class CommandRegistry {

    private final Map<String, CommandTemplate> templates;

    public CommandRegistry(Collection<CommandTemplate> loaded) {
        Map<String, CommandTemplate> byName = new LinkedHashMap<>();
        for (CommandTemplate template : loaded) {
            CommandTemplate previous = byName.put(template.name(), template);
            if (previous != null) {
                log.warn("[Registry] Duplicate executor '{}', keeping the last definition", template.name());
            }
        }
        this.templates = Collections.unmodifiableMap(byName);
    }

    /**
     * Builds a registry from a name to template mapping, as bound from
     * configuration.
     */
    public static CommandRegistry fromMap(Map<String, String> executors) {
        List<CommandTemplate> loaded = executors.entrySet().stream()
                .map(entry -> new CommandTemplate(entry.getKey(), entry.getValue()))
                .toList();
        return new CommandRegistry(loaded);
    }

    public static CommandRegistry empty() {
        return new CommandRegistry(List.of());
    }

    public Optional<CommandTemplate> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(templates.get(name));
    }

    public boolean isEmpty() {
        return templates.isEmpty();
    }

    public int size() {
        return templates.size();
    }

    public Set<String> names() {
        return templates.keySet();
    }

    public Collection<CommandTemplate> templates() {
        return templates.values();
    }
}

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

package me.golemcore.bridge.domain.model;

/**
 * Named shell command template. The template carries a single
 * {@code {{payload}}} placeholder that is replaced with the text of the
 * incoming request.
 */
public record CommandTemplate(String name, String template) {

    public CommandTemplate {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Executor name must not be blank");
        }
        if (template == null) {
            throw new IllegalArgumentException("Template for executor '" + name + "' must not be null");
        }
    }
}

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
 * Command request extracted from a chat message: the executor name selected by
 * the {@code # executor:} directive and the concatenated payload lines.
 *
 * <p>
 * The name may be empty when the block carried no executor directive; lookup
 * then fails downstream like any other unknown name.
 */
public record ParsedCommandRequest(String name, String payload) {

    public ParsedCommandRequest {
        name = name != null ? name : "";
        payload = payload != null ? payload : "";
    }
}

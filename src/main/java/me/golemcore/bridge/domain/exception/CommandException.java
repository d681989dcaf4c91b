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

package me.golemcore.bridge.domain.exception;

/**
 * Base type for errors raised while turning a chat message into a shell
 * command. These are recovered by the caller: the triggering message is still
 * acknowledged and the user gets a diagnostic reply.
 */
public abstract class CommandException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final CommandErrorCode code;

    protected CommandException(CommandErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CommandErrorCode getCode() {
        return code;
    }
}

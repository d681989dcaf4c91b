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

import me.golemcore.bridge.domain.exception.TemplateException;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes a payload into a command template.
 *
 * <p>
 * Templates use a single placeholder, {@code {{payload}}} (inner whitespace
 * allowed). Substitution is literal: the payload is inserted verbatim with no
 * shell escaping, quoting is up to whoever writes the template. The placeholder
 * may appear more than once; every occurrence receives the same payload. Braces
 * that do not form a placeholder, such as jq object literals or awk blocks, are
 * left as they are.
 *
 * <p>
 * A template fails with {@link TemplateException} when it has no placeholder,
 * a trailing {@code {{} that is never closed, or a placeholder naming anything
 * other than {@code payload}.
 */
@Service
public class TemplateRenderer {

    static final String OPEN = "{{";
    static final String CLOSE = "}}";
    static final String PAYLOAD_KEY = "payload";

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{\\s*(\\w+)\\s*}}");

    public String render(String template, String payload) {
        if (template == null) {
            throw new TemplateException(null, "template is missing");
        }
        int lastOpen = template.lastIndexOf(OPEN);
        if (lastOpen >= 0 && template.indexOf(CLOSE, lastOpen + OPEN.length()) < 0) {
            throw new TemplateException(template, "unclosed '" + OPEN + "' at offset " + lastOpen);
        }

        String value = payload != null ? payload : "";
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        StringBuilder rendered = new StringBuilder(template.length() + value.length());
        int placeholders = 0;

        while (matcher.find()) {
            String key = matcher.group(1);
            if (!PAYLOAD_KEY.equals(key)) {
                throw new TemplateException(template, "unknown placeholder '" + key + "'");
            }
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value));
            placeholders++;
        }
        matcher.appendTail(rendered);

        if (placeholders == 0) {
            throw new TemplateException(template, "no " + OPEN + PAYLOAD_KEY + CLOSE + " placeholder");
        }
        return rendered.toString();
    }

    /**
     * Checks the template syntax without producing output.
     */
    public void validate(String template) {
        render(template, "");
    }
}

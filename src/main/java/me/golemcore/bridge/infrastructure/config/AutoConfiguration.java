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

import me.golemcore.bridge.domain.exception.TemplateException;
import me.golemcore.bridge.domain.model.CommandTemplate;
import me.golemcore.bridge.domain.service.CommandRegistry;
import me.golemcore.bridge.domain.service.TemplateRenderer;
import me.golemcore.bridge.port.inbound.ChannelPort;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration that builds the command registry and runs the bridge
 * on application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link ObjectMapper}</li>
 * <li>Loads the {@link CommandRegistry} from {@code bridge.executors} and
 * checks each template once</li>
 * <li>Verifies the Slack tokens are present</li>
 * <li>Starts every {@link ChannelPort} and blocks until they terminate, so a
 * fatal connection error ends the process with a failure</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BridgeProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public CommandRegistry commandRegistry(TemplateRenderer renderer) {
        CommandRegistry registry = CommandRegistry.fromMap(properties.getExecutors());
        for (CommandTemplate template : registry.templates()) {
            try {
                renderer.validate(template.template());
            } catch (TemplateException e) {
                log.warn("[Registry] Executor '{}' has a malformed template: {}", template.name(), e.getMessage());
            }
        }
        if (registry.isEmpty()) {
            log.warn("[Registry] No executors configured, every command request will be rejected");
        } else {
            log.info("[Registry] Loaded {} executor(s): {}", registry.size(), registry.names());
        }
        return registry;
    }

    @Bean
    public ApplicationRunner channelRunner(List<ChannelPort> channelPorts) {
        return args -> {
            BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
            String version = buildProps != null ? buildProps.getVersion() : "dev";
            log.info("GolemCore Shell Bridge v{} starting...", version);
            requireToken("bridge.slack.app-token", properties.getSlack().getAppToken());
            requireToken("bridge.slack.bot-token", properties.getSlack().getBotToken());

            for (ChannelPort channel : channelPorts) {
                log.info("Starting channel: {}", channel.getChannelType());
                channel.start();
            }
            log.info("GolemCore Shell Bridge started successfully");

            for (ChannelPort channel : channelPorts) {
                channel.awaitTermination();
                log.info("Channel {} terminated", channel.getChannelType());
            }
        };
    }

    static void requireToken(String property, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required property: " + property);
        }
    }
}

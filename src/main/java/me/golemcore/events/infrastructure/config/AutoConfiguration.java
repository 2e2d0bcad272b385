package me.golemcore.events.infrastructure.config;

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

import me.golemcore.events.domain.model.EventScanResult;
import me.golemcore.events.domain.service.ScriptRegistry;
import me.golemcore.events.domain.service.ToolRegistry;
import me.golemcore.events.scheduler.EventEngine;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Spring configuration that loads the job folders and starts the engine on
 * application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Creates the events root when it does not exist yet</li>
 * <li>Loads every job folder, logging the ones that fail</li>
 * <li>Starts the polling loop when {@code events.engine.auto-start} is set</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final EventsProperties properties;
    private final EventEngine engine;
    private final ToolRegistry toolRegistry;
    private final ScriptRegistry scriptRegistry;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        Path root = Path.of(properties.getRoot()).toAbsolutePath().normalize();
        log.info("Event engine starting...");
        log.info("Events root: {}", root);
        log.info("Schedule zone: {}", properties.getEngine().getZone());
        log.info("Tools: {}", toolRegistry.listTools());
        log.info("Scripts: {}", scriptRegistry.listScripts());

        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            log.error("Cannot create events root {}: {}", root, e.getMessage());
            return;
        }

        EventScanResult result = engine.load();
        log.info("Loaded {} event(s)", result.events().size());
        result.failures().forEach((folder, reason) -> log.warn("Skipped {}: {}", folder, reason));

        if (properties.getEngine().isAutoStart()) {
            engine.start();
            log.info("Event engine started");
        } else {
            log.info("Auto-start disabled, engine loop not started");
        }
    }
}

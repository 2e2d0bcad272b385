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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the event engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code events.*} prefix:
 * <ul>
 * <li>{@link EngineProperties} - polling loop and administrative timeouts</li>
 * <li>{@link AuditProperties} - in-memory audit trail</li>
 * <li>{@link ScriptsProperties} - external script execution</li>
 * <li>{@link ToolsProperties} - built-in tools</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "events")
@Data
public class EventsProperties {

    private String root = "events";
    private String manifestFile = "EVENT.md";
    private EngineProperties engine = new EngineProperties();
    private AuditProperties audit = new AuditProperties();
    private ScriptsProperties scripts = new ScriptsProperties();
    private ToolsProperties tools = new ToolsProperties();

    @Data
    public static class EngineProperties {
        private boolean autoStart = true;
        private Duration tickInterval = Duration.ofSeconds(1);
        private String zone = "UTC";
        private Duration commandTimeout = Duration.ofSeconds(10);
        private Duration dispatchTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class AuditProperties {
        private int maxEntries = 500;
    }

    @Data
    public static class ScriptsProperties {
        private boolean processEnabled = true;
        private Duration processTimeout = Duration.ofSeconds(60);
        private Map<String, String> interpreters = new LinkedHashMap<>(Map.of(
                "py", "python3",
                "js", "node",
                "sh", "sh"));
    }

    @Data
    public static class ToolsProperties {
        private MailToolProperties mail = new MailToolProperties();
    }

    @Data
    public static class MailToolProperties {
        private boolean enabled = true;
    }
}

package me.golemcore.events;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the event engine.
 *
 * <p>
 * Each folder under the events root is one scheduled job: an {@code EVENT.md}
 * manifest with a YAML header (type, plain-English schedule, action) and the
 * reference files and scripts the action uses. The engine polls the folders'
 * schedules and dispatches due jobs to registered tools or scripts.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Domain Layer       → ScheduleCompiler, CronMatcher, EventDefinitionLoader, registries
 * Scheduler          → EventEngine (single-owner polling loop + command queue)
 * Infrastructure     → ProcessScriptAdapter, configuration
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code events.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EventsApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventsApplication.class, args);
    }

}

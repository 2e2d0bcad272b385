package me.golemcore.events.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One loaded job folder. Built by
 * {@link me.golemcore.events.domain.service.EventDefinitionLoader}; after
 * creation only {@code active} and {@code schedule} change, and only on the
 * engine thread.
 *
 * <p>
 * {@code resolvedParams} holds the action parameters with in-folder file
 * references replaced by file contents. They are resolved once at load time, so
 * an edited reference file takes effect only after the folder is reloaded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventDefinition {

    private String name;

    @Builder.Default
    private String description = "";

    private EventType eventType;
    private String scheduleRaw;
    private ScheduleRule schedule;
    private EventAction action;

    @Builder.Default
    private Map<String, Object> resolvedParams = new LinkedHashMap<>();

    private boolean active;
    private Path eventDir;

    public boolean isScheduled() {
        return eventType == EventType.SCHEDULED && schedule != null;
    }
}

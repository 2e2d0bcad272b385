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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Administrative command as issued by an outer request layer, e.g.
 * {@code {"action": "fire", "name": "send-team-mail"}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AdminCommand {

    private String action;
    private String name;
    private String event;
    private String description;
    private String schedule;

    @JsonAlias("mcp_tool")
    private String tool;

    private String recipients;
    private String subject;
    private String body;

    /**
     * Event name, accepting {@code event} as an alias of {@code name}.
     */
    public String resolveName() {
        if (name != null && !name.isBlank()) {
            return name.trim();
        }
        return event != null ? event.trim() : "";
    }
}

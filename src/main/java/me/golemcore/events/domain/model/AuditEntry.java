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

import java.time.Instant;

/**
 * One line of the audit trail: a dispatch outcome or an administrative change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntry {

    private Instant timestamp;
    private String eventName;
    private Kind kind;
    private Status status;
    private String detail;

    public enum Kind {
        TOOL_CALL, SCRIPT_CALL, CREATED, DELETED, ACTIVATED, DEACTIVATED
    }

    public enum Status {
        OK, ERROR, TIMEOUT, SKIPPED
    }
}

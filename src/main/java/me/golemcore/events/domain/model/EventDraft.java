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

/**
 * Request to create a new job folder on disk.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventDraft {

    private String name;

    @Builder.Default
    private String description = "No description.";

    @Builder.Default
    private String schedule = "every 10 minutes";

    @Builder.Default
    private String tool = "mail_send";

    private String recipients;

    @Builder.Default
    private String subject = "Event Notification";

    @Builder.Default
    private String body = "This is an automated event notification.";
}

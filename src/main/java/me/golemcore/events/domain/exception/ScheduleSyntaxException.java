package me.golemcore.events.domain.exception;

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

/**
 * Schedule text matches none of the recognized forms.
 */
public class ScheduleSyntaxException extends EventEngineException {

    private final String scheduleText;

    public ScheduleSyntaxException(String scheduleText) {
        this(scheduleText, "Cannot parse schedule: '" + scheduleText + "'");
    }

    public ScheduleSyntaxException(String scheduleText, String message) {
        super(message);
        this.scheduleText = scheduleText;
    }

    public String getScheduleText() {
        return scheduleText;
    }
}

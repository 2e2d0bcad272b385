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

/**
 * Five-field wall-clock rule (minute, hour, day-of-month, month, day-of-week).
 * Day-of-week uses the cron convention Sunday = 0 ... Saturday = 6. Fields are
 * kept in their textual cron form and expanded by
 * {@link me.golemcore.events.domain.service.CronMatcher}.
 */
public record CronRule(String minute, String hour, String dayOfMonth, String month, String dayOfWeek)
        implements ScheduleRule {

    private static final int FIELD_COUNT = 5;

    /**
     * Split a 5-field cron expression. Field syntax is validated by the matcher,
     * not here.
     */
    public static CronRule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression cannot be empty");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != FIELD_COUNT) {
            throw new IllegalArgumentException(
                    "Invalid cron expression: expected 5 fields, got " + parts.length);
        }
        return new CronRule(parts[0], parts[1], parts[2], parts[3], parts[4]);
    }

    public String toExpression() {
        return String.join(" ", minute, hour, dayOfMonth, month, dayOfWeek);
    }

    @Override
    public String toCanonicalString() {
        return toExpression();
    }
}

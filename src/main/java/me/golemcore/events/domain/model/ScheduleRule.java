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
 * Compiled timing rule of a scheduled event. Instances are produced only by a
 * successful {@link me.golemcore.events.domain.service.ScheduleCompiler}
 * compilation; the original schedule text is kept on the event itself.
 *
 * @see IntervalRule
 * @see CronRule
 */
public interface ScheduleRule {

    /**
     * Canonical text of the rule. Interval forms ({@code every N seconds})
     * compile back to an equal rule; cron rules render as the five-field
     * expression, which the compiler does not accept as input.
     */
    String toCanonicalString();
}

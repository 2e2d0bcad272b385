package me.golemcore.events.domain.service;

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

import me.golemcore.events.domain.model.CronRule;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a {@link CronRule} matches a given minute.
 *
 * <p>
 * Each field is expanded into a concrete set of integers before comparison.
 * Supported field syntax: {@code *}, literals, comma lists, inclusive ranges
 * {@code a-b}, and steps {@code base/step} where base is {@code *}, a literal
 * start or a range. Legal ranges: minute 0-59, hour 0-23, day-of-month 1-31,
 * month 1-12, day-of-week 0-6 (Sunday = 0).
 */
@Component
public class CronMatcher {

    private final Map<CronRule, ExpandedCron> expanded = new ConcurrentHashMap<>();

    public boolean matches(CronRule rule, ZonedDateTime at) {
        ExpandedCron cron = expand(rule);
        int dayOfWeek = at.getDayOfWeek().getValue() % 7; // Monday=1..Sunday=7 -> Sunday=0
        return cron.minutes().contains(at.getMinute())
                && cron.hours().contains(at.getHour())
                && cron.daysOfMonth().contains(at.getDayOfMonth())
                && cron.months().contains(at.getMonthValue())
                && cron.daysOfWeek().contains(dayOfWeek);
    }

    /**
     * Expand every field of the rule; results are cached per rule.
     *
     * @throws IllegalArgumentException
     *             if a field is malformed or out of range
     */
    public ExpandedCron expand(CronRule rule) {
        return expanded.computeIfAbsent(rule, r -> {
            requireValidExpression(r);
            return new ExpandedCron(
                    expandField(r.minute(), 0, 59),
                    expandField(r.hour(), 0, 23),
                    expandField(r.dayOfMonth(), 1, 31),
                    expandField(r.month(), 1, 12),
                    expandField(r.dayOfWeek(), 0, 6));
        });
    }

    /**
     * Run the five fields through Spring's parser as a six-field expression with
     * a zero seconds field. The set expansion below is stricter: no names, and
     * day-of-week stops at 6.
     */
    static void requireValidExpression(CronRule rule) {
        String sixFieldCron = "0 " + rule.toExpression();
        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid cron expression '" + rule.toExpression() + "': " + e.getMessage(), e);
        }
    }

    static Set<Integer> expandField(String field, int min, int max) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Empty cron field");
        }
        Set<Integer> values = new TreeSet<>();
        for (String part : field.split(",")) {
            expandPart(part.trim(), min, max, values);
        }
        return Collections.unmodifiableSet(values);
    }

    private static void expandPart(String part, int min, int max, Set<Integer> out) {
        try {
            if (part.contains("/")) {
                String[] split = part.split("/", 2);
                int step = Integer.parseInt(split[1]);
                if (step <= 0) {
                    throw new IllegalArgumentException("Cron step must be positive: " + part);
                }
                int start;
                int end = max;
                if ("*".equals(split[0])) {
                    start = min;
                } else if (split[0].contains("-")) {
                    int[] range = range(split[0], min, max);
                    start = range[0];
                    end = range[1];
                } else {
                    start = checked(Integer.parseInt(split[0]), min, max, part);
                }
                for (int v = start; v <= end; v += step) {
                    out.add(v);
                }
            } else if (part.contains("-")) {
                int[] range = range(part, min, max);
                for (int v = range[0]; v <= range[1]; v++) {
                    out.add(v);
                }
            } else if ("*".equals(part)) {
                for (int v = min; v <= max; v++) {
                    out.add(v);
                }
            } else {
                out.add(checked(Integer.parseInt(part), min, max, part));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cron field part: '" + part + "'", e);
        }
    }

    private static int[] range(String part, int min, int max) {
        String[] bounds = part.split("-", 2);
        int start = checked(Integer.parseInt(bounds[0]), min, max, part);
        int end = checked(Integer.parseInt(bounds[1]), min, max, part);
        if (start > end) {
            throw new IllegalArgumentException("Invalid cron range: " + part);
        }
        return new int[] { start, end };
    }

    private static int checked(int value, int min, int max, String part) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                    "Cron value out of range [" + min + "-" + max + "]: " + part);
        }
        return value;
    }

    /**
     * Concrete value sets of the five cron fields.
     */
    public record ExpandedCron(Set<Integer> minutes, Set<Integer> hours, Set<Integer> daysOfMonth,
            Set<Integer> months, Set<Integer> daysOfWeek) {
    }
}

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

import me.golemcore.events.domain.exception.ScheduleSyntaxException;
import me.golemcore.events.domain.model.CronRule;
import me.golemcore.events.domain.model.IntervalRule;
import me.golemcore.events.domain.model.ScheduleRule;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiles natural-language schedule text into a {@link ScheduleRule}.
 *
 * <p>
 * Recognized forms, first match wins (case-insensitive; {@code midnight} and
 * {@code noon} are read as {@code 12 AM} and {@code 12 PM}):
 * <ol>
 * <li>{@code every N seconds|minutes|hours} - interval
 * <li>{@code every hour} - interval of 3600 seconds
 * <li>{@code every monday at 9[:30][ am|pm]} - cron on one weekday
 * <li>{@code every day at 9[:30][ am|pm]} - cron on every day
 * <li>{@code every monday, wednesday and friday at 9 am} - cron on listed weekdays
 * <li>{@code first day of [every] month at 8 am} - cron on day-of-month 1
 * </ol>
 * Anything else is rejected with {@link ScheduleSyntaxException}; there is no
 * default schedule.
 */
@Component
public class ScheduleCompiler {

    private static final String DAY = "monday|tuesday|wednesday|thursday|friday|saturday|sunday";
    private static final String TIME = "(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Pattern MIDNIGHT = Pattern.compile("\\bmidnight\\b", FLAGS);
    private static final Pattern NOON = Pattern.compile("\\bnoon\\b", FLAGS);

    private static final Pattern INTERVAL = Pattern.compile(
            "every\\s+(\\d+)\\s+(seconds?|minutes?|hours?)\\b", FLAGS);
    private static final Pattern EVERY_HOUR = Pattern.compile("every\\s+hour", FLAGS);
    private static final Pattern SINGLE_DAY = Pattern.compile(
            "every\\s+(" + DAY + ")\\s+at\\s+" + TIME, FLAGS);
    private static final Pattern EVERY_DAY = Pattern.compile(
            "every\\s+day\\s+at\\s+" + TIME, FLAGS);
    private static final Pattern DAY_LIST = Pattern.compile(
            "every\\s+((?:" + DAY + ")(?:\\s*,?\\s*(?:and\\s+)?(?:" + DAY + "))*)\\s+at\\s+" + TIME, FLAGS);
    private static final Pattern FIRST_OF_MONTH = Pattern.compile(
            "(?:on\\s+the\\s+)?first\\s+day\\s+of\\s+(?:every\\s+)?month\\s+at\\s+" + TIME, FLAGS);
    private static final Pattern DAY_NAME = Pattern.compile(DAY, FLAGS);

    private static final Map<String, Integer> DAY_OF_WEEK = Map.of(
            "sunday", 0, "monday", 1, "tuesday", 2, "wednesday", 3,
            "thursday", 4, "friday", 5, "saturday", 6);

    private static final Map<String, Long> UNIT_SECONDS = Map.of(
            "second", 1L, "minute", 60L, "hour", 3600L);

    private static final String WILDCARD = "*";

    /**
     * Compile schedule text.
     *
     * @throws ScheduleSyntaxException
     *             if the text matches none of the recognized forms
     */
    public ScheduleRule compile(String text) {
        if (text == null || text.isBlank()) {
            throw new ScheduleSyntaxException(text, "Schedule cannot be empty");
        }
        String normalized = NOON.matcher(MIDNIGHT.matcher(text.trim()).replaceAll("12 AM")).replaceAll("12 PM");

        Matcher m = INTERVAL.matcher(normalized);
        if (m.lookingAt()) {
            return interval(text, m.group(1), m.group(2));
        }

        if (EVERY_HOUR.matcher(normalized).matches()) {
            return new IntervalRule(3600);
        }

        m = SINGLE_DAY.matcher(normalized);
        if (m.matches()) {
            int[] time = toTime(text, m.group(2), m.group(3), m.group(4));
            String dow = String.valueOf(DAY_OF_WEEK.get(m.group(1).toLowerCase(Locale.ROOT)));
            return new CronRule(String.valueOf(time[1]), String.valueOf(time[0]), WILDCARD, WILDCARD, dow);
        }

        m = EVERY_DAY.matcher(normalized);
        if (m.matches()) {
            int[] time = toTime(text, m.group(1), m.group(2), m.group(3));
            return new CronRule(String.valueOf(time[1]), String.valueOf(time[0]), WILDCARD, WILDCARD, WILDCARD);
        }

        m = DAY_LIST.matcher(normalized);
        if (m.matches()) {
            int[] time = toTime(text, m.group(2), m.group(3), m.group(4));
            return new CronRule(String.valueOf(time[1]), String.valueOf(time[0]), WILDCARD, WILDCARD,
                    daysOfWeek(m.group(1)));
        }

        m = FIRST_OF_MONTH.matcher(normalized);
        if (m.matches()) {
            int[] time = toTime(text, m.group(1), m.group(2), m.group(3));
            return new CronRule(String.valueOf(time[1]), String.valueOf(time[0]), "1", WILDCARD, WILDCARD);
        }

        throw new ScheduleSyntaxException(text);
    }

    private IntervalRule interval(String text, String amount, String unit) {
        String singular = unit.toLowerCase(Locale.ROOT);
        if (singular.endsWith("s")) {
            singular = singular.substring(0, singular.length() - 1);
        }
        try {
            long seconds = Math.multiplyExact(Long.parseLong(amount), UNIT_SECONDS.get(singular));
            if (seconds <= 0) {
                throw new ScheduleSyntaxException(text, "Interval must be positive: '" + text + "'");
            }
            return new IntervalRule(seconds);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ScheduleSyntaxException(text, "Interval out of range: '" + text + "'");
        }
    }

    private String daysOfWeek(String dayList) {
        Set<Integer> days = new LinkedHashSet<>();
        Matcher m = DAY_NAME.matcher(dayList);
        while (m.find()) {
            days.add(DAY_OF_WEEK.get(m.group().toLowerCase(Locale.ROOT)));
        }
        return days.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    /**
     * Returns {hour, minute} in 24-hour form.
     */
    private int[] toTime(String text, String hourText, String minuteText, String ampm) {
        int hour = Integer.parseInt(hourText);
        int minute = minuteText != null ? Integer.parseInt(minuteText) : 0;
        if (minute > 59) {
            throw new ScheduleSyntaxException(text, "Invalid minute in schedule: '" + text + "'");
        }
        if (ampm != null) {
            if (hour < 1 || hour > 12) {
                throw new ScheduleSyntaxException(text, "Invalid 12-hour time in schedule: '" + text + "'");
            }
            boolean pm = "pm".equalsIgnoreCase(ampm);
            if (pm && hour != 12) {
                hour += 12;
            } else if (!pm && hour == 12) {
                hour = 0;
            }
        } else if (hour > 23) {
            throw new ScheduleSyntaxException(text, "Invalid hour in schedule: '" + text + "'");
        }
        return new int[] { hour, minute };
    }
}

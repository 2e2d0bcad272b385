package me.golemcore.events.domain.service;

import me.golemcore.events.domain.exception.ScheduleSyntaxException;
import me.golemcore.events.domain.model.CronRule;
import me.golemcore.events.domain.model.IntervalRule;
import me.golemcore.events.domain.model.ScheduleRule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleCompilerTest {

    private final ScheduleCompiler compiler = new ScheduleCompiler();

    @ParameterizedTest
    @CsvSource({
            "every 10 minutes, 600",
            "every 30 seconds, 30",
            "every 1 minute, 60",
            "Every 2 Hours, 7200",
            "every 5 minutes please, 300",
            "every hour, 3600",
            "EVERY HOUR, 3600"
    })
    void compilesIntervals(String text, long seconds) {
        ScheduleRule rule = compiler.compile(text);

        IntervalRule interval = assertInstanceOf(IntervalRule.class, rule);
        assertEquals(seconds, interval.seconds());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "every day at 9 AM | 0 9 * * *",
            "every day at 9:30 pm | 30 21 * * *",
            "every day at 17:45 | 45 17 * * *",
            "every day at midnight | 0 0 * * *",
            "every day at noon | 0 12 * * *",
            "every day at 12 am | 0 0 * * *",
            "every day at 12 pm | 0 12 * * *",
            "every monday at 9 am | 0 9 * * 1",
            "every Sunday at 7:05 | 5 7 * * 0",
            "every saturday at noon | 0 12 * * 6",
            "every monday, wednesday and friday at 9 am | 0 9 * * 1,3,5",
            "every tuesday and thursday at 6pm | 0 18 * * 2,4",
            "every friday, monday at 8 | 0 8 * * 5,1",
            "every monday and monday at 9 | 0 9 * * 1",
            "first day of every month at 8 am | 0 8 1 * *",
            "on the first day of month at 8:15 | 15 8 1 * *"
    })
    void compilesCalendarSchedulesToCron(String text, String expression) {
        ScheduleRule rule = compiler.compile(text);

        CronRule cron = assertInstanceOf(CronRule.class, rule);
        assertEquals(expression, cron.toExpression());
        assertEquals(expression, rule.toCanonicalString());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "   ", "tomorrow", "every", "every day", "daily at 9", "every 0 minutes",
            "every day at 13 pm", "every day at 0 am", "every day at 25", "every day at 9:75",
            "every 99999999999999999999 hours", "every fortnight at 9" })
    void rejectsUnrecognizedOrInvalidText(String text) {
        assertThrows(ScheduleSyntaxException.class, () -> compiler.compile(text));
    }

    @Test
    void exceptionCarriesOriginalText() {
        ScheduleSyntaxException e = assertThrows(ScheduleSyntaxException.class,
                () -> compiler.compile("whenever you like"));

        assertEquals("whenever you like", e.getScheduleText());
        assertTrue(e.getMessage().contains("whenever you like"));
    }

    @Test
    void intervalCanonicalFormIsInSeconds() {
        assertEquals("every 120 seconds", compiler.compile("every 2 minutes").toCanonicalString());
    }

    @ParameterizedTest
    @ValueSource(strings = { "every 1 second", "every 45 seconds", "every 10 minutes", "every 3 hours",
            "every hour" })
    void intervalCanonicalFormCompilesToSameRule(String text) {
        ScheduleRule rule = compiler.compile(text);

        ScheduleRule recompiled = compiler.compile(rule.toCanonicalString());

        assertEquals(rule, recompiled);
        assertEquals(rule.toCanonicalString(), recompiled.toCanonicalString());
    }
}

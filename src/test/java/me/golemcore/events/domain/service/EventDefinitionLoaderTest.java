package me.golemcore.events.domain.service;

import me.golemcore.events.domain.exception.EventEngineException;
import me.golemcore.events.domain.exception.ManifestException;
import me.golemcore.events.domain.exception.ScheduleSyntaxException;
import me.golemcore.events.domain.model.CronRule;
import me.golemcore.events.domain.model.EventDefinition;
import me.golemcore.events.domain.model.EventScanResult;
import me.golemcore.events.domain.model.EventType;
import me.golemcore.events.domain.model.IntervalRule;
import me.golemcore.events.domain.model.ScriptCallAction;
import me.golemcore.events.domain.model.ToolCallAction;
import me.golemcore.events.infrastructure.config.EventsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventDefinitionLoaderTest {

    private static final String MANIFEST = "EVENT.md";

    @TempDir
    Path root;

    private EventDefinitionLoader loader;

    @BeforeEach
    void setUp() {
        loader = new EventDefinitionLoader(new ScheduleCompiler(), new FileReferenceResolver(),
                new EventsProperties());
    }

    @Test
    void loadsScheduledToolEventWithResolvedReferences() throws IOException {
        Path dir = writeEvent("send-team-mail", """
                ---
                name: ignored-header-name
                description: >
                  Weekly status mail
                type: scheduled
                schedule: every day at 9 AM
                active: true
                action:
                  mcp: mail_send
                  params:
                    to: references/recipients.txt
                    subject: "Status"
                    body: references/body.md
                ---

                # send-team-mail
                Documentation only.
                """);
        Files.createDirectories(dir.resolve("references"));
        Files.writeString(dir.resolve("references/recipients.txt"), "# list\na@example.com\nb@example.com\n");
        Files.writeString(dir.resolve("references/body.md"), "Hello!\n");

        EventDefinition event = loader.load(dir);

        assertEquals("send-team-mail", event.getName());
        assertEquals("Weekly status mail", event.getDescription());
        assertEquals(EventType.SCHEDULED, event.getEventType());
        assertEquals("every day at 9 AM", event.getScheduleRaw());
        assertEquals(CronRule.parse("0 9 * * *"), event.getSchedule());
        assertTrue(event.isActive());
        assertTrue(event.isScheduled());
        assertEquals(dir.toAbsolutePath().normalize(), event.getEventDir());

        ToolCallAction action = assertInstanceOf(ToolCallAction.class, event.getAction());
        assertEquals("mail_send", action.toolName());
        assertEquals("references/recipients.txt", action.params().get("to"));
        assertEquals(List.of("a@example.com", "b@example.com"), event.getResolvedParams().get("to"));
        assertEquals("Status", event.getResolvedParams().get("subject"));
        assertEquals("Hello!", event.getResolvedParams().get("body"));
    }

    @Test
    void toolKeyIsAcceptedAsAliasOfMcp() throws IOException {
        Path dir = writeEvent("ping", """
                ---
                type: scheduled
                schedule: every 30 seconds
                action:
                  tool: noop
                ---
                """);

        EventDefinition event = loader.load(dir);

        assertEquals("noop", assertInstanceOf(ToolCallAction.class, event.getAction()).toolName());
        assertEquals(new IntervalRule(30), event.getSchedule());
        assertFalse(event.isActive());
        assertTrue(event.getResolvedParams().isEmpty());
    }

    @Test
    void loadsTopLevelScriptWithParams() throws IOException {
        Path dir = writeEvent("cleanup", """
                ---
                type: manual
                script: scripts/cleanup.sh
                params:
                  days: 7
                ---
                """);

        EventDefinition event = loader.load(dir);

        ScriptCallAction action = assertInstanceOf(ScriptCallAction.class, event.getAction());
        assertEquals("scripts/cleanup.sh", action.scriptPath());
        assertEquals(7, event.getResolvedParams().get("days"));
        assertEquals(EventType.MANUAL, event.getEventType());
        assertNull(event.getSchedule());
        assertFalse(event.isScheduled());
    }

    @Test
    void loadsScriptInsideActionBlock() throws IOException {
        Path dir = writeEvent("report", """
                ---
                type: event-triggered
                action:
                  script: scripts/report.py
                  params:
                    format: pdf
                ---
                """);

        EventDefinition event = loader.load(dir);

        assertEquals("scripts/report.py",
                assertInstanceOf(ScriptCallAction.class, event.getAction()).scriptPath());
        assertEquals("pdf", event.getResolvedParams().get("format"));
        assertEquals(EventType.EVENT_TRIGGERED, event.getEventType());
    }

    @Test
    void scheduleOfNonScheduledEventIsNotCompiled() throws IOException {
        Path dir = writeEvent("manual-only", """
                ---
                type: manual
                schedule: whenever
                action:
                  mcp: mail_send
                ---
                """);

        EventDefinition event = loader.load(dir);

        assertEquals("whenever", event.getScheduleRaw());
        assertNull(event.getSchedule());
    }

    @Test
    void scheduledEventWithoutScheduleNeverBecomesDue() throws IOException {
        Path dir = writeEvent("no-schedule", """
                ---
                type: scheduled
                action:
                  mcp: mail_send
                ---
                """);

        EventDefinition event = loader.load(dir);

        assertNull(event.getSchedule());
        assertFalse(event.isScheduled());
    }

    @Test
    void rejectsMissingType() throws IOException {
        Path dir = writeEvent("no-type", """
                ---
                action:
                  mcp: mail_send
                ---
                """);

        ManifestException e = assertThrows(ManifestException.class, () -> loader.load(dir));
        assertTrue(e.getMessage().contains("type"));
    }

    @Test
    void rejectsUnknownType() throws IOException {
        Path dir = writeEvent("odd-type", """
                ---
                type: sometimes
                action:
                  mcp: mail_send
                ---
                """);

        assertThrows(ManifestException.class, () -> loader.load(dir));
    }

    @Test
    void rejectsMissingActionAndScript() throws IOException {
        Path dir = writeEvent("no-action", """
                ---
                type: manual
                ---
                """);

        assertThrows(ManifestException.class, () -> loader.load(dir));
    }

    @Test
    void rejectsActionWithoutTarget() throws IOException {
        Path dir = writeEvent("empty-action", """
                ---
                type: manual
                action:
                  params:
                    a: 1
                ---
                """);

        assertThrows(ManifestException.class, () -> loader.load(dir));
    }

    @Test
    void rejectsMissingHeader() throws IOException {
        Path dir = writeEvent("no-header", "# Just docs\n");

        assertThrows(ManifestException.class, () -> loader.load(dir));
    }

    @Test
    void rejectsUnclosedHeader() throws IOException {
        Path dir = writeEvent("unclosed", "---\ntype: manual\nscript: run.sh\n");

        assertThrows(ManifestException.class, () -> loader.load(dir));
    }

    @Test
    void rejectsUnparseableSchedule() throws IOException {
        Path dir = writeEvent("bad-schedule", """
                ---
                type: scheduled
                schedule: when the moon is full
                action:
                  mcp: mail_send
                ---
                """);

        assertThrows(ScheduleSyntaxException.class, () -> loader.load(dir));
    }

    @Test
    void rejectsFolderWithoutManifest() throws IOException {
        Path dir = Files.createDirectories(root.resolve("empty"));

        assertThrows(ManifestException.class, () -> loader.load(dir));
    }

    @Test
    void acceptsWindowsLineEndings() throws IOException {
        Path dir = writeEvent("crlf", "---\r\ntype: manual\r\nscript: run.sh\r\n---\r\n\r\nDocs\r\n");

        assertEquals("run.sh", assertInstanceOf(ScriptCallAction.class, loader.load(dir).getAction()).scriptPath());
    }

    @Test
    void loadAllSkipsBrokenFoldersAndKeepsNameOrder() throws IOException {
        writeEvent("b-second", """
                ---
                type: scheduled
                schedule: every 10 minutes
                action:
                  mcp: mail_send
                ---
                """);
        writeEvent("a-first", """
                ---
                type: manual
                script: run.sh
                ---
                """);
        writeEvent("c-broken", """
                ---
                type: scheduled
                schedule: now and then
                action:
                  mcp: mail_send
                ---
                """);
        Files.createDirectories(root.resolve("d-not-an-event"));
        Files.writeString(root.resolve("README.md"), "not a folder");

        EventScanResult result = loader.loadAll(root);

        assertEquals(List.of("a-first", "b-second"),
                result.events().stream().map(EventDefinition::getName).toList());
        assertEquals(List.of("c-broken"), List.copyOf(result.failures().keySet()));
    }

    @Test
    void loadAllRejectsMissingRoot() {
        assertThrows(EventEngineException.class, () -> loader.loadAll(root.resolve("missing")));
    }

    private Path writeEvent(String name, String manifest) throws IOException {
        Path dir = Files.createDirectories(root.resolve(name));
        Files.writeString(dir.resolve(MANIFEST), manifest);
        return dir;
    }
}

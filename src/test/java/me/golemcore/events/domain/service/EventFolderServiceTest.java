package me.golemcore.events.domain.service;

import me.golemcore.events.domain.exception.DuplicateEventException;
import me.golemcore.events.domain.exception.EventNotFoundException;
import me.golemcore.events.domain.exception.ScheduleSyntaxException;
import me.golemcore.events.domain.model.EventDefinition;
import me.golemcore.events.domain.model.EventDraft;
import me.golemcore.events.domain.model.EventType;
import me.golemcore.events.domain.model.IntervalRule;
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

class EventFolderServiceTest {

    @TempDir
    Path root;

    private EventFolderService service;

    @BeforeEach
    void setUp() {
        EventsProperties properties = new EventsProperties();
        properties.setRoot(root.toString());
        ScheduleCompiler compiler = new ScheduleCompiler();
        EventDefinitionLoader loader = new EventDefinitionLoader(compiler, new FileReferenceResolver(), properties);
        service = new EventFolderService(loader, compiler, properties);
    }

    @Test
    void createsFolderThatLoadsBack() {
        EventDefinition event = service.create(EventDraft.builder()
                .name("Team Mail")
                .description("Send test email: every 2 minutes")
                .schedule("every 2 minutes")
                .recipients("alice@example.com, bob@example.com;carol@example.com")
                .subject("Test: hello")
                .body("Hello, this is a test!")
                .build());

        assertEquals("team-mail", event.getName());
        assertEquals(EventType.SCHEDULED, event.getEventType());
        assertEquals(new IntervalRule(120), event.getSchedule());
        assertEquals("Send test email: every 2 minutes", event.getDescription());
        assertFalse(event.isActive());
        assertEquals("mail_send", assertInstanceOf(ToolCallAction.class, event.getAction()).toolName());
        assertEquals(List.of("alice@example.com", "bob@example.com", "carol@example.com"),
                event.getResolvedParams().get("to"));
        assertEquals("Test: hello", event.getResolvedParams().get("subject"));
        assertEquals("Hello, this is a test!", event.getResolvedParams().get("body"));

        Path dir = root.resolve("team-mail");
        assertTrue(Files.isRegularFile(dir.resolve("EVENT.md")));
        assertTrue(Files.isDirectory(dir.resolve("scripts")));
        assertTrue(Files.isRegularFile(dir.resolve(EventFolderService.RECIPIENTS_FILE)));
    }

    @Test
    void manifestStartsWithHeaderAndDocuments() throws IOException {
        service.create(EventDraft.builder().name("docs").build());

        String manifest = Files.readString(root.resolve("docs/EVENT.md"));

        assertTrue(manifest.startsWith("---\n"));
        assertTrue(manifest.contains("# docs"));
        assertTrue(manifest.contains("Fires on schedule: `every 10 minutes`"));
    }

    @Test
    void defaultsApplyWithPlaceholderRecipient() {
        EventDefinition event = service.create(EventDraft.builder().name("defaults").build());

        assertEquals("every 10 minutes", event.getScheduleRaw());
        assertEquals(List.of(EventFolderService.PLACEHOLDER_RECIPIENT), event.getResolvedParams().get("to"));
        assertEquals("Event Notification", event.getResolvedParams().get("subject"));
    }

    @Test
    void badScheduleWritesNothing() {
        EventDraft draft = EventDraft.builder().name("bad").schedule("sometimes").build();

        assertThrows(ScheduleSyntaxException.class, () -> service.create(draft));
        assertFalse(Files.exists(root.resolve("bad")));
    }

    @Test
    void existingFolderIsRefused() {
        service.create(EventDraft.builder().name("twice").build());

        assertThrows(DuplicateEventException.class, () -> service.create(EventDraft.builder().name("twice").build()));
    }

    @Test
    void blankOrUnsafeNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.create(EventDraft.builder().name(" ").build()));
        assertThrows(IllegalArgumentException.class,
                () -> service.create(EventDraft.builder().name("../outside").build()));
    }

    @Test
    void deleteRemovesFolderRecursively() {
        service.create(EventDraft.builder().name("gone").build());

        service.delete("gone");

        assertFalse(Files.exists(root.resolve("gone")));
        assertFalse(service.exists("gone"));
    }

    @Test
    void deleteUnknownFolderFails() {
        assertThrows(EventNotFoundException.class, () -> service.delete("ghost"));
    }

    @Test
    void slugifyLowercasesAndDashes() {
        assertEquals("weekly-team-report", EventFolderService.slugify("  Weekly Team  Report "));
    }

    @Test
    void splitsRecipientsOnCommaSemicolonAndNewline() {
        assertEquals(List.of("a@x.io", "b@x.io", "c@x.io", "d@x.io"),
                EventFolderService.splitRecipients("a@x.io, b@x.io;c@x.io\nd@x.io,"));
        assertTrue(EventFolderService.splitRecipients(null).isEmpty());
    }
}

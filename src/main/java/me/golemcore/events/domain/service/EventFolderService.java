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

import me.golemcore.events.domain.exception.DuplicateEventException;
import me.golemcore.events.domain.exception.EventEngineException;
import me.golemcore.events.domain.exception.EventNotFoundException;
import me.golemcore.events.domain.model.EventDefinition;
import me.golemcore.events.domain.model.EventDraft;
import me.golemcore.events.domain.model.EventType;
import me.golemcore.events.infrastructure.config.EventsProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Creates and removes job folders under the events root.
 *
 * <p>
 * A created folder has the layout the loader expects:
 *
 * <pre>
 * &lt;name&gt;/
 *   EVENT.md                  YAML header + documentation
 *   references/recipients.txt one address per line
 *   references/body.md        message body
 *   scripts/                  empty
 * </pre>
 *
 * This service only touches the disk; registering the event with the running
 * engine is the caller's job.
 */
@Service
@Slf4j
public class EventFolderService {

    static final String RECIPIENTS_FILE = "references/recipients.txt";
    static final String BODY_FILE = "references/body.md";
    static final String PLACEHOLDER_RECIPIENT = "recipient@example.com";

    private static final Pattern SLUG_PATTERN = Pattern.compile("[a-z0-9][a-z0-9._-]*");
    private static final Pattern RECIPIENT_SEPARATORS = Pattern.compile("[,;\\r\\n]+");

    private final EventDefinitionLoader loader;
    private final ScheduleCompiler scheduleCompiler;
    private final EventsProperties properties;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    public EventFolderService(EventDefinitionLoader loader, ScheduleCompiler scheduleCompiler,
            EventsProperties properties) {
        this.loader = loader;
        this.scheduleCompiler = scheduleCompiler;
        this.properties = properties;
    }

    /**
     * Write a new job folder and load it back.
     *
     * @throws IllegalArgumentException
     *             if the name is blank or not usable as a folder name
     * @throws me.golemcore.events.domain.exception.ScheduleSyntaxException
     *             if the schedule does not compile
     * @throws DuplicateEventException
     *             if the folder already exists
     */
    public EventDefinition create(EventDraft draft) {
        String name = slugify(draft.getName());
        scheduleCompiler.compile(draft.getSchedule());

        Path eventDir = eventsRoot().resolve(name);
        if (Files.exists(eventDir)) {
            throw new DuplicateEventException(name);
        }

        try {
            Files.createDirectories(eventDir.resolve("scripts"));
            Files.createDirectories(eventDir.resolve("references"));
            Files.writeString(eventDir.resolve(RECIPIENTS_FILE), recipientsFile(draft.getRecipients()),
                    StandardCharsets.UTF_8);
            Files.writeString(eventDir.resolve(BODY_FILE), nullToEmpty(draft.getBody()), StandardCharsets.UTF_8);
            Files.writeString(eventDir.resolve(properties.getManifestFile()), manifest(name, draft),
                    StandardCharsets.UTF_8);
        } catch (IOException e) {
            removeQuietly(eventDir);
            throw new EventEngineException("Failed to write event folder " + name + ": " + e.getMessage(), e);
        }

        try {
            EventDefinition event = loader.load(eventDir);
            log.info("[EventFolder] Created {} ({}, tool {})", name, draft.getSchedule(), draft.getTool());
            return event;
        } catch (RuntimeException e) {
            removeQuietly(eventDir);
            throw e;
        }
    }

    /**
     * Remove a job folder and everything in it.
     *
     * @throws EventNotFoundException
     *             if no such folder exists
     */
    public void delete(String name) {
        Path eventDir = eventsRoot().resolve(slugify(name));
        if (!Files.isDirectory(eventDir)) {
            throw new EventNotFoundException(name);
        }
        try {
            FileSystemUtils.deleteRecursively(eventDir);
        } catch (IOException e) {
            throw new EventEngineException("Failed to delete event folder " + name + ": " + e.getMessage(), e);
        }
        log.info("[EventFolder] Deleted {}", eventDir);
    }

    public boolean exists(String name) {
        return Files.isDirectory(eventsRoot().resolve(slugify(name)));
    }

    /**
     * Trimmed, lower-cased, spaces replaced by dashes.
     */
    static String slugify(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("No event name provided");
        }
        String slug = name.strip().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
        if (!SLUG_PATTERN.matcher(slug).matches()) {
            throw new IllegalArgumentException("Invalid event name: " + name);
        }
        return slug;
    }

    static List<String> splitRecipients(String recipients) {
        if (recipients == null) {
            return List.of();
        }
        return Arrays.stream(RECIPIENT_SEPARATORS.split(recipients))
                .map(String::strip)
                .filter(address -> !address.isEmpty())
                .toList();
    }

    private String recipientsFile(String recipients) {
        List<String> addresses = splitRecipients(recipients);
        StringBuilder content = new StringBuilder()
                .append("# Recipients, one address per line\n")
                .append("# Lines starting with # are ignored\n\n");
        if (addresses.isEmpty()) {
            content.append(PLACEHOLDER_RECIPIENT).append('\n');
        } else {
            addresses.forEach(address -> content.append(address).append('\n'));
        }
        return content.toString();
    }

    private String manifest(String name, EventDraft draft) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("to", RECIPIENTS_FILE);
        params.put("subject", nullToEmpty(draft.getSubject()));
        params.put("body", BODY_FILE);

        Map<String, Object> action = new LinkedHashMap<>();
        action.put("tool", draft.getTool());
        action.put("params", params);

        Map<String, Object> header = new LinkedHashMap<>();
        header.put("name", name);
        header.put("description", nullToEmpty(draft.getDescription()));
        header.put("type", EventType.SCHEDULED.getValue());
        header.put("schedule", draft.getSchedule());
        header.put("active", false);
        header.put("action", action);

        String yaml;
        try {
            yaml = yamlMapper.writeValueAsString(header);
        } catch (JsonProcessingException e) {
            throw new EventEngineException("Failed to render manifest for " + name + ": " + e.getMessage(), e);
        }

        return "---\n" + yaml + (yaml.endsWith("\n") ? "" : "\n") + "---\n\n"
                + "# " + name + "\n\n"
                + nullToEmpty(draft.getDescription()) + "\n\n"
                + "Fires on schedule: `" + draft.getSchedule() + "`\n"
                + "Sends to recipients in `" + RECIPIENTS_FILE + "`\n"
                + "Uses the message body in `" + BODY_FILE + "`\n";
    }

    private Path eventsRoot() {
        return Path.of(properties.getRoot()).toAbsolutePath().normalize();
    }

    private void removeQuietly(Path eventDir) {
        try {
            FileSystemUtils.deleteRecursively(eventDir);
        } catch (IOException e) {
            log.warn("[EventFolder] Failed to clean up {}: {}", eventDir, e.getMessage());
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}

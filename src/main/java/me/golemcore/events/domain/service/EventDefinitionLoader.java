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

import me.golemcore.events.domain.exception.EventEngineException;
import me.golemcore.events.domain.exception.ManifestException;
import me.golemcore.events.domain.model.EventAction;
import me.golemcore.events.domain.model.EventDefinition;
import me.golemcore.events.domain.model.EventScanResult;
import me.golemcore.events.domain.model.EventType;
import me.golemcore.events.domain.model.ScheduleRule;
import me.golemcore.events.domain.model.ScriptCallAction;
import me.golemcore.events.domain.model.ToolCallAction;
import me.golemcore.events.infrastructure.config.EventsProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Loads job folders into {@link EventDefinition}s.
 *
 * <p>
 * A job folder holds an {@code EVENT.md} manifest: a YAML header between two
 * {@code ---} lines followed by free-form markdown documentation. Header keys:
 * <ul>
 * <li>{@code type} (required) - {@code scheduled}, {@code event-triggered} or
 * {@code manual}
 * <li>{@code action} - tool call: {@code mcp} (or {@code tool}) naming the tool
 * and a {@code params} mapping; may carry {@code script} instead of a tool
 * <li>{@code script} - relative script path, shorthand for an action that only
 * runs a script; top-level {@code params} apply to it
 * <li>{@code schedule} - natural-language schedule, compiled only for
 * {@code scheduled} events
 * <li>{@code description}, {@code active} (default false)
 * </ul>
 * The event name is the folder name.
 */
@Service
@Slf4j
public class EventDefinitionLoader {

    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
            "^---[ \\t]*\\n(.*?)\\n---[ \\t]*(?:\\n(.*))?$", Pattern.DOTALL);
    private static final String DELIMITER = "---";
    private static final String SUPPRESS_UNCHECKED = "unchecked";
    private static final int DISPLAY_LIMIT = 60;

    private final ScheduleCompiler scheduleCompiler;
    private final FileReferenceResolver referenceResolver;
    private final String manifestFile;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public EventDefinitionLoader(ScheduleCompiler scheduleCompiler, FileReferenceResolver referenceResolver,
            EventsProperties properties) {
        this.scheduleCompiler = scheduleCompiler;
        this.referenceResolver = referenceResolver;
        this.manifestFile = properties.getManifestFile();
    }

    /**
     * Scan every sub-folder of {@code root} that holds a manifest, in name order.
     * A folder that fails to load is skipped and reported in the result; it never
     * aborts the scan.
     */
    public EventScanResult loadAll(Path root) {
        if (!Files.isDirectory(root)) {
            throw new EventEngineException("Events root not found: " + root.toAbsolutePath());
        }

        List<Path> folders;
        try (Stream<Path> children = Files.list(root)) {
            folders = children
                    .filter(Files::isDirectory)
                    .filter(dir -> Files.isRegularFile(dir.resolve(manifestFile)))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new EventEngineException("Failed to scan events root " + root + ": " + e.getMessage(), e);
        }

        List<EventDefinition> events = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (Path folder : folders) {
            String folderName = folder.getFileName().toString();
            try {
                EventDefinition event = load(folder);
                events.add(event);
                logLoaded(event);
            } catch (EventEngineException | IllegalArgumentException e) {
                log.warn("[Loader] Skipping {}: {}", folderName, e.getMessage());
                failures.put(folderName, e.getMessage());
            }
        }

        log.info("[Loader] Loaded {} event(s) from {}, skipped {}", events.size(), root, failures.size());
        return new EventScanResult(events, failures);
    }

    /**
     * Load one job folder.
     *
     * @throws ManifestException
     *             if the manifest is absent or malformed
     * @throws me.golemcore.events.domain.exception.ScheduleSyntaxException
     *             if a scheduled event's schedule cannot be compiled
     */
    public EventDefinition load(Path folder) {
        Path eventDir = folder.toAbsolutePath().normalize();
        String name = eventDir.getFileName().toString();
        Map<String, Object> header = readHeader(eventDir, name);

        EventType type = parseType(header, name);
        EventAction action = parseAction(header, name);

        Object scheduleValue = header.get("schedule");
        String scheduleRaw = scheduleValue != null ? scheduleValue.toString().trim() : null;
        ScheduleRule schedule = null;
        if (type == EventType.SCHEDULED) {
            if (scheduleRaw != null && !scheduleRaw.isEmpty()) {
                schedule = scheduleCompiler.compile(scheduleRaw);
            } else {
                log.warn("[Loader] Event {} is scheduled but declares no schedule, it will never fire", name);
            }
        }

        Map<String, Object> resolved = referenceResolver.resolveAll(action.params(), eventDir);

        Object description = header.get("description");
        return EventDefinition.builder()
                .name(name)
                .description(description != null ? description.toString().trim() : "")
                .eventType(type)
                .scheduleRaw(scheduleRaw)
                .schedule(schedule)
                .action(action)
                .resolvedParams(resolved)
                .active(parseBoolean(header.get("active")))
                .eventDir(eventDir)
                .build();
    }

    @SuppressWarnings(SUPPRESS_UNCHECKED)
    private Map<String, Object> readHeader(Path eventDir, String name) {
        Path manifest = eventDir.resolve(manifestFile);
        if (!Files.isRegularFile(manifest)) {
            throw new ManifestException("No " + manifestFile + " in " + eventDir);
        }

        String content;
        try {
            content = Files.readString(manifest, StandardCharsets.UTF_8).replace("\r\n", "\n");
        } catch (IOException e) {
            throw new ManifestException("[" + name + "] Cannot read " + manifestFile + ": " + e.getMessage(), e);
        }

        if (!content.startsWith(DELIMITER)) {
            throw new ManifestException("[" + name + "] " + manifestFile + " must start with --- header");
        }
        Matcher matcher = FRONTMATTER_PATTERN.matcher(content);
        if (!matcher.matches()) {
            throw new ManifestException("[" + name + "] " + manifestFile + " header not closed with ---");
        }

        try {
            Map<String, Object> yaml = yamlMapper.readValue(matcher.group(1), Map.class);
            return yaml != null ? yaml : Map.of();
        } catch (IOException e) {
            throw new ManifestException("[" + name + "] Invalid YAML header: " + e.getMessage(), e);
        }
    }

    private EventType parseType(Map<String, Object> header, String name) {
        Object type = header.get("type");
        if (type == null) {
            throw new ManifestException("[" + name + "] " + manifestFile + " missing required field: type");
        }
        return EventType.fromValue(type.toString())
                .orElseThrow(() -> new ManifestException("[" + name + "] Unknown event type: " + type));
    }

    @SuppressWarnings(SUPPRESS_UNCHECKED)
    private EventAction parseAction(Map<String, Object> header, String name) {
        Object actionObj = header.get("action");
        if (actionObj != null) {
            if (!(actionObj instanceof Map)) {
                throw new ManifestException("[" + name + "] 'action' must be a mapping");
            }
            Map<String, Object> action = (Map<String, Object>) actionObj;
            Map<String, Object> params = parseParams(action.get("params"), name);

            String tool = firstNonBlank(action.get("mcp"), action.get("tool"));
            if (tool != null) {
                return new ToolCallAction(tool, params);
            }
            String script = firstNonBlank(action.get("script"), header.get("script"));
            if (script != null) {
                return new ScriptCallAction(script, params);
            }
            throw new ManifestException("[" + name + "] 'action' must name a tool (mcp) or a script");
        }

        String script = firstNonBlank(header.get("script"));
        if (script != null) {
            return new ScriptCallAction(script, parseParams(header.get("params"), name));
        }
        throw new ManifestException("[" + name + "] " + manifestFile + " must have 'action' or 'script'");
    }

    @SuppressWarnings(SUPPRESS_UNCHECKED)
    private Map<String, Object> parseParams(Object params, String name) {
        if (params == null) {
            return Map.of();
        }
        if (!(params instanceof Map)) {
            throw new ManifestException("[" + name + "] 'params' must be a mapping");
        }
        return (Map<String, Object>) params;
    }

    private static String firstNonBlank(Object... values) {
        for (Object value : values) {
            if (value != null && !value.toString().isBlank()) {
                return value.toString().trim();
            }
        }
        return null;
    }

    private static boolean parseBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString().trim());
    }

    private void logLoaded(EventDefinition event) {
        log.info("[Loader] Loaded event: {} (type={}, schedule={}, action={}, active={})",
                event.getName(), event.getEventType().getValue(),
                event.getScheduleRaw(), event.getAction().target(), event.isActive());
        if (log.isDebugEnabled()) {
            event.getResolvedParams().forEach((key, value) -> log.debug("[Loader]   {}: {}", key,
                    truncate(String.valueOf(value))));
        }
    }

    private static String truncate(String text) {
        return text.length() <= DISPLAY_LIMIT ? text : text.substring(0, DISPLAY_LIMIT) + "...";
    }
}

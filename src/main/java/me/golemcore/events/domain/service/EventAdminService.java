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
import me.golemcore.events.domain.exception.EngineUnavailableException;
import me.golemcore.events.domain.exception.EventEngineException;
import me.golemcore.events.domain.exception.EventNotFoundException;
import me.golemcore.events.domain.model.AdminCommand;
import me.golemcore.events.domain.model.AuditEntry;
import me.golemcore.events.domain.model.EventDefinition;
import me.golemcore.events.domain.model.EventDraft;
import me.golemcore.events.domain.model.EventSummary;
import me.golemcore.events.scheduler.EventEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Administrative entry point for an outer request layer: keeps the job folders
 * on disk and the running engine in step.
 *
 * <p>
 * The typed methods throw the engine's exceptions. {@link #execute(AdminCommand)}
 * routes a {@code {"action": ..., "name": ...}} command and always answers with
 * a readable outcome line.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventAdminService {

    private final EventEngine engine;
    private final EventFolderService folderService;
    private final EventAuditLog auditLog;
    private final ObjectMapper objectMapper;

    /**
     * Write the job folder and register the event with the engine. The folder is
     * removed again if the engine already knows the name; it is kept when the
     * engine is down so the next load picks it up.
     */
    public EventSummary create(EventDraft draft) {
        EventDefinition event = folderService.create(draft);
        try {
            return engine.create(event);
        } catch (DuplicateEventException e) {
            folderService.delete(event.getName());
            throw e;
        }
    }

    /**
     * Remove the event from the engine, then its folder. A folder the engine
     * never loaded is still removed.
     */
    public void delete(String name) {
        try {
            engine.delete(name);
        } catch (EventNotFoundException e) {
            if (!folderService.exists(name)) {
                throw e;
            }
            log.info("[EventAdmin] {} not registered, removing folder only", name);
        }
        if (folderService.exists(name)) {
            folderService.delete(name);
        }
    }

    public EventSummary activate(String name) {
        return engine.activate(name);
    }

    public EventSummary deactivate(String name) {
        return engine.deactivate(name);
    }

    public AuditEntry fire(String name) {
        return engine.fire(name);
    }

    public List<EventSummary> listEvents() {
        return engine.listEvents();
    }

    public List<AuditEntry> recentAudit(int n) {
        return auditLog.recent(n);
    }

    /**
     * Parse a JSON command and execute it.
     */
    public String execute(String json) {
        AdminCommand command;
        try {
            command = objectMapper.readValue(json, AdminCommand.class);
        } catch (JsonProcessingException e) {
            return "Invalid command: " + e.getOriginalMessage();
        }
        return execute(command);
    }

    public String execute(AdminCommand command) {
        String action = command.getAction() != null ? command.getAction().trim().toLowerCase(Locale.ROOT) : "";
        String name = command.resolveName();
        if (!"create".equals(action) && isKnownAction(action) && name.isEmpty()) {
            return "No event name provided.";
        }

        try {
            return switch (action) {
            case "fire" -> describeFire(name, fire(name));
            case "create" -> describeCreate(create(toDraft(command)));
            case "delete" -> {
                delete(name);
                yield "Deleted event '" + name + "', it will no longer fire.";
            }
            case "activate" -> {
                EventSummary summary = activate(name);
                yield "Activated event '" + name + "', it will fire " + summary.getSchedule() + ".";
            }
            case "deactivate" -> {
                deactivate(name);
                yield "Deactivated event '" + name + "', it will no longer fire automatically.";
            }
            default -> "Unknown action: " + action;
            };
        } catch (EngineUnavailableException e) {
            log.warn("[EventAdmin] {} {}: {}", action, name, e.getMessage());
            return "Engine not available: " + e.getMessage();
        } catch (EventEngineException | IllegalArgumentException e) {
            log.warn("[EventAdmin] {} {} failed: {}", action, name, e.getMessage());
            return "Failed to " + action + ": " + e.getMessage();
        }
    }

    private static boolean isKnownAction(String action) {
        return switch (action) {
        case "fire", "delete", "activate", "deactivate" -> true;
        default -> false;
        };
    }

    private static String describeFire(String name, AuditEntry outcome) {
        return "Fired event '" + name + "': " + outcome.getStatus() + " " + outcome.getDetail();
    }

    private static String describeCreate(EventSummary summary) {
        return "Created event '" + summary.getName() + "', fires " + summary.getSchedule()
                + ". Activate it to start the schedule.";
    }

    private static EventDraft toDraft(AdminCommand command) {
        EventDraft draft = EventDraft.builder()
                .name(command.resolveName())
                .recipients(command.getRecipients())
                .build();
        if (command.getDescription() != null) {
            draft.setDescription(command.getDescription());
        }
        if (command.getSchedule() != null) {
            draft.setSchedule(command.getSchedule());
        }
        if (command.getTool() != null) {
            draft.setTool(command.getTool());
        }
        if (command.getSubject() != null) {
            draft.setSubject(command.getSubject());
        }
        if (command.getBody() != null) {
            draft.setBody(command.getBody());
        }
        return draft;
    }
}

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

import me.golemcore.events.domain.model.AuditEntry;
import me.golemcore.events.infrastructure.config.EventsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * In-memory audit trail of dispatch outcomes and administrative changes. It is
 * the only visible record of failed dispatches, and it is bounded: past
 * {@code events.audit.max-entries} the oldest entries are dropped. Not
 * persisted across restarts.
 */
@Service
@Slf4j
public class EventAuditLog {

    private final Clock clock;
    private final int maxEntries;
    private final Deque<AuditEntry> entries = new ArrayDeque<>();

    public EventAuditLog(Clock clock, EventsProperties properties) {
        this.clock = clock;
        this.maxEntries = Math.max(1, properties.getAudit().getMaxEntries());
    }

    public AuditEntry record(String eventName, AuditEntry.Kind kind, AuditEntry.Status status, String detail) {
        AuditEntry entry = AuditEntry.builder()
                .timestamp(Instant.now(clock))
                .eventName(eventName)
                .kind(kind)
                .status(status)
                .detail(detail != null ? detail : "")
                .build();

        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > maxEntries) {
                entries.removeFirst();
            }
        }

        if (status == AuditEntry.Status.OK) {
            log.info("[Audit] {} {} {}: {}", eventName, kind, status, entry.getDetail());
        } else {
            log.warn("[Audit] {} {} {}: {}", eventName, kind, status, entry.getDetail());
        }
        return entry;
    }

    /**
     * All retained entries, oldest first.
     */
    public List<AuditEntry> entries() {
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    /**
     * The last {@code n} entries, oldest first.
     */
    public List<AuditEntry> recent(int n) {
        List<AuditEntry> all = entries();
        if (n <= 0) {
            return List.of();
        }
        return all.subList(Math.max(0, all.size() - n), all.size());
    }

    public List<AuditEntry> entriesFor(String eventName) {
        return entries().stream()
                .filter(entry -> eventName.equals(entry.getEventName()))
                .toList();
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }
}

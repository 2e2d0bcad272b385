package me.golemcore.events.scheduler;

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

import me.golemcore.events.domain.component.ScriptComponent;
import me.golemcore.events.domain.exception.DuplicateEventException;
import me.golemcore.events.domain.exception.EngineUnavailableException;
import me.golemcore.events.domain.exception.EventEngineException;
import me.golemcore.events.domain.exception.EventNotFoundException;
import me.golemcore.events.domain.exception.ScriptEntryPointMissingException;
import me.golemcore.events.domain.exception.ScriptNotFoundException;
import me.golemcore.events.domain.exception.ToolNotFoundException;
import me.golemcore.events.domain.model.AuditEntry;
import me.golemcore.events.domain.model.CronRule;
import me.golemcore.events.domain.model.EventAction;
import me.golemcore.events.domain.model.EventDefinition;
import me.golemcore.events.domain.model.EventScanResult;
import me.golemcore.events.domain.model.EventSummary;
import me.golemcore.events.domain.model.IntervalRule;
import me.golemcore.events.domain.model.ScheduleRule;
import me.golemcore.events.domain.model.ScriptCallAction;
import me.golemcore.events.domain.model.ToolCallAction;
import me.golemcore.events.domain.model.ToolResult;
import me.golemcore.events.domain.service.CronMatcher;
import me.golemcore.events.domain.service.EventAuditLog;
import me.golemcore.events.domain.service.EventDefinitionLoader;
import me.golemcore.events.domain.service.ScriptRegistry;
import me.golemcore.events.domain.service.ToolRegistry;
import me.golemcore.events.infrastructure.config.EventsProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Polling scheduler that owns the loaded events and dispatches the due ones.
 *
 * <p>
 * The loop runs on a single thread and owns the registry and the per-event
 * runtime state (last firing time, cron minute markers). Each tick it evaluates
 * every active scheduled event in registry order and, for each due one, records
 * the firing time and then dispatches it to completion before moving on.
 *
 * <p>
 * Administrative operations (create, delete, activate, deactivate, fire now)
 * are queued as commands and executed by the loop thread between ticks; the
 * caller waits up to {@code events.engine.command-timeout}. They fail with
 * {@link EngineUnavailableException} when the loop is not running.
 * {@link #listEvents()} and {@link #lastFired(String)} read published
 * snapshots and work from any thread.
 *
 * <p>
 * Dispatch failures never stop the loop: every outcome is written to the
 * {@link EventAuditLog}. Handlers run on {@code event-dispatch} worker threads
 * while the loop waits, so a single dispatch is bounded by
 * {@code events.engine.dispatch-timeout} whether the handler blocks or returns
 * a pending future.
 *
 * @see EventDefinitionLoader
 * @see ToolRegistry
 * @see ScriptRegistry
 */
@Component
@Slf4j
public class EventEngine {

    static final String EVENT_NAME_PARAM = "_event_name";

    private static final int DETAIL_LIMIT = 200;
    private static final long SECONDS_PER_MINUTE = 60;

    private final EventDefinitionLoader loader;
    private final ToolRegistry toolRegistry;
    private final ScriptRegistry scriptRegistry;
    private final CronMatcher cronMatcher;
    private final EventAuditLog auditLog;
    private final Clock clock;
    private final Path eventsRoot;
    private final Duration tickInterval;
    private final ZoneId zone;
    private final Duration commandTimeout;
    private final Duration dispatchTimeout;

    // Written only by the loop thread while running
    private final List<EventDefinition> events = new ArrayList<>();
    private final Map<String, Instant> lastFired = new ConcurrentHashMap<>();
    private final Set<CronBucket> cronFiredThisMinute = ConcurrentHashMap.newKeySet();

    private final BlockingQueue<EngineCommand<?>> commands = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean stopRequested;
    private volatile Thread loopThread;
    private volatile List<EventSummary> snapshot = List.of();

    private final AtomicInteger dispatchThreads = new AtomicInteger();
    private final ExecutorService dispatchExecutor = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "event-dispatch-" + dispatchThreads.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private ExecutorService runner;

    public EventEngine(EventDefinitionLoader loader, ToolRegistry toolRegistry, ScriptRegistry scriptRegistry,
            CronMatcher cronMatcher, EventAuditLog auditLog, Clock clock, EventsProperties properties) {
        this.loader = loader;
        this.toolRegistry = toolRegistry;
        this.scriptRegistry = scriptRegistry;
        this.cronMatcher = cronMatcher;
        this.auditLog = auditLog;
        this.clock = clock;
        EventsProperties.EngineProperties engine = properties.getEngine();
        this.eventsRoot = Path.of(properties.getRoot()).toAbsolutePath().normalize();
        this.tickInterval = engine.getTickInterval();
        this.zone = ZoneId.of(engine.getZone());
        this.commandTimeout = engine.getCommandTimeout();
        this.dispatchTimeout = engine.getDispatchTimeout();
    }

    // ==================== LIFECYCLE ====================

    /**
     * Scan the events root and register every folder that loads. Folders whose
     * name is already registered are skipped and reported as failures.
     */
    public EventScanResult load() {
        EventScanResult scanned = loader.loadAll(eventsRoot);
        return onLoop("load", () -> {
            List<EventDefinition> added = new ArrayList<>();
            Map<String, String> failures = new LinkedHashMap<>(scanned.failures());
            for (EventDefinition event : scanned.events()) {
                if (find(event.getName()).isPresent()) {
                    log.warn("[EventEngine] Event {} already registered, skipping", event.getName());
                    failures.put(event.getName(), "Duplicate event name");
                    continue;
                }
                events.add(event);
                added.add(event);
            }
            publishSnapshot();
            return new EventScanResult(added, failures);
        });
    }

    /**
     * Run the loop on the calling thread until {@link #stop()} is called or, when
     * {@code duration} is given, until that much time has elapsed.
     *
     * @throws IllegalStateException
     *             if the loop is already running
     */
    public void run(Duration duration) {
        synchronized (this) {
            stopRequested = false;
            if (!running.compareAndSet(false, true)) {
                throw new IllegalStateException("Event engine is already running");
            }
        }
        runLoop(duration);
    }

    /**
     * Run the loop on a dedicated {@code event-engine} thread.
     */
    public synchronized void start() {
        stopRequested = false;
        if (!running.compareAndSet(false, true)) {
            log.warn("[EventEngine] Already running");
            return;
        }
        runner = Executors.newSingleThreadExecutor(r -> new Thread(r, "event-engine"));
        runner.execute(() -> runLoop(null));
        runner.shutdown();
    }

    /**
     * Ask the loop to exit. The tick in progress, including its dispatches, runs to
     * completion first.
     */
    public void stop() {
        stopRequested = true;
        if (running.get()) {
            commands.offer(new EngineCommand<>(() -> null));
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
        ExecutorService current;
        synchronized (this) {
            current = runner;
        }
        try {
            if (current != null && !current.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[EventEngine] Loop did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            dispatchExecutor.shutdownNow();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runLoop(Duration duration) {
        loopThread = Thread.currentThread();
        long startNanos = System.nanoTime();
        log.info("[EventEngine] Running with tick interval {}ms{}", tickInterval.toMillis(),
                duration != null ? ", stopping after " + duration.toMillis() + "ms" : "");
        try {
            while (!stopRequested) {
                drainCommands();
                safeTick();
                awaitNextTick();
                if (duration != null && System.nanoTime() - startNanos >= duration.toNanos()) {
                    break;
                }
            }
        } finally {
            running.set(false);
            loopThread = null;
            rejectPendingCommands();
            log.info("[EventEngine] Stopped");
        }
    }

    private void safeTick() {
        try {
            tick(clock.instant());
        } catch (Exception e) { // NOSONAR - a failing tick must not end the loop
            log.error("[EventEngine] Tick failed: {}", e.getMessage(), e);
        }
    }

    private void awaitNextTick() {
        long nextTick = System.nanoTime() + tickInterval.toNanos();
        try {
            while (!stopRequested) {
                long remaining = nextTick - System.nanoTime();
                if (remaining <= 0) {
                    return;
                }
                EngineCommand<?> command = commands.poll(remaining, TimeUnit.NANOSECONDS);
                if (command != null) {
                    command.execute();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        }
    }

    private void drainCommands() {
        EngineCommand<?> command = commands.poll();
        while (command != null) {
            command.execute();
            command = commands.poll();
        }
    }

    private void rejectPendingCommands() {
        EngineCommand<?> command = commands.poll();
        while (command != null) {
            command.reject(new EngineUnavailableException("Event engine stopped"));
            command = commands.poll();
        }
    }

    // ==================== ADMINISTRATION ====================

    /**
     * Splice an already-loaded event into the registry, with no firing history.
     *
     * @throws DuplicateEventException
     *             if an event with the same name is registered
     */
    public EventSummary create(EventDefinition event) {
        return submit("create " + event.getName(), () -> {
            if (find(event.getName()).isPresent()) {
                throw new DuplicateEventException(event.getName());
            }
            purgeState(event.getName());
            events.add(event);
            auditLog.record(event.getName(), AuditEntry.Kind.CREATED, AuditEntry.Status.OK,
                    "schedule: " + event.getScheduleRaw() + " | action: " + event.getAction().target());
            publishSnapshot();
            return summarize(event);
        });
    }

    /**
     * Remove an event and purge its firing history.
     *
     * @return the removed event
     */
    public EventDefinition delete(String name) {
        return submit("delete " + name, () -> {
            EventDefinition event = require(name);
            events.remove(event);
            purgeState(name);
            auditLog.record(name, AuditEntry.Kind.DELETED, AuditEntry.Status.OK, "Event removed");
            publishSnapshot();
            return event;
        });
    }

    public EventSummary activate(String name) {
        return submit("activate " + name, () -> {
            EventDefinition event = require(name);
            event.setActive(true);
            auditLog.record(name, AuditEntry.Kind.ACTIVATED, AuditEntry.Status.OK,
                    "Will fire on schedule: " + event.getScheduleRaw());
            publishSnapshot();
            return summarize(event);
        });
    }

    public EventSummary deactivate(String name) {
        return submit("deactivate " + name, () -> {
            EventDefinition event = require(name);
            event.setActive(false);
            auditLog.record(name, AuditEntry.Kind.DEACTIVATED, AuditEntry.Status.OK, "Event stopped");
            publishSnapshot();
            return summarize(event);
        });
    }

    /**
     * Dispatch an event immediately, whatever its type or active flag, through
     * the same path as a scheduled firing.
     *
     * @return the audit entry describing the dispatch outcome
     */
    public AuditEntry fire(String name) {
        return submit("fire " + name, () -> {
            EventDefinition event = require(name);
            AuditEntry outcome = fire(event, clock.instant());
            publishSnapshot();
            return outcome;
        });
    }

    public List<EventSummary> listEvents() {
        return snapshot;
    }

    public Optional<Instant> lastFired(String name) {
        return Optional.ofNullable(lastFired.get(name));
    }

    // ==================== SCHEDULING ====================

    void tick(Instant now) {
        pruneCronBuckets(now);
        for (EventDefinition event : List.copyOf(events)) {
            if (event.isActive() && isDueSafely(event, now)) {
                fire(event, now);
            }
        }
        publishSnapshot();
    }

    /**
     * Interval rules are due when never fired or when the interval has fully
     * elapsed. Cron rules are due at most once per matching minute; the minute is
     * marked as fired here.
     */
    boolean isDue(EventDefinition event, Instant now) {
        if (!event.isScheduled()) {
            return false;
        }

        ScheduleRule rule = event.getSchedule();
        if (rule instanceof IntervalRule interval) {
            Instant last = lastFired.get(event.getName());
            return last == null || !last.plusSeconds(interval.seconds()).isAfter(now);
        }

        if (rule instanceof CronRule cron) {
            CronBucket bucket = new CronBucket(event.getName(), minuteOf(now));
            if (cronFiredThisMinute.contains(bucket)) {
                return false;
            }
            ZonedDateTime local = now.atZone(zone);
            if (cronMatcher.matches(cron, local)) {
                cronFiredThisMinute.add(bucket);
                return true;
            }
        }
        return false;
    }

    private boolean isDueSafely(EventDefinition event, Instant now) {
        try {
            return isDue(event, now);
        } catch (IllegalArgumentException e) {
            log.error("[EventEngine] [{}] Cannot evaluate schedule '{}': {}", event.getName(),
                    event.getScheduleRaw(), e.getMessage());
            return false;
        }
    }

    int pendingCommands() {
        return commands.size();
    }

    boolean hasCronHistory(String name) {
        return cronFiredThisMinute.stream().anyMatch(bucket -> bucket.eventName().equals(name));
    }

    private AuditEntry fire(EventDefinition event, Instant now) {
        // Recorded before dispatch so a slow or failing dispatch is not re-fired next tick
        lastFired.put(event.getName(), now);
        return dispatch(event);
    }

    private void pruneCronBuckets(Instant now) {
        long currentMinute = minuteOf(now);
        cronFiredThisMinute.removeIf(bucket -> bucket.minute() < currentMinute);
    }

    private void purgeState(String name) {
        lastFired.remove(name);
        cronFiredThisMinute.removeIf(bucket -> bucket.eventName().equals(name));
    }

    private static long minuteOf(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), SECONDS_PER_MINUTE);
    }

    // ==================== DISPATCH ====================

    AuditEntry dispatch(EventDefinition event) {
        EventAction action = event.getAction();
        if (action instanceof ToolCallAction toolCall) {
            return dispatchTool(event, toolCall);
        }
        if (action instanceof ScriptCallAction scriptCall) {
            return dispatchScript(event, scriptCall);
        }
        return auditLog.record(event.getName(), AuditEntry.Kind.TOOL_CALL, AuditEntry.Status.SKIPPED,
                "No tool or script defined");
    }

    private AuditEntry dispatchTool(EventDefinition event, ToolCallAction toolCall) {
        String toolName = toolCall.toolName();
        Map<String, Object> params = new LinkedHashMap<>(event.getResolvedParams());
        params.put(EVENT_NAME_PARAM, event.getName());
        log.info("[EventEngine] [{}] Calling tool: {}", event.getName(), toolName);

        try {
            return recordResult(event, AuditEntry.Kind.TOOL_CALL, toolName,
                    await(() -> toolRegistry.call(toolName, params)));
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ToolNotFoundException notFound) {
                return recordFailure(event, AuditEntry.Kind.TOOL_CALL, AuditEntry.Status.ERROR,
                        notFound.getMessage());
            }
            return recordException(event, AuditEntry.Kind.TOOL_CALL, toolName, e);
        } catch (Exception e) { // NOSONAR - dispatch failures are reported, never thrown
            return recordException(event, AuditEntry.Kind.TOOL_CALL, toolName, e);
        }
    }

    private AuditEntry dispatchScript(EventDefinition event, ScriptCallAction scriptCall) {
        String scriptPath = scriptCall.scriptPath();
        log.info("[EventEngine] [{}] Running script: {}", event.getName(), scriptPath);

        try {
            ScriptComponent script = scriptRegistry.resolve(event.getEventDir(), scriptPath);
            Map<String, Object> params = new LinkedHashMap<>(event.getResolvedParams());
            return recordResult(event, AuditEntry.Kind.SCRIPT_CALL, scriptPath, await(() -> script.invoke(params)));
        } catch (ScriptNotFoundException e) {
            return recordFailure(event, AuditEntry.Kind.SCRIPT_CALL, AuditEntry.Status.ERROR, e.getMessage());
        } catch (ScriptEntryPointMissingException e) {
            return recordFailure(event, AuditEntry.Kind.SCRIPT_CALL, AuditEntry.Status.SKIPPED, e.getMessage());
        } catch (Exception e) { // NOSONAR - dispatch failures are reported, never thrown
            return recordException(event, AuditEntry.Kind.SCRIPT_CALL, scriptPath, e);
        }
    }

    /**
     * Start the handler on a dispatch thread and wait for its result. On timeout
     * the worker is interrupted and a pending future is cancelled.
     */
    private ToolResult await(Supplier<CompletableFuture<ToolResult>> handler)
            throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<CompletableFuture<ToolResult>> started = new CompletableFuture<>();
        Future<?> worker = dispatchExecutor.submit(() -> {
            try {
                CompletableFuture<ToolResult> pending = handler.get();
                started.complete(pending != null ? pending : CompletableFuture.completedFuture(null));
            } catch (RuntimeException e) {
                started.completeExceptionally(e);
            }
        });
        CompletableFuture<ToolResult> result = started.thenCompose(Function.identity());
        try {
            return result.get(dispatchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            worker.cancel(true);
            if (started.isDone() && !started.isCompletedExceptionally()) {
                started.join().cancel(true);
            }
            result.cancel(true);
            throw e;
        }
    }

    private AuditEntry recordResult(EventDefinition event, AuditEntry.Kind kind, String target, ToolResult result) {
        if (result == null) {
            return recordFailure(event, kind, AuditEntry.Status.ERROR, target + ": no result");
        }
        String status = result.getStatus() != null ? result.getStatus()
                : (result.isSuccess() ? ToolResult.STATUS_OK : ToolResult.STATUS_ERROR);
        String message = result.isSuccess() ? result.getOutput() : result.getError();
        String detail = target + " -> " + status + (message != null && !message.isBlank() ? " | " + message : "");
        return auditLog.record(event.getName(), kind,
                result.isSuccess() ? AuditEntry.Status.OK : AuditEntry.Status.ERROR, truncate(detail));
    }

    private AuditEntry recordException(EventDefinition event, AuditEntry.Kind kind, String target, Exception e) {
        if (e instanceof TimeoutException) {
            return recordFailure(event, kind, AuditEntry.Status.TIMEOUT,
                    target + " timed out after " + dispatchTimeout.toSeconds() + "s");
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            stopRequested = true;
            return recordFailure(event, kind, AuditEntry.Status.ERROR, target + " interrupted");
        }
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        log.debug("[EventEngine] [{}] Dispatch failure", event.getName(), cause);
        return recordFailure(event, kind, AuditEntry.Status.ERROR, target + " failed: " + cause.getMessage());
    }

    private AuditEntry recordFailure(EventDefinition event, AuditEntry.Kind kind, AuditEntry.Status status,
            String detail) {
        return auditLog.record(event.getName(), kind, status, truncate(detail));
    }

    private static String truncate(String text) {
        return text.length() <= DETAIL_LIMIT ? text : text.substring(0, DETAIL_LIMIT) + "...";
    }

    // ==================== REGISTRY ====================

    /**
     * Names are unique in the registry; lookups return the single match.
     */
    private Optional<EventDefinition> find(String name) {
        return events.stream().filter(event -> event.getName().equals(name)).findFirst();
    }

    private EventDefinition require(String name) {
        return find(name).orElseThrow(() -> new EventNotFoundException(name));
    }

    private void publishSnapshot() {
        snapshot = events.stream().map(this::summarize).toList();
    }

    private EventSummary summarize(EventDefinition event) {
        return EventSummary.builder()
                .name(event.getName())
                .type(event.getEventType().getValue())
                .description(event.getDescription())
                .schedule(event.getScheduleRaw())
                .action(event.getAction().target())
                .active(event.isActive())
                .lastFiredAt(lastFired.get(event.getName()))
                .build();
    }

    // ==================== COMMANDS ====================

    private <T> T onLoop(String description, Supplier<T> action) {
        synchronized (this) {
            if (!running.get()) {
                return action.get();
            }
        }
        return submit(description, action);
    }

    private <T> T submit(String description, Supplier<T> action) {
        if (Thread.currentThread() == loopThread) {
            return action.get();
        }
        if (!running.get()) {
            throw new EngineUnavailableException("Event engine is not running, cannot " + description);
        }

        EngineCommand<T> command = new EngineCommand<>(action);
        commands.add(command);
        if (!running.get() && commands.remove(command)) {
            throw new EngineUnavailableException("Event engine is not running, cannot " + description);
        }

        try {
            return command.result.get(commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            commands.remove(command);
            throw new EngineUnavailableException(
                    "Event engine did not answer '" + description + "' within " + commandTimeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineUnavailableException("Interrupted while waiting for '" + description + "'", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new EventEngineException("Failed to " + description + ": " + e.getCause().getMessage(), e);
        }
    }

    private static final class EngineCommand<T> {

        private final Supplier<T> action;
        private final CompletableFuture<T> result = new CompletableFuture<>();

        EngineCommand(Supplier<T> action) {
            this.action = action;
        }

        void execute() {
            try {
                result.complete(action.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }

        void reject(RuntimeException reason) {
            result.completeExceptionally(reason);
        }
    }

    private record CronBucket(String eventName, long minute) {
    }
}

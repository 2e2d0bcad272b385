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

import me.golemcore.events.domain.component.ToolComponent;
import me.golemcore.events.domain.exception.ToolNotFoundException;
import me.golemcore.events.domain.model.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to tool registry used by the engine to run tool-call actions. Decouples
 * the scheduler from concrete side effects.
 *
 * <p>
 * Every registered tool is held as a {@link ToolComponent}, so callers always
 * get a {@link CompletableFuture}: synchronous handlers complete it before
 * {@link #call} returns, asynchronous ones complete it later. A handler that
 * throws yields an exceptionally completed future rather than an exception from
 * {@code call}.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<ToolComponent> toolComponents) {
        if (toolComponents != null) {
            for (ToolComponent tool : toolComponents) {
                if (tool.isEnabled()) {
                    register(tool);
                } else {
                    log.info("[ToolRegistry] Tool {} is disabled, not registered", tool.getToolName());
                }
            }
        }
    }

    public void register(ToolComponent tool) {
        ToolComponent previous = tools.put(tool.getToolName(), tool);
        if (previous != null) {
            log.warn("[ToolRegistry] Tool {} replaced", tool.getToolName());
        } else {
            log.info("[ToolRegistry] Registered tool: {}", tool.getToolName());
        }
    }

    public void register(String name, ToolHandler handler) {
        register(new HandlerTool(name, params -> {
            try {
                return CompletableFuture.completedFuture(handler.handle(params));
            } catch (Exception e) { // NOSONAR - surfaced through the future
                return CompletableFuture.failedFuture(e);
            }
        }));
    }

    public void registerAsync(String name, AsyncToolHandler handler) {
        register(new HandlerTool(name, params -> {
            try {
                return handler.handle(params);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }));
    }

    public boolean unregister(String name) {
        return tools.remove(name) != null;
    }

    /**
     * Invoke a tool by name.
     *
     * @throws ToolNotFoundException
     *             if no tool is registered under {@code name}; the exception lists
     *             the available tools
     */
    public CompletableFuture<ToolResult> call(String name, Map<String, Object> parameters) {
        ToolComponent tool = tools.get(name);
        if (tool == null) {
            throw new ToolNotFoundException(name, listTools());
        }
        try {
            CompletableFuture<ToolResult> future = tool.execute(parameters);
            return future != null ? future
                    : CompletableFuture.completedFuture(ToolResult.failure("Tool returned no result"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public List<String> listTools() {
        List<String> names = new ArrayList<>(tools.keySet());
        names.sort(null);
        return names;
    }

    private record HandlerTool(String name, AsyncToolHandler body) implements ToolComponent {

        @Override
        public String getToolName() {
            return name;
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            return body.handle(parameters);
        }
    }
}

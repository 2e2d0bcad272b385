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

import me.golemcore.events.domain.component.ScriptComponent;
import me.golemcore.events.domain.exception.ScriptEntryPointMissingException;
import me.golemcore.events.domain.exception.ScriptNotFoundException;
import me.golemcore.events.domain.model.ToolResult;
import me.golemcore.events.infrastructure.config.EventsProperties;
import me.golemcore.events.port.outbound.ScriptProcessPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the script declared by an event folder to something that can run
 * it.
 *
 * <p>
 * Scripts are not loaded as code. A folder's script path maps to a
 * {@link ScriptComponent} registered under its relative path (e.g.
 * {@code scripts/send_mail.py}) or its file name; when none is registered and
 * process execution is enabled, the file runs through {@link ScriptProcessPort}
 * if an interpreter is configured for its extension.
 */
@Service
@Slf4j
public class ScriptRegistry {

    private final Map<String, ScriptComponent> scripts = new ConcurrentHashMap<>();
    private final ScriptProcessPort processPort;
    private final boolean processEnabled;

    public ScriptRegistry(List<ScriptComponent> scriptComponents, ScriptProcessPort processPort,
            EventsProperties properties) {
        this.processPort = processPort;
        this.processEnabled = properties.getScripts().isProcessEnabled();
        if (scriptComponents != null) {
            for (ScriptComponent script : scriptComponents) {
                if (!script.isEnabled()) {
                    continue;
                }
                for (String key : script.getScriptKeys()) {
                    register(key, script);
                }
            }
        }
    }

    public void register(String key, ScriptComponent script) {
        scripts.put(normalizeKey(key), script);
        log.info("[Script] Registered script entry point: {}", key);
    }

    public boolean unregister(String key) {
        return scripts.remove(normalizeKey(key)) != null;
    }

    public List<String> listScripts() {
        List<String> keys = new ArrayList<>(scripts.keySet());
        keys.sort(null);
        return keys;
    }

    /**
     * Find the entry point for {@code scriptPath}, relative to {@code eventDir}.
     *
     * @throws ScriptNotFoundException
     *             if the path escapes the folder or no such file exists
     * @throws ScriptEntryPointMissingException
     *             if the file exists but nothing can invoke it
     */
    public ScriptComponent resolve(Path eventDir, String scriptPath) {
        Path script = locate(eventDir, scriptPath);

        String relativeKey = normalizeKey(eventDir.relativize(script).toString());
        ScriptComponent registered = scripts.get(relativeKey);
        if (registered == null) {
            registered = scripts.get(script.getFileName().toString());
        }
        if (registered != null) {
            return registered;
        }

        if (processEnabled && processPort.supports(script)) {
            return new ProcessScript(script, eventDir, processPort);
        }
        throw new ScriptEntryPointMissingException("Script " + scriptPath
                + " has no registered entry point and no configured interpreter");
    }

    private Path locate(Path eventDir, String scriptPath) {
        Path script;
        try {
            script = eventDir.resolve(scriptPath).normalize();
        } catch (InvalidPathException e) {
            throw new ScriptNotFoundException("Invalid script path: " + scriptPath);
        }
        if (!script.startsWith(eventDir.normalize()) || !Files.isRegularFile(script)) {
            throw new ScriptNotFoundException("Script not found: " + script);
        }
        try {
            if (!script.toRealPath().startsWith(eventDir.toRealPath())) {
                throw new ScriptNotFoundException("Script outside event folder: " + scriptPath);
            }
        } catch (IOException e) {
            throw new ScriptNotFoundException("Script not readable: " + script);
        }
        return script;
    }

    private static String normalizeKey(String key) {
        String normalized = key.replace('\\', '/').trim();
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    private record ProcessScript(Path script, Path workDir, ScriptProcessPort port) implements ScriptComponent {

        @Override
        public CompletableFuture<ToolResult> invoke(Map<String, Object> parameters) {
            return port.run(script, workDir, parameters);
        }
    }
}

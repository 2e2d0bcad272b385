package me.golemcore.events.domain.service;

import me.golemcore.events.domain.component.ScriptComponent;
import me.golemcore.events.domain.exception.ScriptEntryPointMissingException;
import me.golemcore.events.domain.exception.ScriptNotFoundException;
import me.golemcore.events.domain.model.ToolResult;
import me.golemcore.events.infrastructure.config.EventsProperties;
import me.golemcore.events.port.outbound.ScriptProcessPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ScriptRegistryTest {

    private static final String SCRIPT_PATH = "scripts/send_mail.py";

    @TempDir
    Path tempDir;

    private Path eventDir;
    private ScriptProcessPort processPort;
    private EventsProperties properties;

    @BeforeEach
    void setUp() throws IOException {
        eventDir = Files.createDirectories(tempDir.resolve("send-team-mail"));
        Files.createDirectories(eventDir.resolve("scripts"));
        Files.writeString(eventDir.resolve(SCRIPT_PATH), "print('hi')\n");
        processPort = mock(ScriptProcessPort.class);
        properties = new EventsProperties();
    }

    @Test
    void resolvesComponentByRelativePath() {
        ScriptComponent script = scriptWithKeys(SCRIPT_PATH);
        ScriptRegistry registry = new ScriptRegistry(List.of(script), processPort, properties);

        assertSame(script, registry.resolve(eventDir, SCRIPT_PATH));
        assertSame(script, registry.resolve(eventDir, "./" + SCRIPT_PATH));
        verifyNoInteractions(processPort);
    }

    @Test
    void fallsBackToFileName() {
        ScriptComponent script = scriptWithKeys("send_mail.py");
        ScriptRegistry registry = new ScriptRegistry(List.of(script), processPort, properties);

        assertSame(script, registry.resolve(eventDir, SCRIPT_PATH));
    }

    @Test
    void relativePathWinsOverFileName() {
        ScriptComponent byName = scriptWithKeys("send_mail.py");
        ScriptComponent byPath = scriptWithKeys(SCRIPT_PATH);
        ScriptRegistry registry = new ScriptRegistry(List.of(byName, byPath), processPort, properties);

        assertSame(byPath, registry.resolve(eventDir, SCRIPT_PATH));
    }

    @Test
    void usesProcessWhenNothingIsRegistered() throws Exception {
        Path script = eventDir.resolve(SCRIPT_PATH);
        when(processPort.supports(script)).thenReturn(true);
        when(processPort.run(eq(script), eq(eventDir), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("done")));
        ScriptRegistry registry = new ScriptRegistry(List.of(), processPort, properties);

        ScriptComponent resolved = registry.resolve(eventDir, SCRIPT_PATH);
        ToolResult result = resolved.invoke(Map.of("to", "a@example.com")).get();

        assertEquals("done", result.getOutput());
        verify(processPort).run(script, eventDir, Map.of("to", "a@example.com"));
    }

    @Test
    void missingEntryPointWhenProcessDisabled() {
        properties.getScripts().setProcessEnabled(false);
        ScriptRegistry registry = new ScriptRegistry(List.of(), processPort, properties);

        assertThrows(ScriptEntryPointMissingException.class, () -> registry.resolve(eventDir, SCRIPT_PATH));
    }

    @Test
    void missingEntryPointWhenNoInterpreter() {
        when(processPort.supports(any())).thenReturn(false);
        ScriptRegistry registry = new ScriptRegistry(List.of(), processPort, properties);

        assertThrows(ScriptEntryPointMissingException.class, () -> registry.resolve(eventDir, SCRIPT_PATH));
    }

    @Test
    void missingFileIsNotFound() {
        ScriptRegistry registry = new ScriptRegistry(List.of(scriptWithKeys("nope.py")), processPort, properties);

        assertThrows(ScriptNotFoundException.class, () -> registry.resolve(eventDir, "scripts/nope.py"));
    }

    @Test
    void pathEscapingFolderIsNotFound() throws IOException {
        Files.writeString(tempDir.resolve("evil.py"), "print('x')\n");
        ScriptRegistry registry = new ScriptRegistry(List.of(scriptWithKeys("evil.py")), processPort, properties);

        assertThrows(ScriptNotFoundException.class, () -> registry.resolve(eventDir, "../evil.py"));
    }

    @Test
    void disabledComponentsAreNotRegistered() {
        ScriptComponent disabled = scriptWithKeys(SCRIPT_PATH);
        when(disabled.isEnabled()).thenReturn(false);
        ScriptRegistry registry = new ScriptRegistry(List.of(disabled), processPort, properties);

        assertTrue(registry.listScripts().isEmpty());
    }

    @Test
    void registerAndUnregister() {
        ScriptRegistry registry = new ScriptRegistry(List.of(), processPort, properties);
        ScriptComponent script = scriptWithKeys();

        registry.register(SCRIPT_PATH, script);
        assertEquals(List.of(SCRIPT_PATH), registry.listScripts());

        assertTrue(registry.unregister(SCRIPT_PATH));
        assertTrue(registry.listScripts().isEmpty());
    }

    private static ScriptComponent scriptWithKeys(String... keys) {
        ScriptComponent script = mock(ScriptComponent.class);
        when(script.isEnabled()).thenReturn(true);
        when(script.getScriptKeys()).thenReturn(List.of(keys));
        return script;
    }
}

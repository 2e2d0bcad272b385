package me.golemcore.events.infrastructure.config;

import me.golemcore.events.domain.model.EventScanResult;
import me.golemcore.events.domain.service.ScriptRegistry;
import me.golemcore.events.domain.service.ToolRegistry;
import me.golemcore.events.scheduler.EventEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AutoConfigurationTest {

    @TempDir
    Path tempDir;

    @Mock
    private EventEngine engine;
    @Mock
    private ToolRegistry toolRegistry;
    @Mock
    private ScriptRegistry scriptRegistry;

    private EventsProperties properties;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(engine.load()).thenReturn(new EventScanResult(List.of(), Map.of("broken", "bad header")));
        when(toolRegistry.listTools()).thenReturn(List.of("mail_send"));
        when(scriptRegistry.listScripts()).thenReturn(List.of());
        properties = new EventsProperties();
        properties.setRoot(tempDir.resolve("events").toString());
    }

    @Test
    void shouldCreateRootLoadAndStartEngine() {
        AutoConfiguration autoConfiguration = new AutoConfiguration(properties, engine, toolRegistry, scriptRegistry);

        autoConfiguration.init();

        assertTrue(Files.isDirectory(tempDir.resolve("events")));
        verify(engine).load();
        verify(engine).start();
    }

    @Test
    void shouldNotStartEngineWhenAutoStartDisabled() {
        properties.getEngine().setAutoStart(false);
        AutoConfiguration autoConfiguration = new AutoConfiguration(properties, engine, toolRegistry, scriptRegistry);

        autoConfiguration.init();

        verify(engine).load();
        verify(engine, never()).start();
    }

    @Test
    void objectMapperWritesIsoDates() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertEquals("\"2024-01-01T09:00:00Z\"", mapper.writeValueAsString(Instant.parse("2024-01-01T09:00:00Z")));
    }
}

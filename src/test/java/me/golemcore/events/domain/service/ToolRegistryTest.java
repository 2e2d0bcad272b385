package me.golemcore.events.domain.service;

import me.golemcore.events.domain.component.ToolComponent;
import me.golemcore.events.domain.exception.ToolNotFoundException;
import me.golemcore.events.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ToolRegistryTest {

    private static final String TOOL_NAME = "mail_send";

    private ToolComponent mailTool;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        mailTool = mock(ToolComponent.class);
        when(mailTool.getToolName()).thenReturn(TOOL_NAME);
        when(mailTool.isEnabled()).thenReturn(true);
        registry = new ToolRegistry(List.of(mailTool));
    }

    @Test
    void registersEnabledComponents() {
        assertTrue(registry.hasTool(TOOL_NAME));
        assertEquals(List.of(TOOL_NAME), registry.listTools());
    }

    @Test
    void skipsDisabledComponents() {
        ToolComponent disabled = mock(ToolComponent.class);
        when(disabled.getToolName()).thenReturn("disabled");
        when(disabled.isEnabled()).thenReturn(false);

        ToolRegistry withDisabled = new ToolRegistry(List.of(mailTool, disabled));

        assertFalse(withDisabled.hasTool("disabled"));
    }

    @Test
    void callDelegatesToComponent() throws Exception {
        Map<String, Object> params = Map.of("to", List.of("a@example.com"));
        when(mailTool.execute(params)).thenReturn(CompletableFuture.completedFuture(ToolResult.success("sent")));

        ToolResult result = registry.call(TOOL_NAME, params).get();

        assertTrue(result.isSuccess());
        assertEquals("sent", result.getOutput());
        verify(mailTool).execute(params);
    }

    @Test
    void unknownToolListsAvailableOnes() {
        registry.register("noop", params -> ToolResult.success("done"));

        ToolNotFoundException e = assertThrows(ToolNotFoundException.class,
                () -> registry.call("missing", Map.of()));

        assertEquals("missing", e.getToolName());
        assertEquals(List.of(TOOL_NAME, "noop"), e.getAvailableTools());
        assertTrue(e.getMessage().contains("missing"));
        assertTrue(e.getMessage().contains(TOOL_NAME));
    }

    @Test
    void synchronousHandlerIsWrapped() throws Exception {
        registry.register("echo", params -> ToolResult.success(String.valueOf(params.get("text"))));

        assertEquals("hi", registry.call("echo", Map.of("text", "hi")).get().getOutput());
    }

    @Test
    void handlerExceptionSurfacesThroughFuture() {
        registry.register("boom", params -> {
            throw new IllegalStateException("exploded");
        });

        CompletableFuture<ToolResult> future = registry.call("boom", Map.of());

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertEquals("exploded", e.getCause().getMessage());
    }

    @Test
    void asyncHandlerIsCalledAsIs() throws Exception {
        registry.registerAsync("later", params -> CompletableFuture.supplyAsync(() -> ToolResult.success("ok")));

        assertEquals("ok", registry.call("later", Map.of()).get().getOutput());
    }

    @Test
    void componentThrowingOnExecuteYieldsFailedFuture() {
        when(mailTool.execute(anyMap())).thenThrow(new IllegalArgumentException("bad params"));

        CompletableFuture<ToolResult> future = registry.call(TOOL_NAME, Map.of());

        assertTrue(future.isCompletedExceptionally());
    }

    @Test
    void nullFutureBecomesFailureResult() throws Exception {
        when(mailTool.execute(anyMap())).thenReturn(null);

        ToolResult result = registry.call(TOOL_NAME, Map.of()).get();

        assertFalse(result.isSuccess());
    }

    @Test
    void registeringSameNameReplacesTool() throws Exception {
        registry.register(TOOL_NAME, params -> ToolResult.success("replacement"));

        assertEquals("replacement", registry.call(TOOL_NAME, Map.of()).get().getOutput());
        assertEquals(1, registry.listTools().size());
    }

    @Test
    void unregisterRemovesTool() {
        assertTrue(registry.unregister(TOOL_NAME));
        assertFalse(registry.unregister(TOOL_NAME));
        assertFalse(registry.hasTool(TOOL_NAME));
    }
}

package me.golemcore.events.adapter.outbound.script;

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

import me.golemcore.events.domain.model.ToolResult;
import me.golemcore.events.infrastructure.config.EventsProperties;
import me.golemcore.events.port.outbound.ScriptProcessPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs event scripts as external processes.
 *
 * <p>
 * The interpreter is picked by file extension from
 * {@code events.scripts.interpreters} (e.g. {@code py=python3}). The process
 * runs in the event folder, receives the resolved parameters as a JSON object
 * on stdin, and may print a JSON object on stdout; its {@code status} field is
 * carried into the result. Non-JSON output is returned as plain text.
 *
 * <p>
 * A process that outlives {@code events.scripts.process-timeout} is killed and
 * reported as a failure.
 */
@Component
@Slf4j
public class ProcessScriptAdapter implements ScriptProcessPort {

    private static final int MAX_OUTPUT_LENGTH = 100_000;
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final Map<String, String> interpreters;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    public ProcessScriptAdapter(EventsProperties properties, ObjectMapper objectMapper) {
        EventsProperties.ScriptsProperties config = properties.getScripts();
        this.interpreters = new LinkedHashMap<>();
        config.getInterpreters().forEach((ext, command) -> interpreters.put(ext.toLowerCase(Locale.ROOT), command));
        this.timeout = config.getProcessTimeout();
        this.objectMapper = objectMapper;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "event-script");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Script] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean supports(Path script) {
        return interpreterFor(script) != null;
    }

    @Override
    public CompletableFuture<ToolResult> run(Path script, Path workDir, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String interpreter = interpreterFor(script);
            if (interpreter == null) {
                return ToolResult.failure("No interpreter configured for " + script.getFileName());
            }
            log.info("[Script] Running {} {}", interpreter, script.getFileName());
            try {
                return execute(interpreter, script, workDir, parameters);
            } catch (IOException e) {
                return ToolResult.failure("Failed to start script: " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ToolResult.failure("Script execution interrupted");
            } catch (ExecutionException e) {
                return ToolResult.failure("Error reading script output: " + e.getMessage());
            }
        }, executor);
    }

    String interpreterFor(Path script) {
        String fileName = script.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return null;
        }
        return interpreters.get(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private ToolResult execute(String interpreter, Path script, Path workDir, Map<String, Object> parameters)
            throws IOException, InterruptedException, ExecutionException {
        ProcessBuilder pb = new ProcessBuilder(interpreter, script.toString());
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);

        long startTime = System.currentTimeMillis();
        Process process = pb.start();

        // stdin and stdout are both serviced on the executor while this thread waits
        byte[] input = objectMapper.writeValueAsBytes(parameters);
        Future<String> outputFuture = executor.submit(() -> readOutput(process));
        Future<?> inputFuture = executor.submit(() -> writeInput(process, input));

        boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!completed) {
            process.destroyForcibly();
            inputFuture.cancel(true);
            outputFuture.cancel(true);
            return ToolResult.failure("Script timed out after " + timeout.toSeconds() + " seconds");
        }

        String output;
        try {
            output = outputFuture.get(1, TimeUnit.SECONDS).strip();
        } catch (TimeoutException e) {
            output = "[Output read timeout]";
        }

        int exitCode = process.exitValue();
        long duration = System.currentTimeMillis() - startTime;
        log.info("[Script] {} finished: exitCode={}, duration={}ms", script.getFileName(), exitCode, duration);

        Map<String, Object> data = parseJson(output);
        Map<String, Object> resultData = new LinkedHashMap<>();
        if (data != null) {
            resultData.putAll(data);
        }
        resultData.put("exitCode", exitCode);
        resultData.put("duration", duration);

        Object status = data != null ? data.get("status") : null;
        if (exitCode == 0) {
            return ToolResult.builder()
                    .success(true)
                    .status(status != null ? status.toString() : ToolResult.STATUS_OK)
                    .output(output.isEmpty() ? "(no output)" : output)
                    .data(resultData)
                    .build();
        }
        return ToolResult.builder()
                .success(false)
                .status(status != null ? status.toString() : ToolResult.STATUS_ERROR)
                .output(output)
                .data(resultData)
                .error("Script failed with exit code " + exitCode)
                .build();
    }

    private void writeInput(Process process, byte[] input) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(input);
        } catch (IOException e) {
            log.debug("[Script] Script closed stdin early: {}", e.getMessage());
        }
    }

    private String readOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() < MAX_OUTPUT_LENGTH) {
                    output.append(line).append('\n');
                }
                line = reader.readLine();
            }
        }
        return output.toString();
    }

    private Map<String, Object> parseJson(String output) {
        if (!output.startsWith("{")) {
            return null;
        }
        try {
            return objectMapper.readValue(output, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}

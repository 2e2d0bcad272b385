package me.golemcore.events.port.outbound;

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

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for running a script file as an external process. Abstracts process
 * management and interpreter selection from the domain layer.
 */
public interface ScriptProcessPort {

    /**
     * Whether an interpreter is configured for this script file.
     */
    boolean supports(Path script);

    /**
     * Run the script in {@code workDir}, handing it the parameters as JSON.
     */
    CompletableFuture<ToolResult> run(Path script, Path workDir, Map<String, Object> parameters);
}

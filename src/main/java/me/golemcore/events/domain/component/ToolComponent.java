package me.golemcore.events.domain.component;

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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing a named action an event can call. Spring beans of
 * this type are registered in the
 * {@link me.golemcore.events.domain.service.ToolRegistry} at startup; plain
 * lambdas can be registered there as well.
 */
public interface ToolComponent extends Component {

    /**
     * Returns the unique name events use to call this tool.
     *
     * @return the tool name
     */
    String getToolName();

    /**
     * Executes the tool. The parameters are the event's resolved parameters plus
     * the injected {@code _event_name} field.
     *
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);
}

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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of a script declared by an event folder. Implementations are
 * registered in the {@link me.golemcore.events.domain.service.ScriptRegistry}
 * under the script's relative path or file name.
 */
public interface ScriptComponent extends Component {

    /**
     * Keys this script answers to, e.g. {@code scripts/send_mail.py} or
     * {@code send_mail.py}.
     */
    default List<String> getScriptKeys() {
        return List.of();
    }

    /**
     * Invokes the script with the event's resolved parameters.
     *
     * @param parameters
     *            resolved parameters of the firing event
     * @return a future containing the script result
     */
    CompletableFuture<ToolResult> invoke(Map<String, Object> parameters);
}

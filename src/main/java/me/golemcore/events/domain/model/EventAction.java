package me.golemcore.events.domain.model;

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

import java.util.Map;

/**
 * What an event does when it fires. Decided once at load time: either a
 * {@link ToolCallAction} or a {@link ScriptCallAction}.
 */
public interface EventAction {

    /**
     * Tool name or script path, for listings and audit records.
     */
    String target();

    /**
     * Parameters as written in the manifest, before file-reference resolution.
     */
    Map<String, Object> params();
}

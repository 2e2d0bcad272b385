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

import lombok.Builder;
import lombok.Data;

/**
 * Result of a tool or script invocation. {@code status} is the short outcome
 * label handlers report ({@code sent}, {@code ok}, {@code error}, ...);
 * {@code success} is the boolean the engine audits on.
 */
@Data
@Builder
public class ToolResult {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String status;
    private String output;
    private Object data;
    private String error;

    /**
     * Creates a successful result with output text.
     */
    public static ToolResult success(String output) {
        return ToolResult.builder()
                .success(true)
                .status(STATUS_OK)
                .output(output)
                .build();
    }

    /**
     * Creates a successful result with output text and structured data.
     */
    public static ToolResult success(String output, Object data) {
        return ToolResult.builder()
                .success(true)
                .status(STATUS_OK)
                .output(output)
                .data(data)
                .build();
    }

    /**
     * Creates a failed result with an error message.
     */
    public static ToolResult failure(String error) {
        return ToolResult.builder()
                .success(false)
                .status(STATUS_ERROR)
                .error(error)
                .build();
    }
}

package me.golemcore.events.tools;

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

import me.golemcore.events.domain.component.ToolComponent;
import me.golemcore.events.domain.model.ToolResult;
import me.golemcore.events.infrastructure.config.EventsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mock mail sender registered as {@code mail_send}.
 *
 * <p>
 * Accepts {@code to} as a list of addresses or as newline-separated text
 * ({@code #} lines ignored), plus {@code subject} and {@code body}. Nothing is
 * transmitted: the message is logged and a {@code mock-NNNN} id is returned
 * with status {@code sent}.
 *
 * <p>
 * Enabled by {@code events.tools.mail.enabled}.
 */
@Component
@Slf4j
public class MailSendTool implements ToolComponent {

    public static final String TOOL_NAME = "mail_send";
    public static final String STATUS_SENT = "sent";

    private static final String DEFAULT_SUBJECT = "(no subject)";

    private final EventsProperties properties;
    private final AtomicInteger messageCounter = new AtomicInteger();

    public MailSendTool(EventsProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getToolName() {
        return TOOL_NAME;
    }

    @Override
    public boolean isEnabled() {
        return properties.getTools().getMail().isEnabled();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> send(parameters));
    }

    private ToolResult send(Map<String, Object> parameters) {
        List<String> recipients = parseRecipients(parameters.get("to"));
        String subject = stringParam(parameters, "subject", DEFAULT_SUBJECT);
        String body = stringParam(parameters, "body", "");
        String eventName = stringParam(parameters, "_event_name", "unknown-event");

        if (recipients.isEmpty()) {
            log.warn("[MailSend] [{}] No valid recipients", eventName);
            return ToolResult.failure("No valid recipients");
        }

        String messageId = String.format("mock-%04d", messageCounter.incrementAndGet());
        log.info("[MailSend] [{}] {} to {} recipient(s): subject='{}', {} chars", eventName, messageId,
                recipients.size(), subject, body.length());
        log.debug("[MailSend] [{}] Recipients: {}", eventName, recipients);

        return ToolResult.builder()
                .success(true)
                .status(STATUS_SENT)
                .output("Sent " + messageId + " to " + recipients.size() + " recipient(s)")
                .data(Map.of(
                        "message_id", messageId,
                        "recipients", recipients.size(),
                        "subject", subject))
                .build();
    }

    static List<String> parseRecipients(Object raw) {
        if (raw instanceof String text) {
            return text.lines()
                    .map(String::strip)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .toList();
        }
        if (raw instanceof Collection<?> values) {
            return values.stream()
                    .filter(Objects::nonNull)
                    .map(value -> value.toString().strip())
                    .filter(value -> !value.isEmpty())
                    .toList();
        }
        return List.of();
    }

    private static String stringParam(Map<String, Object> parameters, String key, String fallback) {
        Object value = parameters.get(key);
        return value != null ? value.toString() : fallback;
    }
}

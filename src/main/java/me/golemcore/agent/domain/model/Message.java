package me.golemcore.agent.domain.model;

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
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One entry of a run transcript. The {@link Role} decides which fields are
 * meaningful:
 * <ul>
 * <li>{@code SYSTEM}: {@code content}</li>
 * <li>{@code USER}: {@code parts}</li>
 * <li>{@code ASSISTANT}: {@code content} and {@code toolCalls}</li>
 * <li>{@code TOOL_RESULTS}: {@code toolResults}</li>
 * </ul>
 *
 * <p>
 * Messages are immutable once built; the transcript only ever grows.
 */
@Value
@Builder
@Jacksonized
public class Message {

    public enum Role {
        SYSTEM, USER, ASSISTANT, TOOL_RESULTS
    }

    Role role;
    String content;

    @Singular
    List<ContentPart> parts;

    @Singular
    List<ToolCall> toolCalls;

    @Singular
    List<ToolResultEntry> toolResults;

    public static Message system(String text) {
        return Message.builder().role(Role.SYSTEM).content(text).build();
    }

    public static Message user(String text) {
        return Message.builder().role(Role.USER).part(ContentPart.text(text)).build();
    }

    public static Message user(List<ContentPart> parts) {
        return Message.builder().role(Role.USER).parts(parts).build();
    }

    public static Message assistant(String text, List<ToolCall> toolCalls) {
        return Message.builder()
                .role(Role.ASSISTANT)
                .content(text != null ? text : "")
                .toolCalls(toolCalls != null ? toolCalls : List.of())
                .build();
    }

    public static Message toolResults(List<ToolResultEntry> entries) {
        return Message.builder().role(Role.TOOL_RESULTS).toolResults(entries).build();
    }

    /**
     * Checks if this message contains tool calls from the model.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Concatenated text of the message regardless of role.
     */
    public String text() {
        if (role == Role.USER) {
            StringBuilder sb = new StringBuilder();
            for (ContentPart part : parts) {
                if (part.getType() == ContentPart.Type.TEXT && part.getText() != null) {
                    sb.append(part.getText());
                }
            }
            return sb.toString();
        }
        if (role == Role.TOOL_RESULTS) {
            StringBuilder sb = new StringBuilder();
            for (ToolResultEntry entry : toolResults) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(entry.getContent());
            }
            return sb.toString();
        }
        return content != null ? content : "";
    }

    /**
     * A function call requested by the model. Consumed at most once by the
     * loop.
     */
    @Value
    @Builder
    @Jacksonized
    public static class ToolCall {
        String id;
        String name;
        String argumentsJson;

        public static ToolCall of(String id, String name, String argumentsJson) {
            return ToolCall.builder().id(id).name(name).argumentsJson(argumentsJson).build();
        }
    }

    /**
     * The result fed back to the model for one tool call.
     */
    @Value
    @Builder
    @Jacksonized
    public static class ToolResultEntry {
        String toolCallId;
        String toolName;
        String content;
        boolean error;

        public static ToolResultEntry success(Message.ToolCall call, String content) {
            return new ToolResultEntry(call.getId(), call.getName(), content, false);
        }

        public static ToolResultEntry error(Message.ToolCall call, String content) {
            return new ToolResultEntry(call.getId(), call.getName(), content, true);
        }
    }
}

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
import lombok.Value;

/**
 * Event of the live stream mode. Model deltas are forwarded as they arrive;
 * tool results, usage updates and the final result come from the loop.
 *
 * @param <O>
 *            output type
 */
@Value
@Builder
public class AgentStreamEvent<O> {

    public enum Kind {
        CONTENT_DELTA, TOOL_CALL_START, TOOL_CALL_DELTA, TOOL_CALL_END, TOOL_RESULT, USAGE, RESULT
    }

    Kind kind;
    String text;
    String toolCallId;
    String toolName;
    ToolCallResult toolResult;
    Usage usage;
    AgentResult<O> result;

    public static <O> AgentStreamEvent<O> contentDelta(String text) {
        return AgentStreamEvent.<O>builder().kind(Kind.CONTENT_DELTA).text(text).build();
    }

    public static <O> AgentStreamEvent<O> toolCallStart(String id, String name) {
        return AgentStreamEvent.<O>builder().kind(Kind.TOOL_CALL_START).toolCallId(id).toolName(name).build();
    }

    public static <O> AgentStreamEvent<O> toolCallDelta(String id, String argumentsDelta) {
        return AgentStreamEvent.<O>builder().kind(Kind.TOOL_CALL_DELTA).toolCallId(id).text(argumentsDelta).build();
    }

    public static <O> AgentStreamEvent<O> toolCallEnd(String id) {
        return AgentStreamEvent.<O>builder().kind(Kind.TOOL_CALL_END).toolCallId(id).build();
    }

    public static <O> AgentStreamEvent<O> toolResult(ToolCallResult result) {
        return AgentStreamEvent.<O>builder()
                .kind(Kind.TOOL_RESULT)
                .toolCallId(result.call().getId())
                .toolName(result.call().getName())
                .toolResult(result)
                .build();
    }

    public static <O> AgentStreamEvent<O> usage(Usage usage) {
        return AgentStreamEvent.<O>builder().kind(Kind.USAGE).usage(usage).build();
    }

    public static <O> AgentStreamEvent<O> result(AgentResult<O> result) {
        return AgentStreamEvent.<O>builder().kind(Kind.RESULT).result(result).usage(result.getUsage()).build();
    }
}

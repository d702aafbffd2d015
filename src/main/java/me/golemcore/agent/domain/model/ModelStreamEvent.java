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
 * Incremental event emitted by {@code ModelPort.stream}. A stream ends with
 * exactly one {@link Kind#DONE} event carrying the assembled response.
 * {@code toolCallId} is optional on {@link Kind#TOOL_CALL_DELTA}; consumers fall
 * back to the most recently started call.
 */
@Value
@Builder
public class ModelStreamEvent {

    public enum Kind {
        CONTENT_DELTA, TOOL_CALL_START, TOOL_CALL_DELTA, TOOL_CALL_END, DONE
    }

    Kind kind;
    String text;
    String toolCallId;
    String toolName;
    ModelResponse response;

    public static ModelStreamEvent contentDelta(String text) {
        return ModelStreamEvent.builder().kind(Kind.CONTENT_DELTA).text(text).build();
    }

    public static ModelStreamEvent toolCallStart(String id, String name) {
        return ModelStreamEvent.builder().kind(Kind.TOOL_CALL_START).toolCallId(id).toolName(name).build();
    }

    public static ModelStreamEvent toolCallDelta(String id, String argumentsDelta) {
        return ModelStreamEvent.builder().kind(Kind.TOOL_CALL_DELTA).toolCallId(id).text(argumentsDelta).build();
    }

    public static ModelStreamEvent toolCallEnd(String id) {
        return ModelStreamEvent.builder().kind(Kind.TOOL_CALL_END).toolCallId(id).build();
    }

    public static ModelStreamEvent done(ModelResponse response) {
        return ModelStreamEvent.builder().kind(Kind.DONE).response(response).build();
    }
}

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

import java.util.List;

/**
 * Step of the iterate mode. One node per loop lifecycle point.
 *
 * @param <O>
 *            output type
 */
@Value
@Builder
public class AgentNode<O> {

    public enum Kind {
        USER_PROMPT, MODEL_REQUEST, MODEL_RESPONSE, TOOL_EXECUTION, TOOL_RESULTS, END
    }

    Kind kind;
    int step;
    List<Message> prompt;
    ModelRequest request;
    ModelResponse response;

    @Singular
    List<Message.ToolCall> toolCalls;

    @Singular("toolResult")
    List<ToolCallResult> results;

    AgentResult<O> result;
}

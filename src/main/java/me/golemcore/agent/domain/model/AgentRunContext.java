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
import lombok.With;
import me.golemcore.agent.port.outbound.ModelPort;

import java.util.List;

/**
 * Read-only view of a run handed to tools and output validators.
 *
 * @param <D>
 *            caller-supplied dependency type
 */
@Value
@Builder(toBuilder = true)
public class AgentRunContext<D> {

    D deps;
    ModelPort model;
    Usage usage;

    /**
     * Number of earlier attempts of this call that asked to be retried.
     */
    @With
    int retries;

    String toolCallId;
    String toolName;
    int runStep;
    String runId;
    List<Message> messages;

    public AgentRunContext<D> forToolCall(String toolCallId, String toolName, int retries) {
        return toBuilder()
                .toolCallId(toolCallId)
                .toolName(toolName)
                .retries(retries)
                .build();
    }
}

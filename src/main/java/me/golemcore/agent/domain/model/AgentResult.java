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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Terminal result of a completed run.
 *
 * @param <O>
 *            output type
 */
@Value
@Builder
public class AgentResult<O> {

    O output;
    Usage usage;

    @Singular
    List<Message> messages;

    /**
     * Name of the output-schema pseudo-tool that produced the output, or
     * {@code null} for plain-text output.
     */
    String outputToolName;

    String runId;
    int requestCount;
    int toolCallCount;
    Instant startedAt;
    Instant completedAt;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public Duration elapsed() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}

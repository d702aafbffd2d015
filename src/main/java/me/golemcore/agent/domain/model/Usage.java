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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Token usage reported by a model call, or accumulated over a run.
 *
 * <p>
 * Immutable. Accumulation via {@link #plus(Usage)} is elementwise, so it is
 * associative and commutative.
 */
@Value
@Builder
@Jacksonized
public class Usage {

    public static final Usage ZERO = Usage.builder().build();

    int inputTokens;
    int outputTokens;
    int cachedTokens;
    int reasoningTokens;

    public static Usage of(int inputTokens, int outputTokens) {
        return Usage.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .build();
    }

    @JsonIgnore
    public int getTotalTokens() {
        return inputTokens + outputTokens;
    }

    /**
     * Input tokens that were not served from the provider's prompt cache.
     */
    @JsonIgnore
    public int getEffectiveInputTokens() {
        return inputTokens - cachedTokens;
    }

    public Usage plus(Usage other) {
        if (other == null) {
            return this;
        }
        return Usage.builder()
                .inputTokens(inputTokens + other.inputTokens)
                .outputTokens(outputTokens + other.outputTokens)
                .cachedTokens(cachedTokens + other.cachedTokens)
                .reasoningTokens(reasoningTokens + other.reasoningTokens)
                .build();
    }
}

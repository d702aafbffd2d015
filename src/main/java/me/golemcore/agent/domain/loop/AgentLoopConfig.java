package me.golemcore.agent.domain.loop;


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
import me.golemcore.agent.domain.model.EndStrategy;
import me.golemcore.agent.domain.model.RetryPolicy;
import me.golemcore.agent.domain.model.UsageLimits;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration parameters for the agent run loop. Controls the iteration
 * ceiling, the output-schema pseudo-tool, retry and usage policies, tool
 * timeouts and generation parameters.
 */
@Data
@Builder(toBuilder = true)
public class AgentLoopConfig {

    @Builder.Default
    private int maxIterations = 10;

    @Builder.Default
    private EndStrategy endStrategy = EndStrategy.EARLY;

    @Builder.Default
    private String outputToolName = "final_result";

    @Builder.Default
    private String outputToolDescription = "Provide the final result";

    private String systemPrompt;

    /**
     * Per-attempt tool timeout; {@code null} waits indefinitely.
     */
    private Duration toolTimeout;

    @Builder.Default
    private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;

    @Builder.Default
    private UsageLimits usageLimits = UsageLimits.NONE;

    private Double temperature;
    private Double topP;
    private Integer maxTokens;

    @Builder.Default
    private List<String> stopSequences = new ArrayList<>();

    /**
     * Ceiling on output validation retries within one run; {@code null} leaves
     * them bounded only by {@code maxIterations}.
     */
    private Integer maxValidationRetries;

    public static AgentLoopConfig defaultConfig() {
        return AgentLoopConfig.builder().build();
    }

    /**
     * Detached copy, including the stop sequence list.
     */
    public AgentLoopConfig copy() {
        return toBuilder()
                .stopSequences(stopSequences != null ? new ArrayList<>(stopSequences) : new ArrayList<>())
                .build();
    }
}

package me.golemcore.agent.infrastructure.config;


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

import lombok.Data;
import me.golemcore.agent.domain.model.EndStrategy;
import me.golemcore.agent.domain.model.RetryableErrorKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for the agent engine, bound from
 * {@code application.properties} / {@code application.yml}.
 *
 * <p>
 * All settings live under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link LoopProperties} - iteration ceiling, output tool, generation
 * parameters</li>
 * <li>{@link RetryProperties} - model-call retry policy</li>
 * <li>{@link LimitsProperties} - per-run usage ceilings</li>
 * <li>{@link ToolsProperties} - tool execution</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private LoopProperties loop = new LoopProperties();
    private RetryProperties retry = new RetryProperties();
    private LimitsProperties limits = new LimitsProperties();
    private ToolsProperties tools = new ToolsProperties();

    @Data
    public static class LoopProperties {
        private int maxIterations = 10;
        private EndStrategy endStrategy = EndStrategy.EARLY;
        private String outputToolName = "final_result";
        private String outputToolDescription = "Provide the final result";
        private String systemPrompt;
        private Double temperature;
        private Double topP;
        private Integer maxTokens;
        private List<String> stopSequences = new ArrayList<>();

        /** Ceiling on output validation retries per run; unset means unbounded. */
        private Integer maxValidationRetries;
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofMillis(100);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private double jitter = 0.1;
        private Set<RetryableErrorKind> retryableErrors = EnumSet.allOf(RetryableErrorKind.class);
    }

    // ==================== LIMITS ====================

    @Data
    public static class LimitsProperties {
        private Integer maxInputTokens;
        private Integer maxOutputTokens;
        private Integer maxTotalTokens;
        private Integer maxRequests;
        private Integer maxToolCalls;
    }

    @Data
    public static class ToolsProperties {
        /** Per-attempt tool timeout. Unset waits indefinitely. */
        private Duration timeout;
    }
}

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.loop.AgentFactory;
import me.golemcore.agent.domain.loop.AgentLoopConfig;
import me.golemcore.agent.domain.model.RetryPolicy;
import me.golemcore.agent.domain.model.RetryableErrorKind;
import me.golemcore.agent.domain.model.UsageLimits;
import me.golemcore.agent.domain.service.PausedRunCodec;
import me.golemcore.agent.domain.system.toolloop.ModelErrorClassifier;
import me.golemcore.agent.domain.system.toolloop.UsageTrackingModelPortDecorator;
import me.golemcore.agent.port.outbound.ModelPort;
import me.golemcore.agent.port.outbound.UsageTrackingPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.EnumSet;

/**
 * Spring wiring for the agent engine: binds {@link AgentProperties} into the
 * loop configuration and policies, and exposes an {@link AgentFactory} on the
 * application's {@link ModelPort}.
 *
 * <p>
 * Every bean backs off when the application defines its own. The application's
 * {@link ObjectMapper} and {@link Clock} are used when present; otherwise the
 * engine keeps private defaults and publishes neither.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(AgentProperties.class)
@Slf4j
public class AgentEngineConfiguration {

    static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy agentRetryPolicy(AgentProperties properties) {
        AgentProperties.RetryProperties retry = properties.getRetry();
        return RetryPolicy.builder()
                .maxAttempts(retry.getMaxAttempts())
                .initialDelay(retry.getInitialDelay())
                .maxDelay(retry.getMaxDelay())
                .multiplier(retry.getMultiplier())
                .jitter(retry.getJitter())
                .retryableErrors(retry.getRetryableErrors() != null && !retry.getRetryableErrors().isEmpty()
                        ? EnumSet.copyOf(retry.getRetryableErrors())
                        : EnumSet.noneOf(RetryableErrorKind.class))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public UsageLimits agentUsageLimits(AgentProperties properties) {
        AgentProperties.LimitsProperties limits = properties.getLimits();
        return UsageLimits.builder()
                .maxInputTokens(limits.getMaxInputTokens())
                .maxOutputTokens(limits.getMaxOutputTokens())
                .maxTotalTokens(limits.getMaxTotalTokens())
                .maxRequests(limits.getMaxRequests())
                .maxToolCalls(limits.getMaxToolCalls())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentLoopConfig agentLoopConfig(AgentProperties properties, RetryPolicy agentRetryPolicy,
            UsageLimits agentUsageLimits) {
        AgentProperties.LoopProperties loop = properties.getLoop();
        return AgentLoopConfig.builder()
                .maxIterations(loop.getMaxIterations())
                .endStrategy(loop.getEndStrategy())
                .outputToolName(loop.getOutputToolName())
                .outputToolDescription(loop.getOutputToolDescription())
                .systemPrompt(loop.getSystemPrompt())
                .temperature(loop.getTemperature())
                .topP(loop.getTopP())
                .maxTokens(loop.getMaxTokens())
                .stopSequences(loop.getStopSequences())
                .maxValidationRetries(loop.getMaxValidationRetries())
                .toolTimeout(properties.getTools().getTimeout())
                .retryPolicy(agentRetryPolicy)
                .usageLimits(agentUsageLimits)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ModelErrorClassifier modelErrorClassifier() {
        return new ModelErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public PausedRunCodec pausedRunCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new PausedRunCodec(objectMapper.getIfUnique(AgentEngineConfiguration::defaultObjectMapper));
    }

    @Bean
    @ConditionalOnBean(ModelPort.class)
    @ConditionalOnMissingBean
    public AgentFactory agentFactory(ModelPort modelPort, ObjectProvider<UsageTrackingPort> usageTrackerProvider,
            AgentLoopConfig agentLoopConfig, ObjectProvider<ObjectMapper> objectMapperProvider,
            ModelErrorClassifier modelErrorClassifier, ObjectProvider<Clock> clockProvider) {
        ObjectMapper objectMapper = objectMapperProvider.getIfUnique(AgentEngineConfiguration::defaultObjectMapper);
        Clock clock = clockProvider.getIfUnique(Clock::systemDefaultZone);
        UsageTrackingPort usageTracker = usageTrackerProvider.getIfAvailable();
        ModelPort model = usageTracker != null
                ? new UsageTrackingModelPortDecorator(modelPort, usageTracker, clock)
                : modelPort;
        log.info("[AgentLoop] Agent engine ready: model={}, maxIterations={}, usageTracking={}",
                modelPort.getName(), agentLoopConfig.getMaxIterations(), usageTracker != null);
        return new AgentFactory(model, agentLoopConfig, objectMapper, modelErrorClassifier, clock);
    }
}

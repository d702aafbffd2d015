package me.golemcore.agent.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.loop.AgentFactory;
import me.golemcore.agent.domain.loop.AgentLoopConfig;
import me.golemcore.agent.domain.model.AgentResult;
import me.golemcore.agent.domain.model.EndStrategy;
import me.golemcore.agent.domain.model.OutputType;
import me.golemcore.agent.domain.model.RetryPolicy;
import me.golemcore.agent.domain.model.RetryableErrorKind;
import me.golemcore.agent.domain.service.PausedRunCodec;
import me.golemcore.agent.domain.system.toolloop.UsageTrackingModelPortDecorator;
import me.golemcore.agent.port.outbound.UsageTrackingPort;
import me.golemcore.agent.testsupport.ScriptedModelPort;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class AgentEngineConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AgentEngineConfiguration.class));

    @Test
    void shouldApplyDefaultsWithoutProperties() {
        contextRunner.run(context -> {
            AgentLoopConfig config = context.getBean(AgentLoopConfig.class);
            assertEquals(10, config.getMaxIterations());
            assertEquals(EndStrategy.EARLY, config.getEndStrategy());
            assertEquals("final_result", config.getOutputToolName());
            assertNull(config.getToolTimeout());
            assertNull(config.getMaxValidationRetries());
            assertFalse(config.getUsageLimits().hasAny());
            assertEquals(3, config.getRetryPolicy().getMaxAttempts());
            assertEquals(EnumSet.allOf(RetryableErrorKind.class), config.getRetryPolicy().getRetryableErrors());
            assertTrue(context.containsBean("pausedRunCodec"));
        });
    }

    @Test
    void shouldBindLoopRetryLimitAndToolProperties() {
        contextRunner
                .withPropertyValues(
                        "agent.loop.max-iterations=4",
                        "agent.loop.end-strategy=exhaustive",
                        "agent.loop.output-tool-name=submit_answer",
                        "agent.loop.system-prompt=Be brief.",
                        "agent.loop.stop-sequences=END,STOP",
                        "agent.loop.max-validation-retries=2",
                        "agent.retry.max-attempts=5",
                        "agent.retry.initial-delay=250ms",
                        "agent.retry.retryable-errors=rate-limited",
                        "agent.limits.max-requests=7",
                        "agent.limits.max-total-tokens=5000",
                        "agent.tools.timeout=2s")
                .run(context -> {
                    AgentLoopConfig config = context.getBean(AgentLoopConfig.class);
                    assertEquals(4, config.getMaxIterations());
                    assertEquals(EndStrategy.EXHAUSTIVE, config.getEndStrategy());
                    assertEquals("submit_answer", config.getOutputToolName());
                    assertEquals("Be brief.", config.getSystemPrompt());
                    assertEquals(List.of("END", "STOP"), config.getStopSequences());
                    assertEquals(Integer.valueOf(2), config.getMaxValidationRetries());
                    assertEquals(Duration.ofSeconds(2), config.getToolTimeout());
                    assertEquals(Integer.valueOf(7), config.getUsageLimits().getMaxRequests());
                    assertEquals(Integer.valueOf(5000), config.getUsageLimits().getMaxTotalTokens());

                    RetryPolicy policy = context.getBean(RetryPolicy.class);
                    assertEquals(5, policy.getMaxAttempts());
                    assertEquals(Duration.ofMillis(250), policy.getInitialDelay());
                    assertEquals(EnumSet.of(RetryableErrorKind.RATE_LIMITED), policy.getRetryableErrors());
                    assertSame(policy, config.getRetryPolicy());
                });
    }

    @Test
    void shouldNotCreateFactoryWithoutModel() {
        contextRunner.run(context -> assertTrue(context.getBeansOfType(AgentFactory.class).isEmpty()));
    }

    @Test
    void shouldCreateFactoryForModelBean() {
        ScriptedModelPort model = new ScriptedModelPort();

        contextRunner
                .withBean(ScriptedModelPort.class, () -> model)
                .run(context -> {
                    AgentFactory factory = context.getBean(AgentFactory.class);
                    assertSame(model, factory.getModel());
                });
    }

    @Test
    void shouldWrapModelWhenUsageTrackerIsPresent() {
        contextRunner
                .withBean(ScriptedModelPort.class, ScriptedModelPort::new)
                .withBean(UsageTrackingPort.class, () -> mock(UsageTrackingPort.class))
                .run(context -> {
                    AgentFactory factory = context.getBean(AgentFactory.class);
                    assertInstanceOf(UsageTrackingModelPortDecorator.class, factory.getModel());
                    assertEquals("scripted", factory.getModel().getName());
                });
    }

    @Test
    void shouldBackOffWhenApplicationProvidesObjectMapper() {
        ObjectMapper custom = new ObjectMapper();

        contextRunner
                .withBean(ObjectMapper.class, () -> custom)
                .run(context -> {
                    assertSame(custom, context.getBean(ObjectMapper.class));
                    assertNotNull(context.getBean(PausedRunCodec.class));
                });
    }

    @Test
    void shouldNotPublishObjectMapperOrClockOfItsOwn() {
        contextRunner
                .withBean(ScriptedModelPort.class, ScriptedModelPort::new)
                .run(context -> {
                    assertTrue(context.getBeansOfType(ObjectMapper.class).isEmpty());
                    assertTrue(context.getBeansOfType(Clock.class).isEmpty());
                    assertNotNull(context.getBean(PausedRunCodec.class));
                    assertNotNull(context.getBean(AgentFactory.class));
                });
    }

    @Test
    void shouldUseApplicationClockForAgents() {
        ScriptedModelPort model = new ScriptedModelPort();
        model.respond(ScriptedModelPort.text("done"));
        Clock fixed = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneId.of("UTC"));

        contextRunner
                .withBean(ScriptedModelPort.class, () -> model)
                .withBean(Clock.class, () -> fixed)
                .run(context -> {
                    AgentResult<String> result = context.getBean(AgentFactory.class)
                            .<String, String>builder(OutputType.text())
                            .build()
                            .run("Hi", "deps");
                    assertEquals(Instant.parse("2026-03-01T12:00:00Z"), result.getStartedAt());
                });
    }
}

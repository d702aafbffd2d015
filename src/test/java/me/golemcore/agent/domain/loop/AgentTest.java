package me.golemcore.agent.domain.loop;

import dev.langchain4j.exception.RateLimitException;
import me.golemcore.agent.domain.exception.OutputValidationFailedException;
import me.golemcore.agent.domain.exception.ToolTimeoutException;
import me.golemcore.agent.domain.exception.UsageLimitExceededException;
import me.golemcore.agent.domain.exception.ValidationRetryException;
import me.golemcore.agent.domain.model.AgentResult;
import me.golemcore.agent.domain.model.EndStrategy;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ModelRequest;
import me.golemcore.agent.domain.model.ModelResponse;
import me.golemcore.agent.domain.model.OutputType;
import me.golemcore.agent.domain.model.RetryPolicy;
import me.golemcore.agent.domain.model.StopReason;
import me.golemcore.agent.domain.model.ToolOutcome;
import me.golemcore.agent.domain.model.Usage;
import me.golemcore.agent.domain.model.UsageLimitKind;
import me.golemcore.agent.domain.model.UsageLimits;
import me.golemcore.agent.port.outbound.ModelPort;
import me.golemcore.agent.testsupport.ScriptedModelPort;
import me.golemcore.agent.testsupport.StubTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentTest {

    private static final String OUTPUT_TOOL = "final_result";
    private static final String DEPS = "tenant-42";
    private static final String PARIS = "{\"city\":\"Paris\",\"population\":2100000}";

    public record Answer(String city, int population) {
    }

    private static final OutputType<Answer> ANSWER = OutputType.of(Answer.class,
            Map.of("type", "object", "required", List.of("city", "population")));

    private static final RetryPolicy FAST_RETRY = RetryPolicy.DEFAULT.toBuilder()
            .initialDelay(Duration.ofMillis(1))
            .maxDelay(Duration.ofMillis(5))
            .jitter(0.0)
            .build();

    private ScriptedModelPort model;
    private ExecutorService executor;
    private Clock clock;

    @BeforeEach
    void setUp() {
        model = new ScriptedModelPort();
        executor = Executors.newCachedThreadPool();
        clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Agent.AgentBuilder<String, Answer> answerAgent(AgentLoopConfig config) {
        return Agent.<String, Answer>builder()
                .model(model)
                .outputType(ANSWER)
                .config(config)
                .executor(executor)
                .clock(clock);
    }

    private Agent.AgentBuilder<String, String> textAgent(AgentLoopConfig config) {
        return Agent.<String, String>builder()
                .model(model)
                .outputType(OutputType.text())
                .config(config)
                .executor(executor)
                .clock(clock);
    }

    private static Message lastMessage(AgentResult<?> result) {
        return result.getMessages().get(result.getMessages().size() - 1);
    }

    // ==================== Tools ====================

    @Test
    void shouldPassDepsAndArgumentsToTools() {
        StubTool<String> lookup = new StubTool<>("lookup", 1,
                (ctx, args) -> ToolOutcome.success("population of " + ctx.getDeps()));
        model.respond(ScriptedModelPort.toolCalls(ScriptedModelPort.call("c1", "lookup", "{\"q\":\"paris\"}")))
                .respond(ScriptedModelPort.toolCalls(ScriptedModelPort.call("c2", OUTPUT_TOOL, PARIS)));

        AgentResult<Answer> result = answerAgent(AgentLoopConfig.defaultConfig()).tool(lookup).build()
                .run("How many people live in Paris?", DEPS);

        assertEquals("Paris", result.getOutput().city());
        assertEquals(List.of("{\"q\":\"paris\"}"), lookup.getArguments());
        assertEquals(DEPS, lookup.getContexts().get(0).getDeps());
        assertEquals(1, result.getToolCallCount());
        assertEquals(2, result.getRequestCount());
        Message toolResults = result.getMessages().get(2);
        assertEquals("population of " + DEPS, toolResults.getToolResults().get(0).getContent());
    }

    @Test
    void shouldFeedToolFailureBackToModel() {
        StubTool<String> broken = new StubTool<>("broken", 0, (ctx, args) -> ToolOutcome.failure("disk full"));
        model.respond(ScriptedModelPort.toolCalls(ScriptedModelPort.call("c1", "broken", "{}")))
                .respond(ScriptedModelPort.text("Could not finish: disk full"));

        AgentResult<String> result = textAgent(AgentLoopConfig.defaultConfig()).tool(broken).build()
                .run("Save the report", DEPS);

        Message.ToolResultEntry entry = result.getMessages().get(2).getToolResults().get(0);
        assertTrue(entry.isError());
        assertEquals("Error: disk full", entry.getContent());
        assertEquals("Could not finish: disk full", result.getOutput());
    }

    @Test
    void shouldFeedUnknownToolBackToModel() {
        model.respond(ScriptedModelPort.toolCalls(ScriptedModelPort.call("c1", "teleport", "{}")))
                .respond(ScriptedModelPort.text("Sorry"));

        AgentResult<String> result = textAgent(AgentLoopConfig.defaultConfig()).build().run("Go", DEPS);

        assertTrue(result.getMessages().get(2).getToolResults().get(0).isError());
        assertEquals(1, result.getToolCallCount());
    }

    @Test
    void shouldInvokeToolWithDottedName() {
        StubTool<String> read = StubTool.returning("fs.read", "hello");
        model.respond(ScriptedModelPort.toolCalls(ScriptedModelPort.call("c1", "fs.read", "{\"path\":\"a.txt\"}")))
                .respond(ScriptedModelPort.text("It says hello"));

        AgentResult<String> result = textAgent(AgentLoopConfig.defaultConfig()).tool(read).build()
                .run("Read a.txt", DEPS);

        assertEquals(1, read.getInvocations());
        assertEquals("hello", result.getMessages().get(2).getToolResults().get(0).getContent());
    }

    @Test
    void shouldFailRunWhenToolTimesOut() {
        StubTool<String> slow = new StubTool<>("slow", 1, (ctx, args) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ToolOutcome.success("late");
        });
        model.respond(ScriptedModelPort.toolCalls(ScriptedModelPort.call("c1", "slow", "{}")));
        Agent<String, String> agent = textAgent(AgentLoopConfig.builder().toolTimeout(Duration.ofMillis(100))
                .build()).tool(slow).build();

        long start = System.nanoTime();
        assertThrows(ToolTimeoutException.class, () -> agent.run("Wait", DEPS));

        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(2)) < 0);
    }

    // ==================== End strategy ====================

    @Test
    void shouldSkipToolsAfterOutputWithEarlyStrategy() {
        StubTool<String> audit = StubTool.returning("audit", "logged");
        model.respond(ScriptedModelPort.toolCalls(
                ScriptedModelPort.call("c1", OUTPUT_TOOL, PARIS),
                ScriptedModelPort.call("c2", "audit", "{}")));

        AgentResult<Answer> result = answerAgent(AgentLoopConfig.defaultConfig()).tool(audit).build()
                .run("Answer", DEPS);

        assertEquals(0, audit.getInvocations());
        assertEquals(0, result.getToolCallCount());
        List<Message.ToolResultEntry> entries = lastMessage(result).getToolResults();
        assertEquals(2, entries.size());
        assertEquals("Tool not executed - a final result was already processed.", entries.get(1).getContent());
    }

    @Test
    void shouldRunRemainingToolsWithExhaustiveStrategy() {
        StubTool<String> audit = StubTool.returning("audit", "logged");
        model.respond(ScriptedModelPort.toolCalls(
                ScriptedModelPort.call("c1", OUTPUT_TOOL, PARIS),
                ScriptedModelPort.call("c2", "audit", "{}")));

        AgentResult<Answer> result = answerAgent(AgentLoopConfig.builder().endStrategy(EndStrategy.EXHAUSTIVE)
                .build()).tool(audit).build().run("Answer", DEPS);

        assertEquals(1, audit.getInvocations());
        assertEquals(1, result.getToolCallCount());
        assertEquals(new Answer("Paris", 2_100_000), result.getOutput());
        assertEquals("logged", lastMessage(result).getToolResults().get(1).getContent());
    }

    @Test
    void shouldKeepFirstOutputWhenModelSendsTwo() {
        model.respond(ScriptedModelPort.toolCalls(
                ScriptedModelPort.call("c1", OUTPUT_TOOL, PARIS),
                ScriptedModelPort.call("c2", OUTPUT_TOOL, "{\"city\":\"Lyon\",\"population\":1}")));

        AgentResult<Answer> result = answerAgent(AgentLoopConfig.defaultConfig()).build().run("Answer", DEPS);

        assertEquals("Paris", result.getOutput().city());
        assertEquals(2, lastMessage(result).getToolResults().size());
    }

    // ==================== Validation ====================

    @Test
    void shouldAcceptOutputCallWithLeakedChannelMarker() {
        model.respond(ScriptedModelPort.toolCalls(
                ScriptedModelPort.call("c1", OUTPUT_TOOL + "<|channel|>commentary", PARIS)));

        AgentResult<Answer> result = answerAgent(AgentLoopConfig.defaultConfig()).build()
                .run("Largest French city?", DEPS);

        assertEquals("Paris", result.getOutput().city());
        assertEquals(1, result.getRequestCount());
        assertEquals(0, result.getToolCallCount());
    }

    @Test
    void shouldRetryWhenValidatorRejectsOutput() {
        model.respond(ScriptedModelPort.toolCalls(
                ScriptedModelPort.call("c1", OUTPUT_TOOL, "{\"city\":\"Paris\",\"population\":-1}")))
                .respond(ScriptedModelPort.toolCalls(ScriptedModelPort.call("c2", OUTPUT_TOOL, PARIS)));

        AgentResult<Answer> result = answerAgent(AgentLoopConfig.defaultConfig())
                .validator((ctx, answer) -> {
                    if (answer.population() < 0) {
                        throw new ValidationRetryException("population must not be negative");
                    }
                    return answer;
                })
                .build()
                .run("Answer", DEPS);

        assertEquals(2_100_000, result.getOutput().population());
        assertEquals(2, result.getRequestCount());
        Message.ToolResultEntry feedback = result.getMessages().get(2).getToolResults().get(0);
        assertTrue(feedback.isError());
        assertEquals("population must not be negative", feedback.getContent());
    }

    @Test
    void shouldRetryWhenOutputArgumentsDoNotDecode() {
        model.respond(ScriptedModelPort.toolCalls(ScriptedModelPort.call("c1", OUTPUT_TOOL, "{\"city\":")))
                .respond(ScriptedModelPort.toolCalls(ScriptedModelPort.call("c2", OUTPUT_TOOL, PARIS)));

        AgentResult<Answer> result = answerAgent(AgentLoopConfig.defaultConfig()).build().run("Answer", DEPS);

        assertEquals("Paris", result.getOutput().city());
        assertTrue(result.getMessages().get(2).getToolResults().get(0).getContent()
                .startsWith("Invalid final result"));
    }

    @Test
    void shouldRetryTextOutputWithFeedbackPrompt() {
        model.respond(ScriptedModelPort.text("paris"))
                .respond(ScriptedModelPort.text("Paris"));

        AgentResult<String> result = textAgent(AgentLoopConfig.defaultConfig())
                .validator((ctx, text) -> {
                    if (!Character.isUpperCase(text.charAt(0))) {
                        throw new ValidationRetryException("Capitalize the answer");
                    }
                    return text;
                })
                .build()
                .run("Capital of France?", DEPS);

        assertEquals("Paris", result.getOutput());
        Message feedback = result.getMessages().get(2);
        assertEquals(Message.Role.USER, feedback.getRole());
        assertTrue(feedback.text().contains("Capitalize the answer"));
    }

    @Test
    void shouldFailWhenValidationRetriesRunOut() {
        model.respond(ScriptedModelPort.text("paris"))
                .respond(ScriptedModelPort.text("paris"))
                .respond(ScriptedModelPort.text("Paris"));
        Agent<String, String> agent = textAgent(AgentLoopConfig.builder().maxValidationRetries(1).build())
                .validator((ctx, text) -> {
                    if (!Character.isUpperCase(text.charAt(0))) {
                        throw new ValidationRetryException("Capitalize the answer");
                    }
                    return text;
                })
                .build();

        OutputValidationFailedException error = assertThrows(OutputValidationFailedException.class,
                () -> agent.run("Capital of France?", DEPS));

        assertEquals(2, error.getAttempts());
        assertEquals(1, model.remaining());
    }

    // ==================== Limits and retries ====================

    @Test
    void shouldStopAtRequestLimit() {
        StubTool<String> lookup = StubTool.returning("lookup", "x");
        for (int i = 0; i < 5; i++) {
            model.respond(ScriptedModelPort.toolCalls(ScriptedModelPort.call("c" + i, "lookup", "{}")));
        }
        Agent<String, String> agent = textAgent(AgentLoopConfig.builder()
                .usageLimits(UsageLimits.builder().maxRequests(3).build())
                .build()).tool(lookup).build();

        UsageLimitExceededException error = assertThrows(UsageLimitExceededException.class,
                () -> agent.run("Loop", DEPS));

        assertEquals(UsageLimitKind.REQUESTS, error.getKind());
        assertEquals(3, model.getRequests().size());
    }

    @Test
    void shouldIgnoreConfigChangesMadeAfterBuild() {
        AgentLoopConfig config = AgentLoopConfig.defaultConfig();
        Agent<String, Answer> agent = answerAgent(config).build();
        config.setOutputToolName("answer");
        config.setUsageLimits(UsageLimits.builder().maxRequests(0).build());
        config.getStopSequences().add("END");
        model.respond(ScriptedModelPort.toolCalls(ScriptedModelPort.call("c1", OUTPUT_TOOL, PARIS)));

        AgentResult<Answer> result = agent.run("Largest French city?", DEPS);

        assertEquals("Paris", result.getOutput().city());
        ModelRequest sent = model.getRequests().get(0);
        assertEquals(OUTPUT_TOOL, sent.getTools().get(0).getName());
        assertTrue(sent.getStopSequences().isEmpty());
    }

    @Test
    void shouldStopAtToolCallLimit() {
        StubTool<String> lookup = StubTool.returning("lookup", "x");
        model.respond(ScriptedModelPort.toolCalls(
                ScriptedModelPort.call("c1", "lookup", "{}"),
                ScriptedModelPort.call("c2", "lookup", "{}")));
        Agent<String, String> agent = textAgent(AgentLoopConfig.builder()
                .usageLimits(UsageLimits.builder().maxToolCalls(1).build())
                .build()).tool(lookup).build();

        UsageLimitExceededException error = assertThrows(UsageLimitExceededException.class,
                () -> agent.run("Loop", DEPS));

        assertEquals(UsageLimitKind.TOOL_CALLS, error.getKind());
        assertEquals(1, lookup.getInvocations());
    }

    @Test
    void shouldRetryTransientModelFailureWithinRun() {
        model.fail(new RateLimitException("too many requests"))
                .respond(ScriptedModelPort.text("Paris"));

        AgentResult<String> result = textAgent(AgentLoopConfig.builder().retryPolicy(FAST_RETRY).build()).build()
                .run("Capital of France?", DEPS);

        assertEquals("Paris", result.getOutput());
        assertEquals(1, result.getRequestCount());
        assertEquals(2, model.getRequests().size());
    }

    // ==================== History ====================

    @Test
    void shouldContinueFromPriorHistory() {
        model.respond(ScriptedModelPort.text("Still Paris"));
        List<Message> history = List.of(Message.user("Capital of France?"),
                Message.assistant("Paris", List.of()));

        AgentResult<String> result = textAgent(AgentLoopConfig.defaultConfig()).build()
                .run("Are you sure?", DEPS, history);

        ModelRequest request = model.getRequests().get(0);
        assertEquals(3, request.getMessages().size());
        assertEquals("Are you sure?", request.getMessages().get(2).text());
        assertEquals(4, result.getMessages().size());
    }

    // ==================== Concurrency ====================

    @Test
    void shouldRunConcurrentRunsWithIsolatedState() throws Exception {
        ModelPort echo = new ModelPort() {
            @Override
            public String getName() {
                return "echo";
            }

            @Override
            public CompletableFuture<ModelResponse> complete(ModelRequest request) {
                List<Message> messages = request.getMessages();
                Message last = messages.get(messages.size() - 1);
                if (last.getRole() == Message.Role.USER) {
                    return CompletableFuture.completedFuture(ModelResponse.builder()
                            .toolCall(Message.ToolCall.of("c-" + last.text(), "lookup", last.text()))
                            .stopReason(StopReason.TOOL_USE)
                            .usage(Usage.of(1, 1))
                            .build());
                }
                return CompletableFuture.completedFuture(ModelResponse.builder()
                        .content("echo:" + last.getToolResults().get(0).getContent())
                        .stopReason(StopReason.END_TURN)
                        .usage(Usage.of(1, 1))
                        .build());
            }
        };
        StubTool<String> lookup = new StubTool<>("lookup", 0, (ctx, args) -> ToolOutcome.success(args));
        Agent<String, String> agent = Agent.<String, String>builder()
                .model(echo)
                .outputType(OutputType.text())
                .tool(lookup)
                .executor(executor)
                .clock(clock)
                .build();

        int runs = 8;
        ExecutorService callers = Executors.newFixedThreadPool(runs);
        try {
            List<Future<AgentResult<String>>> futures = new ArrayList<>();
            for (int i = 0; i < runs; i++) {
                String prompt = "prompt-" + i;
                futures.add(callers.submit(() -> agent.run(prompt, DEPS)));
            }
            Set<String> runIds = new HashSet<>();
            for (int i = 0; i < runs; i++) {
                AgentResult<String> result = futures.get(i).get(10, TimeUnit.SECONDS);
                assertEquals("echo:prompt-" + i, result.getOutput());
                assertEquals(2, result.getRequestCount());
                assertEquals(1, result.getToolCallCount());
                assertEquals(Usage.of(2, 2), result.getUsage());
                runIds.add(result.getRunId());
            }
            assertEquals(runs, runIds.size());
            assertEquals(runs, lookup.getInvocations());
        } finally {
            callers.shutdownNow();
        }
    }
}

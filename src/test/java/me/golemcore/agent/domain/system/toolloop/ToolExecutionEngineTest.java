package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.ToolNotFoundException;
import me.golemcore.agent.domain.exception.ToolRetriesExhaustedException;
import me.golemcore.agent.domain.exception.ToolTimeoutException;
import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.DeferredToolCall;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolCallResult;
import me.golemcore.agent.domain.model.ToolOutcome;
import me.golemcore.agent.domain.service.ToolCatalog;
import me.golemcore.agent.testsupport.ScriptedModelPort;
import me.golemcore.agent.testsupport.StubTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolExecutionEngineTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    private ExecutorService executor;
    private AgentRunContext<String> context;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        context = RunState.start("deps", NOW).toContext(new ScriptedModelPort());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @SafeVarargs
    private ToolExecutionEngine<String> engine(Duration timeout, StubTool<String>... tools) {
        return new ToolExecutionEngine<>(new ToolCatalog<>(List.of(tools), "final_result"), timeout, executor);
    }

    // ==================== Retry ====================

    @Test
    void shouldRetryUntilToolSucceeds() {
        StubTool<String> flaky = new StubTool<>("flaky", 3, (ctx, args) -> ctx.getRetries() < 2
                ? ToolOutcome.retry("attempt " + ctx.getRetries() + " failed")
                : ToolOutcome.success("ok"));

        ToolOutcome outcome = engine(null, flaky).execute(ScriptedModelPort.call("c1", "flaky", "{}"), context);

        assertTrue(outcome.isSuccess());
        assertEquals(3, flaky.getInvocations());
        assertEquals(List.of(0, 1, 2), flaky.getContexts().stream().map(AgentRunContext::getRetries).toList());
        assertEquals("c1", flaky.getContexts().get(0).getToolCallId());
    }

    @Test
    void shouldInvokeMaxRetriesPlusOneTimesBeforeFailing() {
        StubTool<String> stubborn = new StubTool<>("stubborn", 2, (ctx, args) -> ToolOutcome.retry("nope"));

        ToolOutcome outcome = engine(null, stubborn).execute(ScriptedModelPort.call("c1", "stubborn", "{}"),
                context);

        assertTrue(outcome.isFailure());
        assertEquals(3, stubborn.getInvocations());
        ToolRetriesExhaustedException error = assertInstanceOf(ToolRetriesExhaustedException.class,
                outcome.getError());
        assertEquals(3, error.getAttempts());
    }

    @Test
    void shouldNotRetryWithZeroBudget() {
        StubTool<String> once = new StubTool<>("once", 0, (ctx, args) -> ToolOutcome.retry("nope"));

        ToolOutcome outcome = engine(null, once).execute(ScriptedModelPort.call("c1", "once", "{}"), context);

        assertTrue(outcome.isFailure());
        assertEquals(1, once.getInvocations());
    }

    // ==================== Failures ====================

    @Test
    void shouldReturnFailureForUnknownTool() {
        ToolOutcome outcome = engine(null).execute(ScriptedModelPort.call("c1", "missing", "{}"), context);

        assertTrue(outcome.isFailure());
        assertInstanceOf(ToolNotFoundException.class, outcome.getError());
    }

    @Test
    void shouldTurnToolExceptionIntoFailure() {
        StubTool<String> broken = new StubTool<>("broken", 1, (ctx, args) -> {
            throw new IllegalStateException("disk full");
        });

        ToolOutcome outcome = engine(null, broken).execute(ScriptedModelPort.call("c1", "broken", "{}"), context);

        assertTrue(outcome.isFailure());
        assertEquals("Error: disk full", outcome.toMessageContent());
        assertEquals(1, broken.getInvocations());
    }

    @Test
    void shouldTurnNullOutcomeIntoFailure() {
        StubTool<String> silent = new StubTool<>("silent", 1, (ctx, args) -> null);

        ToolOutcome outcome = engine(null, silent).execute(ScriptedModelPort.call("c1", "silent", "{}"), context);

        assertTrue(outcome.isFailure());
    }

    // ==================== Timeout ====================

    @Test
    void shouldTimeOutSlowToolWithoutWaitingForIt() {
        StubTool<String> slow = new StubTool<>("slow", 1, (ctx, args) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ToolOutcome.success("late");
        });
        ToolExecutionEngine<String> engine = engine(Duration.ofMillis(100), slow);

        long start = System.nanoTime();
        ToolTimeoutException error = assertThrows(ToolTimeoutException.class,
                () -> engine.execute(ScriptedModelPort.call("c1", "slow", "{}"), context));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertEquals("slow", error.getToolName());
        assertTrue(elapsed.compareTo(Duration.ofSeconds(2)) < 0, "took " + elapsed);
    }

    @Test
    void shouldRequireExecutorWhenTimeoutIsSet() {
        assertThrows(IllegalArgumentException.class,
                () -> new ToolExecutionEngine<>(ToolCatalog.<String>empty(), Duration.ofSeconds(1), null));
    }

    // ==================== Batches ====================

    @Test
    void shouldStopBatchAfterDeferredCall() {
        StubTool<String> first = StubTool.returning("first", "1");
        StubTool<String> gated = new StubTool<>("gated", 1,
                (ctx, args) -> ToolOutcome.deferred(DeferredToolCall.needsApproval("d-1", "needs a human")));
        StubTool<String> last = StubTool.returning("last", "3");
        List<String> seen = new ArrayList<>();

        ToolExecutionEngine.BatchResult batch = engine(null, first, gated, last).executeAll(List.of(
                ScriptedModelPort.call("c1", "first", "{}"),
                ScriptedModelPort.call("c2", "gated", "{}"),
                ScriptedModelPort.call("c3", "last", "{}")), context, new ToolExecutionEngine.BatchListener() {
                    @Override
                    public void beforeCall(Message.ToolCall call) {
                        seen.add(call.getId());
                    }
                });

        assertEquals(2, batch.results().size());
        assertEquals(List.of("c3"), batch.unattempted().stream().map(Message.ToolCall::getId).toList());
        ToolCallResult deferred = batch.deferred().orElseThrow();
        assertEquals("d-1", deferred.outcome().getDeferral().getId());
        assertEquals(0, last.getInvocations());
        assertEquals(List.of("c1", "c2"), seen);
    }

    @Test
    void shouldExecuteApprovedCallExactlyOnce() {
        StubTool<String> retrying = new StubTool<>("retrying", 5, (ctx, args) -> ToolOutcome.retry("again"));

        ToolOutcome outcome = engine(null, retrying).executeOnce(ScriptedModelPort.call("c1", "retrying", "{}"),
                context);

        assertTrue(outcome.needsRetry());
        assertEquals(1, retrying.getInvocations());
    }
}

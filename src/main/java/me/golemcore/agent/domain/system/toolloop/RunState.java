package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.PausedAgentRun;
import me.golemcore.agent.domain.model.PendingToolCall;
import me.golemcore.agent.domain.model.Usage;
import me.golemcore.agent.port.outbound.ModelPort;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Mutable state of one run. Owned by the thread driving the run and never
 * shared between runs, so it is not synchronized.
 *
 * @param <D>
 *            dependency type
 */
public final class RunState<D> {

    private final String runId;
    private final D deps;
    private final Instant startedAt;
    private final List<Message> messages;
    private Usage usage;
    private int requestCount;
    private int toolCallCount;
    private int validationRetries;

    private RunState(String runId, D deps, Instant startedAt, List<Message> messages, Usage usage,
            int requestCount, int toolCallCount) {
        this.runId = runId;
        this.deps = deps;
        this.startedAt = startedAt;
        this.messages = new ArrayList<>(messages);
        this.usage = usage != null ? usage : Usage.ZERO;
        this.requestCount = requestCount;
        this.toolCallCount = toolCallCount;
    }

    public static <D> RunState<D> start(D deps, Instant startedAt) {
        return new RunState<>(UUID.randomUUID().toString(), deps, startedAt, List.of(), Usage.ZERO, 0, 0);
    }

    /**
     * Rebuilds the state of a paused run. The run keeps its id and counters.
     */
    public static <D> RunState<D> resume(PausedAgentRun pausedRun, D deps, Instant resumedAt) {
        return new RunState<>(pausedRun.getRunId(), deps, resumedAt, pausedRun.getMessages(),
                pausedRun.getUsage(), pausedRun.getRequestCount(), pausedRun.getToolCallCount());
    }

    public String getRunId() {
        return runId;
    }

    public D getDeps() {
        return deps;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /**
     * Read-only view of the transcript.
     */
    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public Usage getUsage() {
        return usage;
    }

    public int getRequestCount() {
        return requestCount;
    }

    public int getToolCallCount() {
        return toolCallCount;
    }

    int getValidationRetries() {
        return validationRetries;
    }

    void append(Message message) {
        messages.add(message);
    }

    void recordModelCall(Usage callUsage) {
        requestCount++;
        usage = usage.plus(callUsage);
    }

    void recordToolCall() {
        toolCallCount++;
    }

    int recordValidationRetry() {
        return ++validationRetries;
    }

    /**
     * Context handed to tools and validators. The transcript is copied so that
     * it stays stable while the run continues.
     */
    public AgentRunContext<D> toContext(ModelPort model) {
        return AgentRunContext.<D>builder()
                .deps(deps)
                .model(model)
                .usage(usage)
                .runStep(requestCount)
                .runId(runId)
                .messages(List.copyOf(messages))
                .build();
    }

    PausedAgentRun snapshot(List<PendingToolCall> pending, List<Message.ToolCall> unattempted, Instant now) {
        return PausedAgentRun.builder()
                .runId(runId)
                .messages(List.copyOf(messages))
                .usage(usage)
                .requestCount(requestCount)
                .toolCallCount(toolCallCount)
                .pendingCalls(pending)
                .unattemptedCalls(unattempted)
                .createdAt(now)
                .build();
    }
}

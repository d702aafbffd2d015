package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.HasDeferredToolsException;
import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.PausedAgentRun;
import me.golemcore.agent.domain.model.PendingToolCall;
import me.golemcore.agent.domain.model.ResolvedTool;
import me.golemcore.agent.domain.model.ToolOutcome;
import me.golemcore.agent.port.outbound.ModelPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies caller resolutions to the pending calls of a paused run and records
 * their results, so the run loop can continue.
 *
 * <p>
 * Approved calls run exactly once, without the retry wrapper. Calls queued
 * behind the deferred call in the same batch are answered with an error entry. Resuming the
 * same snapshot twice executes approved tools twice; keeping resume calls
 * unique is up to the caller.
 *
 * @param <D>
 *            dependency type
 */
public class ResumeManager<D> {

    private static final Logger log = LoggerFactory.getLogger(ResumeManager.class);

    static final String NO_RESOLUTION = "No resolution provided";
    static final String NOT_EXECUTED = "Tool not executed - an earlier call in the same batch was deferred. "
            + "Call it again if it is still needed.";

    private final ModelPort model;
    private final ToolExecutionEngine<D> engine;
    private final UsageLimiter limiter;
    private final HistoryWriter historyWriter;
    private final Clock clock;

    public ResumeManager(ModelPort model, ToolExecutionEngine<D> engine, UsageLimiter limiter,
            HistoryWriter historyWriter, Clock clock) {
        this.model = model;
        this.engine = engine;
        this.limiter = limiter;
        this.historyWriter = historyWriter;
        this.clock = clock;
    }

    /**
     * Resolves every pending call of {@code pausedRun} and appends the results,
     * together with a "not executed" entry for each call of the batch that came
     * after the deferring call, as one tool-results message. Those later calls
     * are never invoked; the model decides whether to issue them again.
     *
     * @throws HasDeferredToolsException
     *             if an approved call defers again; the new snapshot keeps
     *             every result resolved so far and carries the skipped calls
     *             forward
     */
    public void resolve(RunState<D> state, PausedAgentRun pausedRun, List<ResolvedTool> resolutions) {
        Map<String, ResolvedTool.Resolution> byId = new LinkedHashMap<>();
        for (ResolvedTool resolved : resolutions) {
            byId.put(resolved.getDeferralId(), resolved.getResolution());
        }

        AgentRunContext<D> context = state.toContext(model);
        List<Message.ToolResultEntry> entries = new ArrayList<>();
        List<PendingToolCall> stillPending = new ArrayList<>();

        for (PendingToolCall pending : pausedRun.getPendingCalls()) {
            Message.ToolCall call = pending.toolCall();
            ResolvedTool.Resolution resolution = byId.remove(pending.deferral().getId());
            if (resolution == null) {
                log.info("[Resume] No resolution for {} ({}), treating as denied", call.getName(),
                        pending.deferral().getId());
                entries.add(Message.ToolResultEntry.error(call, "Tool call denied: " + NO_RESOLUTION));
                continue;
            }
            switch (resolution.getKind()) {
            case APPROVED -> {
                limiter.checkBeforeToolCall(state);
                ToolOutcome outcome = engine.executeOnce(call, context);
                if (outcome.isDeferred()) {
                    stillPending.add(new PendingToolCall(call, outcome.getDeferral()));
                } else {
                    state.recordToolCall();
                    entries.add(outcome.needsRetry()
                            ? Message.ToolResultEntry.error(call, outcome.getFeedback())
                            : ResponseHandler.toEntry(call, outcome));
                }
            }
            case DENIED -> entries.add(Message.ToolResultEntry.error(call, "Tool call denied: "
                    + (resolution.getText() != null ? resolution.getText() : "denied by user")));
            case COMPLETED -> entries.add(Message.ToolResultEntry.success(call,
                    resolution.getText() != null ? resolution.getText() : ""));
            case FAILED -> entries.add(Message.ToolResultEntry.error(call, "Error: "
                    + (resolution.getText() != null ? resolution.getText() : "tool failed")));
            }
        }
        if (!byId.isEmpty()) {
            log.warn("[Resume] Ignoring resolutions for unknown deferral ids: {}", byId.keySet());
        }

        if (!stillPending.isEmpty()) {
            pause(state, entries, stillPending, pausedRun.getUnattemptedCalls());
        }

        for (Message.ToolCall call : pausedRun.getUnattemptedCalls()) {
            entries.add(Message.ToolResultEntry.error(call, NOT_EXECUTED));
        }
        if (!pausedRun.getUnattemptedCalls().isEmpty()) {
            log.debug("[Resume] Skipped {} call(s) queued behind the deferred call",
                    pausedRun.getUnattemptedCalls().size());
        }

        historyWriter.appendToolResults(state, entries);
        log.info("[Resume] Run {} resumed with {} resolved result(s)", state.getRunId(), entries.size());
    }

    private void pause(RunState<D> state, List<Message.ToolResultEntry> entries, List<PendingToolCall> pending,
            List<Message.ToolCall> unattempted) {
        historyWriter.appendToolResults(state, entries);
        PausedAgentRun paused = state.snapshot(pending, unattempted, clock.instant());
        log.info("[Resume] Run {} paused again on {} call(s)", state.getRunId(), pending.size());
        throw new HasDeferredToolsException(paused);
    }
}

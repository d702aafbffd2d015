package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentResult;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ModelRequest;
import me.golemcore.agent.domain.model.ModelResponse;
import me.golemcore.agent.domain.model.ToolCallResult;

import java.util.List;

/**
 * Lifecycle hooks of the run loop. Each execution mode supplies an observer
 * that projects these hooks into its own event shape; the loop itself does not
 * know which mode is driving it.
 *
 * <p>
 * Hooks are called on the thread driving the run.
 *
 * @param <O>
 *            output type
 */
public interface LoopObserver<O> {

    default void onLoopStart(RunState<?> state) {
    }

    default void onBeforeModelCall(RunState<?> state, ModelRequest request) {
    }

    /**
     * Called after usage of the response has been added to the state.
     */
    default void onModelResponse(RunState<?> state, ModelResponse response) {
    }

    default void onBeforeToolProcessing(RunState<?> state, List<Message.ToolCall> calls) {
    }

    default void onToolComplete(RunState<?> state, ToolCallResult result) {
    }

    /**
     * Called once per batch, also when the batch stopped on a deferral.
     */
    default void onAfterToolProcessing(RunState<?> state, List<ToolCallResult> results) {
    }

    default void onEnd(AgentResult<O> result) {
    }
}

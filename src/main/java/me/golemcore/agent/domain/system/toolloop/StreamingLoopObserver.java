package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentResult;
import me.golemcore.agent.domain.model.AgentStreamEvent;
import me.golemcore.agent.domain.model.ModelResponse;
import me.golemcore.agent.domain.model.ToolCallResult;
import reactor.core.publisher.FluxSink;

/**
 * Loop side of the stream mode: usage updates, tool results and the final
 * result. Model deltas come from {@link StreamingModelAdapter}.
 */
public class StreamingLoopObserver<O> implements LoopObserver<O> {

    private final FluxSink<AgentStreamEvent<O>> sink;

    public StreamingLoopObserver(FluxSink<AgentStreamEvent<O>> sink) {
        this.sink = sink;
    }

    @Override
    public void onModelResponse(RunState<?> state, ModelResponse response) {
        emit(AgentStreamEvent.usage(state.getUsage()));
    }

    @Override
    public void onToolComplete(RunState<?> state, ToolCallResult result) {
        emit(AgentStreamEvent.toolResult(result));
    }

    @Override
    public void onEnd(AgentResult<O> result) {
        emit(AgentStreamEvent.result(result));
    }

    private void emit(AgentStreamEvent<O> event) {
        if (!sink.isCancelled()) {
            sink.next(event);
        }
    }
}

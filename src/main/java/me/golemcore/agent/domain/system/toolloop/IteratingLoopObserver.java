package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentNode;
import me.golemcore.agent.domain.model.AgentResult;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ModelRequest;
import me.golemcore.agent.domain.model.ModelResponse;
import me.golemcore.agent.domain.model.ToolCallResult;
import reactor.core.publisher.FluxSink;

import java.util.List;

/**
 * Projects loop hooks into {@link AgentNode}s for the iterate mode.
 */
public class IteratingLoopObserver<O> implements LoopObserver<O> {

    private final FluxSink<AgentNode<O>> sink;

    public IteratingLoopObserver(FluxSink<AgentNode<O>> sink) {
        this.sink = sink;
    }

    @Override
    public void onLoopStart(RunState<?> state) {
        emit(AgentNode.<O>builder()
                .kind(AgentNode.Kind.USER_PROMPT)
                .step(state.getRequestCount())
                .prompt(List.copyOf(state.getMessages()))
                .build());
    }

    @Override
    public void onBeforeModelCall(RunState<?> state, ModelRequest request) {
        emit(AgentNode.<O>builder()
                .kind(AgentNode.Kind.MODEL_REQUEST)
                .step(state.getRequestCount() + 1)
                .request(request)
                .build());
    }

    @Override
    public void onModelResponse(RunState<?> state, ModelResponse response) {
        emit(AgentNode.<O>builder()
                .kind(AgentNode.Kind.MODEL_RESPONSE)
                .step(state.getRequestCount())
                .response(response)
                .build());
    }

    @Override
    public void onBeforeToolProcessing(RunState<?> state, List<Message.ToolCall> calls) {
        emit(AgentNode.<O>builder()
                .kind(AgentNode.Kind.TOOL_EXECUTION)
                .step(state.getRequestCount())
                .toolCalls(calls)
                .build());
    }

    @Override
    public void onAfterToolProcessing(RunState<?> state, List<ToolCallResult> results) {
        emit(AgentNode.<O>builder()
                .kind(AgentNode.Kind.TOOL_RESULTS)
                .step(state.getRequestCount())
                .results(results)
                .build());
    }

    @Override
    public void onEnd(AgentResult<O> result) {
        emit(AgentNode.<O>builder()
                .kind(AgentNode.Kind.END)
                .step(result.getRequestCount())
                .result(result)
                .build());
    }

    private void emit(AgentNode<O> node) {
        if (!sink.isCancelled()) {
            sink.next(node);
        }
    }
}

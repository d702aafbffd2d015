package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.UnexpectedModelBehaviorException;
import me.golemcore.agent.domain.model.AgentStreamEvent;
import me.golemcore.agent.domain.model.ModelRequest;
import me.golemcore.agent.domain.model.ModelResponse;
import me.golemcore.agent.domain.model.ModelStreamEvent;
import me.golemcore.agent.port.outbound.ModelPort;
import reactor.core.Disposable;
import reactor.core.publisher.FluxSink;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Model invoker of the stream mode. Forwards the model's incremental events to
 * the caller's sink and hands the final response to the loop.
 *
 * <p>
 * Attempts go through {@link RetryingCompletion}, so a failed stream is
 * retried from the start; deltas of the failed attempt have already been
 * forwarded by then.
 */
public class StreamingModelAdapter<O> implements ModelInvoker {

    private final ModelPort model;
    private final RetryingCompletion retrying;
    private final FluxSink<AgentStreamEvent<O>> sink;

    public StreamingModelAdapter(ModelPort model, RetryingCompletion retrying, FluxSink<AgentStreamEvent<O>> sink) {
        this.model = model;
        this.retrying = retrying;
        this.sink = sink;
    }

    @Override
    public ModelResponse invoke(ModelRequest request) {
        return retrying.call(() -> streamOnce(request));
    }

    private CompletableFuture<ModelResponse> streamOnce(ModelRequest request) {
        CompletableFuture<ModelResponse> future = new CompletableFuture<>();
        AtomicReference<String> currentToolCallId = new AtomicReference<>();

        Disposable subscription = model.stream(request).subscribe(
                event -> onEvent(event, currentToolCallId, future),
                future::completeExceptionally,
                () -> future.completeExceptionally(
                        new UnexpectedModelBehaviorException("Model stream ended without a final response")));
        future.whenComplete((response, error) -> {
            if (future.isCancelled()) {
                subscription.dispose();
            }
        });
        return future;
    }

    private void onEvent(ModelStreamEvent event, AtomicReference<String> currentToolCallId,
            CompletableFuture<ModelResponse> future) {
        if (future.isDone()) {
            return;
        }
        switch (event.getKind()) {
        case CONTENT_DELTA -> emit(AgentStreamEvent.contentDelta(event.getText()));
        case TOOL_CALL_START -> {
            currentToolCallId.set(event.getToolCallId());
            emit(AgentStreamEvent.toolCallStart(event.getToolCallId(), event.getToolName()));
        }
        case TOOL_CALL_DELTA -> {
            String id = event.getToolCallId() != null ? event.getToolCallId() : currentToolCallId.get();
            emit(AgentStreamEvent.toolCallDelta(id, event.getText()));
        }
        case TOOL_CALL_END -> {
            String id = event.getToolCallId() != null ? event.getToolCallId() : currentToolCallId.get();
            emit(AgentStreamEvent.toolCallEnd(id));
        }
        case DONE -> {
            if (event.getResponse() == null) {
                future.completeExceptionally(
                        new UnexpectedModelBehaviorException("Model stream completed without a response"));
            } else {
                future.complete(event.getResponse());
            }
        }
        }
    }

    private void emit(AgentStreamEvent<O> event) {
        if (!sink.isCancelled()) {
            sink.next(event);
        }
    }
}

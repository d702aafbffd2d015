package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.AgentCancelledException;
import me.golemcore.agent.domain.exception.IterationLimitExceededException;
import me.golemcore.agent.domain.exception.UnexpectedModelBehaviorException;
import me.golemcore.agent.domain.loop.AgentLoopConfig;
import me.golemcore.agent.domain.model.AgentResult;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ModelRequest;
import me.golemcore.agent.domain.model.ModelResponse;
import me.golemcore.agent.domain.model.OutputType;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.service.ToolCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Run loop orchestrator.
 *
 * <p>
 * Each iteration: cancellation check, usage-limit check, one model call, then
 * the {@link ResponseHandler} decides whether the run ends or continues. The
 * same loop drives the blocking, streaming and iterating modes; the
 * {@link ModelInvoker} and {@link LoopObserver} passed in are what differ.
 *
 * @param <D>
 *            dependency type
 * @param <O>
 *            output type
 */
public class RunLoop<D, O> {

    private static final Logger log = LoggerFactory.getLogger(RunLoop.class);

    private final ToolCatalog<D> catalog;
    private final OutputType<O> outputType;
    private final AgentLoopConfig config;
    private final ResponseHandler<D, O> responseHandler;
    private final UsageLimiter limiter;
    private final HistoryWriter historyWriter;
    private final Clock clock;

    public RunLoop(ToolCatalog<D> catalog, OutputType<O> outputType, AgentLoopConfig config,
            ResponseHandler<D, O> responseHandler, UsageLimiter limiter, HistoryWriter historyWriter, Clock clock) {
        this.catalog = catalog;
        this.outputType = outputType;
        this.config = config;
        this.responseHandler = responseHandler;
        this.limiter = limiter;
        this.historyWriter = historyWriter;
        this.clock = clock;
    }

    public AgentResult<O> run(RunState<D> state, ModelInvoker invoker, LoopObserver<O> observer) {
        log.info("[AgentLoop] Run {} started (step {}, {} message(s))", state.getRunId(), state.getRequestCount(),
                state.getMessages().size());
        observer.onLoopStart(state);

        int maxIterations = config.getMaxIterations();
        while (state.getRequestCount() < maxIterations) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AgentCancelledException("Run " + state.getRunId() + " cancelled");
            }
            limiter.checkBeforeRequest(state);

            ModelRequest request = buildRequest(state);
            observer.onBeforeModelCall(state, request);
            ModelResponse response = invoker.invoke(request);
            if (response == null) {
                throw new UnexpectedModelBehaviorException("Model returned no response");
            }
            state.recordModelCall(response.getUsage());
            observer.onModelResponse(state, response);
            historyWriter.appendAssistant(state, response);
            log.debug("[AgentLoop] Run {} step {}: stop={}, toolCalls={}", state.getRunId(),
                    state.getRequestCount(), response.getStopReason(), response.getToolCalls().size());

            ResponseAction<O> action = responseHandler.handle(state, response, observer);
            if (action.finished()) {
                AgentResult<O> result = buildResult(state, action);
                log.info("[AgentLoop] Run {} finished: requests={}, toolCalls={}, tokens={}", state.getRunId(),
                        result.getRequestCount(), result.getToolCallCount(), result.getUsage().getTotalTokens());
                observer.onEnd(result);
                return result;
            }
        }

        log.warn("[AgentLoop] Run {} reached the iteration limit ({})", state.getRunId(), maxIterations);
        throw new IterationLimitExceededException(maxIterations);
    }

    ModelRequest buildRequest(RunState<D> state) {
        List<Message> messages = new ArrayList<>(state.getMessages().size() + 1);
        if (config.getSystemPrompt() != null && !config.getSystemPrompt().isBlank()) {
            messages.add(Message.system(config.getSystemPrompt()));
        }
        messages.addAll(state.getMessages());

        List<ToolDefinition> tools = new ArrayList<>(catalog.definitions());
        if (!outputType.isText()) {
            tools.add(ToolDefinition.builder()
                    .name(config.getOutputToolName())
                    .description(config.getOutputToolDescription())
                    .inputSchema(outputType.getSchema())
                    .build());
        }

        ModelRequest.ModelRequestBuilder builder = ModelRequest.builder()
                .messages(messages)
                .tools(tools)
                .temperature(config.getTemperature())
                .topP(config.getTopP())
                .maxTokens(config.getMaxTokens())
                .runId(state.getRunId());
        if (config.getStopSequences() != null) {
            builder.stopSequences(config.getStopSequences());
        }
        return builder.build();
    }

    private AgentResult<O> buildResult(RunState<D> state, ResponseAction<O> action) {
        return AgentResult.<O>builder()
                .output(action.output())
                .usage(state.getUsage())
                .messages(state.getMessages())
                .outputToolName(action.outputToolName())
                .runId(state.getRunId())
                .requestCount(state.getRequestCount())
                .toolCallCount(state.getToolCallCount())
                .startedAt(state.getStartedAt())
                .completedAt(clock.instant())
                .build();
    }
}

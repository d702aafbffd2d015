package me.golemcore.agent.domain.system.toolloop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.component.OutputValidator;
import me.golemcore.agent.domain.exception.HasDeferredToolsException;
import me.golemcore.agent.domain.exception.ModelRefusedException;
import me.golemcore.agent.domain.exception.OutputValidationFailedException;
import me.golemcore.agent.domain.exception.TruncatedOrFilteredException;
import me.golemcore.agent.domain.exception.UnexpectedModelBehaviorException;
import me.golemcore.agent.domain.exception.ValidationRetryException;
import me.golemcore.agent.domain.loop.AgentLoopConfig;
import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.EndStrategy;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ModelResponse;
import me.golemcore.agent.domain.model.OutputType;
import me.golemcore.agent.domain.model.PausedAgentRun;
import me.golemcore.agent.domain.model.PendingToolCall;
import me.golemcore.agent.domain.model.StopReason;
import me.golemcore.agent.domain.model.ToolCallResult;
import me.golemcore.agent.domain.model.ToolOutcome;
import me.golemcore.agent.domain.service.ToolCatalog;
import me.golemcore.agent.port.outbound.ModelPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns one model response into the next action of the run: accept an output,
 * dispatch tool calls, or fail.
 *
 * <p>
 * Tool calls of a batch are processed sequentially in call order. Calls to the
 * output-schema pseudo-tool are decoded and validated here and never reach the
 * {@link ToolExecutionEngine}. All results of a batch are appended as one
 * tool-results message once the batch settles or stops on a deferral.
 *
 * @param <D>
 *            dependency type
 * @param <O>
 *            output type
 */
public class ResponseHandler<D, O> {

    private static final Logger log = LoggerFactory.getLogger(ResponseHandler.class);

    static final String OUTPUT_ACCEPTED = "Final result processed.";
    static final String OUTPUT_ALREADY_ACCEPTED = "Final result already processed; this call was ignored.";
    static final String TOOL_SKIPPED = "Tool not executed - a final result was already processed.";
    static final String OUTPUT_NOT_ACCEPTED_PENDING = "Final result not accepted: other tool calls are pending.";

    private final ModelPort model;
    private final OutputType<O> outputType;
    private final List<OutputValidator<D, O>> validators;
    private final AgentLoopConfig config;
    private final ObjectMapper objectMapper;
    private final ToolExecutionEngine<D> engine;
    private final UsageLimiter limiter;
    private final HistoryWriter historyWriter;
    private final Clock clock;

    public ResponseHandler(ModelPort model, OutputType<O> outputType, List<OutputValidator<D, O>> validators,
            AgentLoopConfig config, ObjectMapper objectMapper, ToolExecutionEngine<D> engine, UsageLimiter limiter,
            HistoryWriter historyWriter, Clock clock) {
        this.model = model;
        this.outputType = outputType;
        this.validators = List.copyOf(validators);
        this.config = config;
        this.objectMapper = objectMapper;
        this.engine = engine;
        this.limiter = limiter;
        this.historyWriter = historyWriter;
        this.clock = clock;
    }

    ResponseAction<O> handle(RunState<D> state, ModelResponse response, LoopObserver<O> observer) {
        if (response.getRefusal() != null && !response.getRefusal().isBlank()) {
            throw new ModelRefusedException(response.getRefusal());
        }

        StopReason stopReason = response.getStopReason() != null ? response.getStopReason() : StopReason.END_TURN;
        return switch (stopReason) {
        case MAX_TOKENS, CONTENT_FILTERED -> throw new TruncatedOrFilteredException(stopReason);
        case TOOL_USE -> {
            if (!response.hasToolCalls()) {
                throw new UnexpectedModelBehaviorException("Model requested tool use without any tool calls");
            }
            yield dispatchTools(state, response.getToolCalls(), observer);
        }
        case END_TURN, STOP_SEQUENCE -> handleCompletion(state, response, observer);
        };
    }

    private ResponseAction<O> handleCompletion(RunState<D> state, ModelResponse response,
            LoopObserver<O> observer) {
        if (response.hasToolCalls()) {
            return dispatchTools(state, response.getToolCalls(), observer);
        }
        if (outputType.isText() && response.hasContent()) {
            O candidate = outputType.fromText(response.getContent());
            try {
                O output = validate(state.toContext(model), candidate);
                return ResponseAction.finish(output, null);
            } catch (ValidationRetryException e) {
                registerValidationRetry(state, e.getMessage());
                historyWriter.appendRetryPrompt(state, e.getMessage());
                return ResponseAction.proceed();
            }
        }
        throw new UnexpectedModelBehaviorException("Model ended its turn with neither "
                + (outputType.isText() ? "text content" : "a call to " + config.getOutputToolName())
                + " nor tool calls");
    }

    private ResponseAction<O> dispatchTools(RunState<D> state, List<Message.ToolCall> calls,
            LoopObserver<O> observer) {
        observer.onBeforeToolProcessing(state, calls);

        AgentRunContext<D> context = state.toContext(model);
        List<Message.ToolResultEntry> entries = new ArrayList<>(calls.size());
        List<ToolCallResult> results = new ArrayList<>(calls.size());
        boolean outputFound = false;
        int outputEntryIndex = -1;
        Message.ToolCall outputCall = null;
        O output = null;
        String validationFeedback = null;

        for (int i = 0; i < calls.size(); i++) {
            Message.ToolCall call = calls.get(i);

            if (isOutputCall(call)) {
                if (outputFound) {
                    entries.add(Message.ToolResultEntry.success(call, OUTPUT_ALREADY_ACCEPTED));
                    continue;
                }
                long start = System.nanoTime();
                ToolOutcome outcome;
                try {
                    output = decodeAndValidate(context.forToolCall(call.getId(), call.getName(), 0), call);
                    outputFound = true;
                    outputCall = call;
                    outputEntryIndex = entries.size();
                    outcome = ToolOutcome.success(OUTPUT_ACCEPTED);
                    entries.add(Message.ToolResultEntry.success(call, OUTPUT_ACCEPTED));
                } catch (ValidationRetryException e) {
                    validationFeedback = e.getMessage();
                    outcome = ToolOutcome.retry(validationFeedback);
                    entries.add(Message.ToolResultEntry.error(call, validationFeedback));
                }
                ToolCallResult result = new ToolCallResult(call, outcome, Duration.ofNanos(System.nanoTime() - start));
                results.add(result);
                observer.onToolComplete(state, result);
                continue;
            }

            if (outputFound && config.getEndStrategy() == EndStrategy.EARLY) {
                entries.add(Message.ToolResultEntry.success(call, TOOL_SKIPPED));
                continue;
            }

            limiter.checkBeforeToolCall(state);
            ToolCallResult result = engine.executeTimed(call, context);
            results.add(result);

            if (result.outcome().isDeferred()) {
                if (outputFound) {
                    entries.set(outputEntryIndex, Message.ToolResultEntry.error(outputCall,
                            OUTPUT_NOT_ACCEPTED_PENDING));
                }
                List<Message.ToolCall> unattempted = new ArrayList<>();
                for (Message.ToolCall rest : calls.subList(i + 1, calls.size())) {
                    if (isOutputCall(rest)) {
                        entries.add(Message.ToolResultEntry.error(rest, OUTPUT_NOT_ACCEPTED_PENDING));
                    } else {
                        unattempted.add(rest);
                    }
                }
                historyWriter.appendToolResults(state, entries);
                observer.onAfterToolProcessing(state, results);

                PausedAgentRun paused = state.snapshot(
                        List.of(new PendingToolCall(call, result.outcome().getDeferral())), unattempted,
                        clock.instant());
                log.info("[AgentLoop] Run {} paused on {} ({})", state.getRunId(), call.getName(),
                        result.outcome().getDeferral().getKind());
                throw new HasDeferredToolsException(paused);
            }

            state.recordToolCall();
            entries.add(toEntry(call, result.outcome()));
            observer.onToolComplete(state, result);
        }

        historyWriter.appendToolResults(state, entries);
        observer.onAfterToolProcessing(state, results);

        if (outputFound) {
            return ResponseAction.finish(output, config.getOutputToolName());
        }
        if (validationFeedback != null) {
            registerValidationRetry(state, validationFeedback);
        }
        return ResponseAction.proceed();
    }

    private O decodeAndValidate(AgentRunContext<D> context, Message.ToolCall call) {
        O candidate;
        try {
            candidate = outputType.decode(objectMapper, call.getArgumentsJson());
        } catch (JsonProcessingException e) {
            throw new ValidationRetryException("Invalid final result: " + e.getOriginalMessage());
        }
        return validate(context, candidate);
    }

    private O validate(AgentRunContext<D> context, O candidate) {
        O current = candidate;
        for (OutputValidator<D, O> validator : validators) {
            current = validator.validate(context, current);
        }
        return current;
    }

    private void registerValidationRetry(RunState<D> state, String feedback) {
        int retries = state.recordValidationRetry();
        Integer max = config.getMaxValidationRetries();
        log.debug("[AgentLoop] Output validation retry {} for run {}: {}", retries, state.getRunId(), feedback);
        if (max != null && retries > max) {
            throw new OutputValidationFailedException(retries, feedback);
        }
    }

    private boolean isOutputCall(Message.ToolCall call) {
        if (outputType.isText() || call.getName() == null) {
            return false;
        }
        String outputToolName = config.getOutputToolName();
        return outputToolName.equals(call.getName())
                || outputToolName.equals(ToolCatalog.sanitizeToolName(call.getName()));
    }

    static Message.ToolResultEntry toEntry(Message.ToolCall call, ToolOutcome outcome) {
        String content = outcome.toMessageContent();
        return outcome.isSuccess()
                ? Message.ToolResultEntry.success(call, content)
                : Message.ToolResultEntry.error(call, content);
    }
}

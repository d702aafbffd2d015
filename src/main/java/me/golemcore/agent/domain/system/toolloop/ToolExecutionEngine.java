package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.AgentCancelledException;
import me.golemcore.agent.domain.exception.ToolExecutionException;
import me.golemcore.agent.domain.exception.ToolNotFoundException;
import me.golemcore.agent.domain.exception.ToolRetriesExhaustedException;
import me.golemcore.agent.domain.exception.ToolTimeoutException;
import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolCallResult;
import me.golemcore.agent.domain.model.ToolOutcome;
import me.golemcore.agent.domain.service.RegisteredTool;
import me.golemcore.agent.domain.service.ToolCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pure tool-call execution: lookup, per-tool retry and timeout racing.
 *
 * <p>
 * Does NOT mutate the transcript and holds no state between calls. Tool
 * failures become {@code failure} outcomes; only a timeout or a cancellation
 * escapes as an exception.
 *
 * @param <D>
 *            dependency type
 */
public class ToolExecutionEngine<D> {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutionEngine.class);

    private final ToolCatalog<D> catalog;
    private final Duration toolTimeout;
    private final ExecutorService executor;

    /**
     * @param toolTimeout
     *            per-attempt timeout, or {@code null} to wait indefinitely
     * @param executor
     *            runs timed attempts; required when a timeout is set
     */
    public ToolExecutionEngine(ToolCatalog<D> catalog, Duration toolTimeout, ExecutorService executor) {
        if (toolTimeout != null && executor == null) {
            throw new IllegalArgumentException("An executor is required when a tool timeout is configured");
        }
        this.catalog = catalog;
        this.toolTimeout = toolTimeout;
        this.executor = executor;
    }

    /**
     * Callbacks around each call of a batch. {@code beforeCall} may throw to
     * stop the batch.
     */
    public interface BatchListener {

        BatchListener NONE = new BatchListener() {
        };

        default void beforeCall(Message.ToolCall call) {
        }

        default void afterCall(ToolCallResult result) {
        }
    }

    /**
     * Results of a batch in call order. When a call deferred, it is the last
     * entry and the calls after it were not attempted.
     */
    public record BatchResult(List<ToolCallResult> results, List<Message.ToolCall> unattempted) {

        public Optional<ToolCallResult> deferred() {
            if (results.isEmpty()) {
                return Optional.empty();
            }
            ToolCallResult last = results.get(results.size() - 1);
            return last.outcome().isDeferred() ? Optional.of(last) : Optional.empty();
        }
    }

    /**
     * Executes a call with the tool's retry budget. A {@code retry} outcome
     * left after the last attempt becomes a failure.
     */
    public ToolOutcome execute(Message.ToolCall call, AgentRunContext<D> context) {
        Optional<RegisteredTool<D>> found = catalog.find(call.getName());
        if (found.isEmpty()) {
            log.warn("[Tools] Unknown tool '{}'. Available tools: {}", call.getName(), catalog.names());
            return ToolOutcome.failure(new ToolNotFoundException(call.getName()));
        }
        RegisteredTool<D> tool = found.get();
        int maxRetries = tool.getMaxRetries();

        ToolOutcome outcome = null;
        for (int retries = 0; retries <= maxRetries; retries++) {
            outcome = invokeOnce(tool, call, context.forToolCall(call.getId(), tool.getName(), retries));
            if (!outcome.needsRetry()) {
                return outcome;
            }
            log.debug("[Tools] {} asked for retry {}/{}: {}", tool.getName(), retries + 1, maxRetries,
                    outcome.getFeedback());
        }
        log.warn("[Tools] {} exhausted {} attempts", tool.getName(), maxRetries + 1);
        return ToolOutcome.failure(new ToolRetriesExhaustedException(tool.getName(), maxRetries + 1,
                outcome.getFeedback()));
    }

    /**
     * Executes a call exactly once, without the retry wrapper. Used for calls
     * that were approved after a deferral.
     */
    public ToolOutcome executeOnce(Message.ToolCall call, AgentRunContext<D> context) {
        Optional<RegisteredTool<D>> found = catalog.find(call.getName());
        if (found.isEmpty()) {
            return ToolOutcome.failure(new ToolNotFoundException(call.getName()));
        }
        RegisteredTool<D> tool = found.get();
        return invokeOnce(tool, call, context.forToolCall(call.getId(), tool.getName(), 0));
    }

    public ToolCallResult executeTimed(Message.ToolCall call, AgentRunContext<D> context) {
        long start = System.nanoTime();
        ToolOutcome outcome = execute(call, context);
        return new ToolCallResult(call, outcome, Duration.ofNanos(System.nanoTime() - start));
    }

    /**
     * Executes calls sequentially in call order, stopping after the first
     * deferred outcome.
     */
    public BatchResult executeAll(List<Message.ToolCall> calls, AgentRunContext<D> context,
            BatchListener listener) {
        List<ToolCallResult> results = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            Message.ToolCall call = calls.get(i);
            listener.beforeCall(call);
            ToolCallResult result = executeTimed(call, context);
            results.add(result);
            listener.afterCall(result);
            if (result.outcome().isDeferred()) {
                log.info("[Tools] {} deferred ({}), {} call(s) left unattempted", call.getName(),
                        result.outcome().getDeferral().getKind(), calls.size() - i - 1);
                return new BatchResult(results, List.copyOf(calls.subList(i + 1, calls.size())));
            }
        }
        return new BatchResult(results, List.of());
    }

    private ToolOutcome invokeOnce(RegisteredTool<D> tool, Message.ToolCall call, AgentRunContext<D> context) {
        if (Thread.currentThread().isInterrupted()) {
            throw new AgentCancelledException("Run cancelled before tool " + tool.getName());
        }
        try {
            if (toolTimeout == null) {
                return awaitOutcome(tool.invoke(context, call.getArgumentsJson()));
            }
            return invokeWithTimeout(tool, call, context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentCancelledException("Run cancelled while executing tool " + tool.getName(), e);
        } catch (ToolTimeoutException | AgentCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Tools] {} failed: {}", tool.getName(), e.getMessage());
            return ToolOutcome.failure(e);
        }
    }

    private ToolOutcome invokeWithTimeout(RegisteredTool<D> tool, Message.ToolCall call,
            AgentRunContext<D> context) throws InterruptedException {
        Future<ToolOutcome> attempt = executor
                .submit(() -> awaitOutcome(tool.invoke(context, call.getArgumentsJson())));
        try {
            return attempt.get(toolTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            attempt.cancel(true);
            log.warn("[Tools] {} timed out after {} ms", tool.getName(), toolTimeout.toMillis());
            throw new ToolTimeoutException(tool.getName(), toolTimeout);
        } catch (InterruptedException e) {
            attempt.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            return ToolOutcome.failure(unwrap(e));
        }
    }

    private static ToolOutcome awaitOutcome(CompletableFuture<ToolOutcome> future) throws InterruptedException {
        if (future == null) {
            return ToolOutcome.failure(new ToolExecutionException("Tool returned no result"));
        }
        ToolOutcome outcome;
        try {
            outcome = future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            return ToolOutcome.failure(unwrap(e));
        }
        return outcome != null ? outcome : ToolOutcome.failure(new ToolExecutionException("Tool returned no result"));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.AgentCancelledException;
import me.golemcore.agent.domain.exception.AgentException;
import me.golemcore.agent.domain.exception.ModelCallException;
import me.golemcore.agent.domain.exception.RetriesExhaustedException;
import me.golemcore.agent.domain.model.ModelRequest;
import me.golemcore.agent.domain.model.ModelResponse;
import me.golemcore.agent.domain.model.RetryPolicy;
import me.golemcore.agent.domain.model.RetryableErrorKind;
import me.golemcore.agent.port.outbound.ModelPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Runs one model call under a {@link RetryPolicy}.
 *
 * <p>
 * Transient failures (rate limit, server error, network error) are retried
 * while the policy allows that kind and attempts remain; a transient failure
 * that is not retried surfaces as {@link RetriesExhaustedException}. Any other
 * failure propagates unchanged. The caller thread blocks; interrupting it
 * cancels the in-flight call and the backoff sleep.
 */
public class RetryingCompletion implements ModelInvoker {

    private static final Logger log = LoggerFactory.getLogger(RetryingCompletion.class);

    private final ModelPort model;
    private final RetryPolicy policy;
    private final ModelErrorClassifier classifier;
    private final Sleeper sleeper;

    public RetryingCompletion(ModelPort model, RetryPolicy policy, ModelErrorClassifier classifier) {
        this(model, policy, classifier, Sleeper.THREAD);
    }

    // Visible for testing
    RetryingCompletion(ModelPort model, RetryPolicy policy, ModelErrorClassifier classifier, Sleeper sleeper) {
        this.model = model;
        this.policy = policy != null ? policy : RetryPolicy.NONE;
        this.classifier = classifier;
        this.sleeper = sleeper;
    }

    /**
     * A single asynchronous attempt. Called once per attempt.
     */
    @FunctionalInterface
    public interface ModelCall<T> {
        CompletableFuture<T> start();
    }

    @Override
    public ModelResponse invoke(ModelRequest request) {
        return call(() -> model.complete(request));
    }

    public <T> T call(ModelCall<T> modelCall) {
        int maxAttempts = Math.max(1, policy.getMaxAttempts());
        Throwable lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AgentCancelledException("Model call cancelled before attempt " + attempt);
            }
            if (attempt > 1) {
                backoff(attempt, lastError);
            }

            Throwable failure;
            CompletableFuture<T> future = null;
            try {
                future = modelCall.start();
                return future.get();
            } catch (InterruptedException e) {
                if (future != null) {
                    future.cancel(true);
                }
                Thread.currentThread().interrupt();
                throw new AgentCancelledException("Model call interrupted", e);
            } catch (ExecutionException e) {
                failure = unwrap(e);
            } catch (RuntimeException e) {
                failure = unwrap(e);
            }

            if (failure instanceof AgentException && !(failure instanceof ModelCallException)) {
                throw (AgentException) failure;
            }

            Optional<RetryableErrorKind> kind = classifier.classifyRetryable(failure);
            if (kind.isEmpty()) {
                throw propagate(failure);
            }
            if (!policy.allows(kind.get())) {
                log.warn("[ModelCall] {} failure is not retryable under the current policy: {}", kind.get(),
                        failure.getMessage());
                throw new RetriesExhaustedException(attempt, failure);
            }
            lastError = failure;
            if (attempt < maxAttempts) {
                log.warn("[ModelCall] Attempt {}/{} failed ({}): {}", attempt, maxAttempts, kind.get(),
                        failure.getMessage());
            }
        }

        log.warn("[ModelCall] Giving up after {} attempts", maxAttempts);
        throw new RetriesExhaustedException(maxAttempts, lastError);
    }

    private void backoff(int attempt, Throwable lastError) {
        Duration delay = policy.delay(attempt - 1, retryAfter(lastError));
        log.debug("[ModelCall] Waiting {} ms before attempt {}", delay.toMillis(), attempt);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentCancelledException("Model call cancelled during backoff", e);
        }
    }

    private static Duration retryAfter(Throwable error) {
        if (error instanceof ModelCallException modelCallException) {
            return modelCallException.getRetryAfter();
        }
        return null;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static RuntimeException propagate(Throwable failure) {
        if (failure instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        return new AgentException("Model call failed: " + failure.getMessage(), failure);
    }
}

package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.ModelRequest;
import me.golemcore.agent.domain.model.ModelResponse;
import me.golemcore.agent.domain.model.ModelStreamEvent;
import me.golemcore.agent.port.outbound.ModelPort;
import me.golemcore.agent.port.outbound.UsageTrackingPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Decorator around {@link ModelPort} that records token usage via
 * {@link UsageTrackingPort} after each completed call, streamed or not.
 */
public class UsageTrackingModelPortDecorator implements ModelPort {

    private static final Logger log = LoggerFactory.getLogger(UsageTrackingModelPortDecorator.class);

    private final ModelPort delegate;
    private final UsageTrackingPort usageTracker;
    private final Clock clock;

    public UsageTrackingModelPortDecorator(ModelPort delegate, UsageTrackingPort usageTracker, Clock clock) {
        this.delegate = delegate;
        this.usageTracker = usageTracker;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public CompletableFuture<ModelResponse> complete(ModelRequest request) {
        Instant start = clock.instant();
        return delegate.complete(request).thenApply(response -> {
            recordUsage(request, response, start);
            return response;
        });
    }

    @Override
    public Flux<ModelStreamEvent> stream(ModelRequest request) {
        return Flux.defer(() -> {
            Instant start = clock.instant();
            return delegate.stream(request).doOnNext(event -> {
                if (event.getKind() == ModelStreamEvent.Kind.DONE) {
                    recordUsage(request, event.getResponse(), start);
                }
            });
        });
    }

    private void recordUsage(ModelRequest request, ModelResponse response, Instant start) {
        if (response == null || response.getUsage() == null) {
            return;
        }
        try {
            String model = response.getModel() != null ? response.getModel() : delegate.getName();
            usageTracker.recordUsage(request.getRunId(), model, response.getUsage(),
                    Duration.between(start, clock.instant()));
        } catch (Exception e) { // NOSONAR
            log.warn("[UsageTracking] Failed to record usage: {}", e.getMessage());
        }
    }
}

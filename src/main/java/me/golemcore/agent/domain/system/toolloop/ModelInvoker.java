package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.ModelRequest;
import me.golemcore.agent.domain.model.ModelResponse;

/**
 * Blocking model call as seen by the run loop. Retries, streaming and
 * cancellation are the implementation's concern.
 */
@FunctionalInterface
public interface ModelInvoker {

    ModelResponse invoke(ModelRequest request);
}

package me.golemcore.agent.port.outbound;


/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agent.domain.model.ModelRequest;
import me.golemcore.agent.domain.model.ModelResponse;
import me.golemcore.agent.domain.model.ModelStreamEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the language model the agent talks to. Implementations own the
 * provider wire format; failures should be reported as
 * {@code ModelCallException} (or any exception the error classifier
 * understands) so that transient errors can be retried.
 */
public interface ModelPort {

    /**
     * Returns a short identifier for logs and usage records.
     */
    String getName();

    /**
     * Executes a completion request and returns the full response.
     */
    CompletableFuture<ModelResponse> complete(ModelRequest request);

    /**
     * Executes a streaming request. The stream must end with exactly one
     * {@code DONE} event carrying the assembled response. The default
     * implementation emits that single event from {@link #complete}.
     */
    default Flux<ModelStreamEvent> stream(ModelRequest request) {
        return Mono.fromFuture(() -> complete(request))
                .map(ModelStreamEvent::done)
                .flux();
    }
}

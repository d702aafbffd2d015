package me.golemcore.agent.domain.loop;


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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.model.OutputType;
import me.golemcore.agent.domain.system.toolloop.ModelErrorClassifier;
import me.golemcore.agent.port.outbound.ModelPort;

import java.time.Clock;

/**
 * Creates agent builders pre-wired with the shared model, configuration,
 * object mapper and error classifier.
 */
public class AgentFactory {

    private final ModelPort model;
    private final AgentLoopConfig config;
    private final ObjectMapper objectMapper;
    private final ModelErrorClassifier errorClassifier;
    private final Clock clock;

    public AgentFactory(ModelPort model, AgentLoopConfig config, ObjectMapper objectMapper,
            ModelErrorClassifier errorClassifier, Clock clock) {
        this.model = model;
        this.config = config;
        this.objectMapper = objectMapper;
        this.errorClassifier = errorClassifier;
        this.clock = clock;
    }

    /**
     * Returns a builder with the shared collaborators set. The agent copies the
     * loop configuration when it is built.
     */
    public <D, O> Agent.AgentBuilder<D, O> builder(OutputType<O> outputType) {
        return Agent.<D, O>builder()
                .model(model)
                .outputType(outputType)
                .config(config)
                .objectMapper(objectMapper)
                .errorClassifier(errorClassifier)
                .clock(clock);
    }

    public ModelPort getModel() {
        return model;
    }
}

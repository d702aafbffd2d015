package me.golemcore.agent.domain.service;


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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.PausedAgentRun;

/**
 * JSON codec for {@link PausedAgentRun}, for callers that resolve deferred
 * tools out of process and need to persist or transport the snapshot.
 */
@Slf4j
public class PausedRunCodec {

    private final ObjectMapper objectMapper;

    public PausedRunCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(PausedAgentRun pausedRun) {
        try {
            return objectMapper.writeValueAsString(pausedRun);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize paused run " + pausedRun.getRunId(), e);
        }
    }

    public PausedAgentRun decode(String json) {
        try {
            PausedAgentRun pausedRun = objectMapper.readValue(json, PausedAgentRun.class);
            log.debug("[Resume] Decoded paused run {} with {} pending call(s)", pausedRun.getRunId(),
                    pausedRun.getPendingCalls().size());
            return pausedRun;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid paused run JSON: " + e.getOriginalMessage(), e);
        }
    }
}

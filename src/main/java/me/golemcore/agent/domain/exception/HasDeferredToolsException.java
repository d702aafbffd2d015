package me.golemcore.agent.domain.exception;


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

import lombok.Getter;
import me.golemcore.agent.domain.model.PausedAgentRun;

/**
 * Raised when a run suspends on deferred tool calls. Not a failure: the
 * carried snapshot is resumed with {@code Agent.resume}.
 */
@Getter
public class HasDeferredToolsException extends AgentException {

    private final transient PausedAgentRun pausedRun;

    public HasDeferredToolsException(PausedAgentRun pausedRun) {
        super("Run " + pausedRun.getRunId() + " is waiting on " + pausedRun.getPendingCalls().size()
                + " deferred tool call(s)");
        this.pausedRun = pausedRun;
    }
}

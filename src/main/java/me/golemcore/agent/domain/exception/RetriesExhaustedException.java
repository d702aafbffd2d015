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

/**
 * A transient model-call failure that was not recovered by the retry policy.
 * The last failure is the cause.
 */
@Getter
public class RetriesExhaustedException extends AgentException {

    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable lastError) {
        super("Model call failed after " + attempts + " attempt(s): " + lastError.getMessage(), lastError);
        this.attempts = attempts;
    }

    public Throwable getLastError() {
        return getCause();
    }
}

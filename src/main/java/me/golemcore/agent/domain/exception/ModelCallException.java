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

import java.time.Duration;

/**
 * Failure of a single model call, tagged with its kind. Providers may attach a
 * server-suggested wait via {@code retryAfter}.
 */
@Getter
public class ModelCallException extends AgentException {

    private final ModelErrorKind kind;
    private final Duration retryAfter;

    public ModelCallException(ModelErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public ModelCallException(ModelErrorKind kind, String message, Duration retryAfter) {
        this(kind, message, retryAfter, null);
    }

    public ModelCallException(ModelErrorKind kind, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }
}

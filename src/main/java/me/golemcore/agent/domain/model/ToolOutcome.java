package me.golemcore.agent.domain.model;


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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import me.golemcore.agent.domain.exception.ToolExecutionException;

import java.util.Objects;

/**
 * Result of one attempt of one tool call. Exactly one of the four kinds:
 * <ul>
 * <li>{@link Kind#SUCCESS} with the text handed back to the model</li>
 * <li>{@link Kind#RETRY} with feedback; the engine re-invokes the tool while
 * its retry budget lasts</li>
 * <li>{@link Kind#FAILURE} with the error; recorded as error content</li>
 * <li>{@link Kind#DEFERRED} with a {@link DeferredToolCall}; pauses the run</li>
 * </ul>
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ToolOutcome {

    public enum Kind {
        SUCCESS, RETRY, FAILURE, DEFERRED
    }

    private final Kind kind;
    private final String output;
    private final String feedback;
    private final Throwable error;
    private final DeferredToolCall deferral;

    public static ToolOutcome success(String output) {
        return new ToolOutcome(Kind.SUCCESS, output != null ? output : "", null, null, null);
    }

    public static ToolOutcome retry(String feedback) {
        return new ToolOutcome(Kind.RETRY, null, Objects.requireNonNull(feedback, "feedback"), null, null);
    }

    public static ToolOutcome failure(Throwable error) {
        return new ToolOutcome(Kind.FAILURE, null, null, Objects.requireNonNull(error, "error"), null);
    }

    public static ToolOutcome failure(String message) {
        return failure(new ToolExecutionException(message));
    }

    public static ToolOutcome deferred(DeferredToolCall deferral) {
        return new ToolOutcome(Kind.DEFERRED, null, null, null, Objects.requireNonNull(deferral, "deferral"));
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean needsRetry() {
        return kind == Kind.RETRY;
    }

    public boolean isFailure() {
        return kind == Kind.FAILURE;
    }

    public boolean isDeferred() {
        return kind == Kind.DEFERRED;
    }

    /**
     * Text recorded in the transcript for this outcome. Deferred outcomes have
     * no transcript content until they are resolved.
     */
    public String toMessageContent() {
        return switch (kind) {
        case SUCCESS -> output;
        case RETRY -> feedback;
        case FAILURE -> "Error: " + (error.getMessage() != null ? error.getMessage()
                : error.getClass().getSimpleName());
        case DEFERRED -> throw new IllegalStateException("Deferred outcome has no message content");
        };
    }
}

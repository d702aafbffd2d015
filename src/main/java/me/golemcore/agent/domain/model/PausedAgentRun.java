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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a run suspended on deferred tool calls. This is the only thing a
 * caller needs to keep (in memory, or serialized with
 * {@code PausedRunCodec}) to continue the run later.
 *
 * <p>
 * {@code pendingCalls} are the calls awaiting a {@link ResolvedTool};
 * {@code unattemptedCalls} are the calls of the same batch that came after the
 * deferring call and were never started. They are never invoked; resume
 * answers each with a "not executed" error entry.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PausedAgentRun {

    String runId;

    @Singular
    List<Message> messages;

    Usage usage;
    int requestCount;
    int toolCallCount;

    @Singular
    List<PendingToolCall> pendingCalls;

    @Singular
    List<Message.ToolCall> unattemptedCalls;

    Instant createdAt;

    /**
     * Pending calls waiting for a human decision.
     */
    public List<PendingToolCall> approvals() {
        return byKind(DeferralKind.APPROVAL);
    }

    /**
     * Pending calls whose result is produced externally.
     */
    public List<PendingToolCall> external() {
        return byKind(DeferralKind.EXTERNAL);
    }

    private List<PendingToolCall> byKind(DeferralKind kind) {
        return pendingCalls.stream()
                .filter(pending -> pending.deferral().getKind() == kind)
                .toList();
    }
}

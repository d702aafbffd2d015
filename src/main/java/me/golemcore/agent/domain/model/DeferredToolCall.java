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
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Returned by a tool that needs external resolution. The {@code id} is the key
 * a caller uses in {@link ResolvedTool} when resuming.
 */
@Value
@Builder
@Jacksonized
public class DeferredToolCall {

    String id;
    String reason;
    DeferralKind kind;

    public static DeferredToolCall needsApproval(String id, String reason) {
        return new DeferredToolCall(id, reason, DeferralKind.APPROVAL);
    }

    public static DeferredToolCall external(String id, String reason) {
        return new DeferredToolCall(id, reason, DeferralKind.EXTERNAL);
    }

    public static DeferredToolCall custom(String id, String reason) {
        return new DeferredToolCall(id, reason, DeferralKind.CUSTOM);
    }
}

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

/**
 * Optional per-run ceilings. A {@code null} field means no limit.
 */
@Value
@Builder(toBuilder = true)
public class UsageLimits {

    public static final UsageLimits NONE = UsageLimits.builder().build();

    Integer maxInputTokens;
    Integer maxOutputTokens;
    Integer maxTotalTokens;
    Integer maxRequests;
    Integer maxToolCalls;

    public boolean hasAny() {
        return maxInputTokens != null || maxOutputTokens != null || maxTotalTokens != null
                || maxRequests != null || maxToolCalls != null;
    }
}

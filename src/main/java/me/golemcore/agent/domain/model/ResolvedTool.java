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

import java.util.Objects;

/**
 * Caller's decision for one deferred tool call, keyed by the deferral id.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ResolvedTool {

    private final String deferralId;
    private final Resolution resolution;

    public static ResolvedTool of(String deferralId, Resolution resolution) {
        return new ResolvedTool(Objects.requireNonNull(deferralId, "deferralId"),
                Objects.requireNonNull(resolution, "resolution"));
    }

    public static ResolvedTool approved(String deferralId) {
        return of(deferralId, Resolution.approved());
    }

    public static ResolvedTool denied(String deferralId, String reason) {
        return of(deferralId, Resolution.denied(reason));
    }

    public static ResolvedTool completed(String deferralId, String result) {
        return of(deferralId, Resolution.completed(result));
    }

    public static ResolvedTool failed(String deferralId, String error) {
        return of(deferralId, Resolution.failed(error));
    }

    @Getter
    @ToString
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class Resolution {

        public enum Kind {
            APPROVED, DENIED, COMPLETED, FAILED
        }

        private final Kind kind;
        private final String text;

        public static Resolution approved() {
            return new Resolution(Kind.APPROVED, null);
        }

        public static Resolution denied(String reason) {
            return new Resolution(Kind.DENIED, reason);
        }

        public static Resolution completed(String result) {
            return new Resolution(Kind.COMPLETED, result);
        }

        public static Resolution failed(String error) {
            return new Resolution(Kind.FAILED, error);
        }
    }
}

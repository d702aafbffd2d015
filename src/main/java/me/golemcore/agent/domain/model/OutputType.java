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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;
import java.util.Objects;

/**
 * Declared result type of an agent. Plain text is taken from the model's
 * content; anything else is requested through the output-schema pseudo-tool
 * whose JSON Schema is supplied here.
 *
 * @param <O>
 *            output type
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class OutputType<O> {

    private static final OutputType<String> TEXT = new OutputType<>(String.class, null, true);

    private final Class<O> type;
    private final Map<String, Object> schema;
    private final boolean text;

    public static OutputType<String> text() {
        return TEXT;
    }

    public static <O> OutputType<O> of(Class<O> type, Map<String, Object> schema) {
        return new OutputType<>(Objects.requireNonNull(type, "type"), Objects.requireNonNull(schema, "schema"),
                false);
    }

    /**
     * Decodes the arguments of an output-tool call.
     */
    public O decode(ObjectMapper objectMapper, String argumentsJson) throws JsonProcessingException {
        String json = argumentsJson == null || argumentsJson.isBlank() ? "{}" : argumentsJson;
        return objectMapper.readValue(json, type);
    }

    /**
     * Casts plain model content to the output type. Only valid for text output.
     */
    public O fromText(String content) {
        if (!text) {
            throw new IllegalStateException("Output type " + type.getName() + " is not plain text");
        }
        return type.cast(content);
    }
}

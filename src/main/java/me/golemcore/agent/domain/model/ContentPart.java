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
 * A piece of user content: text, or an image referenced by base64 data.
 */
@Value
@Builder
@Jacksonized
public class ContentPart {

    public enum Type {
        TEXT, IMAGE
    }

    Type type;
    String text;
    String base64Data;
    String mimeType;

    public static ContentPart text(String text) {
        return ContentPart.builder().type(Type.TEXT).text(text).build();
    }

    public static ContentPart image(String base64Data, String mimeType) {
        return ContentPart.builder().type(Type.IMAGE).base64Data(base64Data).mimeType(mimeType).build();
    }
}

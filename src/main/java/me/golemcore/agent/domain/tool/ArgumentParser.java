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

package me.golemcore.agent.domain.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses model-produced tool arguments. Models sometimes double-encode nested
 * objects as JSON strings, so string values that look like a JSON object or
 * array are parsed recursively; strings that fail to parse stay strings.
 */
public class ArgumentParser {

    private final ObjectMapper objectMapper;

    public ArgumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException
     *             if the top level is not a JSON object
     */
    public Map<String, Object> parse(String rawArguments) {
        if (rawArguments == null || rawArguments.isBlank()) {
            return new LinkedHashMap<>();
        }
        Object parsed;
        try {
            parsed = objectMapper.readValue(rawArguments, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON arguments: " + e.getOriginalMessage(), e);
        }
        if (parsed instanceof String nested) {
            return parse(nested);
        }
        if (!(parsed instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Tool arguments must be a JSON object");
        }
        return deepParseMap(map);
    }

    public Map<String, Object> deepParseMap(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            result.put(String.valueOf(entry.getKey()), deepParse(entry.getValue()));
        }
        return result;
    }

    private Object deepParse(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepParseMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(deepParse(item));
            }
            return result;
        }
        if (value instanceof String text && looksLikeJson(text)) {
            try {
                return deepParse(objectMapper.readValue(text, Object.class));
            } catch (JsonProcessingException e) {
                return text;
            }
        }
        return value;
    }

    private static boolean looksLikeJson(String text) {
        String trimmed = text.trim();
        return (trimmed.startsWith("{") && trimmed.endsWith("}"))
                || (trimmed.startsWith("[") && trimmed.endsWith("]"));
    }
}

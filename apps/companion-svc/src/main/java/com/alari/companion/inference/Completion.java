package com.alari.companion.inference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A buffered reply. {@code usage} is passed through untouched and may be empty.
 */
public record Completion(String text, Map<String, Object> usage) {
    public Completion {
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }
}

package com.alari.companion.conversation;

import java.util.Locale;

public enum MessageRole {
    SYSTEM, USER, ASSISTANT;

    /** Lower-case wire and column form. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MessageRole fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("role is required");
        }
        return MessageRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.alari.companion.goal;

import java.util.Locale;

public enum GoalStatus {
    ACTIVE, COMPLETED, ABANDONED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException for anything other than active, completed or abandoned
     */
    public static GoalStatus fromValue(String value) {
        if (value != null) {
            for (GoalStatus status : values()) {
                if (status.value().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("status must be one of active, completed, abandoned");
    }
}

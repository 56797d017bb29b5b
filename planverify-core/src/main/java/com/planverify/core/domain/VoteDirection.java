package com.planverify.core.domain;

import java.util.Locale;

public enum VoteDirection {
    UP,
    DOWN;

    /**
     * Parses "up"/"down" in any case.
     */
    public static VoteDirection parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Vote direction is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "up" -> UP;
            case "down" -> DOWN;
            default -> throw new IllegalArgumentException("Vote must be 'up' or 'down': " + value);
        };
    }
}

package com.linlay.toolseek.model;

import java.util.Locale;

public enum ChatRole {
    SYSTEM,
    USER,
    ASSISTANT;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChatRole fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("message role is required");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (ChatRole role : values()) {
            if (role.name().equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unsupported message role: " + raw);
    }
}

package io.vocalis.core.model;

import java.util.Locale;

public enum TurnRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String wireValue;

    TurnRole(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static TurnRole parse(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (TurnRole role : values()) {
            if (role.wireValue.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("unsupported turn role: " + raw);
    }
}

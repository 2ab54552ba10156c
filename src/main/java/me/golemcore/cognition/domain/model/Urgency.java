package me.golemcore.cognition.domain.model;

import java.util.Locale;
import java.util.Optional;

public enum Urgency {
    LOW, MEDIUM, HIGH;

    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Urgency> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Urgency urgency : values()) {
            if (urgency.name().equals(normalized)) {
                return Optional.of(urgency);
            }
        }
        return Optional.empty();
    }
}

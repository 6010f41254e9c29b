package com.vidnyan.kpolicy.domain.check;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity assigned to a check by the active configuration.
 */
public enum Severity {
    DANGER("danger"),     // Must fix
    WARNING("warning"),   // Should review
    IGNORE("ignore");     // Not evaluated

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Ignored checks are never run.
     */
    public boolean isActionable() {
        return this != IGNORE;
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null) {
            return IGNORE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "danger", "error" -> DANGER;
            case "warning", "warn" -> WARNING;
            case "ignore", "off" -> IGNORE;
            default -> throw new IllegalArgumentException("Unknown severity: " + value);
        };
    }
}

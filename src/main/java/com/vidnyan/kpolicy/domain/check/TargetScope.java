package com.vidnyan.kpolicy.domain.check;

import java.util.Arrays;

/**
 * Structural scope a check is evaluated in, and the shape of the fragment its predicate expects.
 */
public enum TargetScope {
    POD("Pod"),
    CONTROLLER("Controller"),
    CONTAINER("Container"),
    OTHER("Other");

    private final String value;

    TargetScope(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parse the value used in check definitions ("Pod", "Container", ...). Case-insensitive.
     */
    public static TargetScope fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown target: " + value));
    }
}

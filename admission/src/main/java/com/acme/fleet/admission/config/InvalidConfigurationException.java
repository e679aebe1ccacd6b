package com.acme.fleet.admission.config;

import java.util.List;

/**
 * Raised at init when admission settings are inconsistent. The only fatal error of the
 * admission subsystem; it is thrown before any request is accepted.
 */
public final class InvalidConfigurationException extends RuntimeException {
    private final List<String> violations;

    public InvalidConfigurationException(List<String> violations) {
        super("invalid spawn admission configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }

    /**
     * Throws when {@code violations} is non-empty.
     */
    public static void throwIfAny(List<String> violations) {
        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }
    }
}

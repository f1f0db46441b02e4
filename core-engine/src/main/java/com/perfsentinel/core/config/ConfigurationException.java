package com.perfsentinel.core.config;

import java.util.List;

/**
 * Thrown when an alert or scaling rule definition is invalid.
 *
 * <p>
 * Raised at registration or configuration load time so that a misconfigured
 * rule fails fast instead of producing undefined evaluation behaviour.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Throw if {@code errors} is non-empty, joining every error into one
     * message.
     *
     * @param subject what was validated, e.g. {@code "Invalid AlertRule"}
     * @param errors  collected validation errors
     * @throws ConfigurationException if any error was collected
     */
    public static void throwIfAny(String subject, List<String> errors) {
        if (!errors.isEmpty()) {
            throw new ConfigurationException(subject + ": " + String.join("; ", errors));
        }
    }
}

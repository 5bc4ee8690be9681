package com.questrail.touchportal.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing an error or anomaly in the plugin runtime.
 *
 * @param rawLine the inbound line involved, or {@code null} when the error is
 *                not tied to a particular message
 */
public record PluginErrorEvent(
    Instant timestamp,
    ErrorCategory category,
    String message,
    Throwable cause,
    String rawLine
) {
    public PluginErrorEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(message, "message");
    }

    public static PluginErrorEvent of(ErrorCategory category, String message, Throwable cause, String rawLine) {
        return new PluginErrorEvent(Instant.now(), category, message, cause, rawLine);
    }
}

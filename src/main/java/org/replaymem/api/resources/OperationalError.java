package org.replaymem.api.resources;

import java.time.Instant;

/**
 * A transient, survivable problem recorded by a replay memory.
 *
 * @param timestamp When the error occurred.
 * @param errorType A category for the error (e.g., "EPISODE_TOO_LONG").
 * @param message   A human-readable description of the error.
 * @param details   Optional additional context.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}

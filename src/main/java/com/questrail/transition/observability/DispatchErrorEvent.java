package com.questrail.transition.observability;

import java.time.Instant;

/**
 * Record representing an error raised outside the manager itself, such as a
 * failing event handler.
 */
public record DispatchErrorEvent(
    Instant timestamp,
    String managerName,
    String message,
    Throwable cause
) {
}

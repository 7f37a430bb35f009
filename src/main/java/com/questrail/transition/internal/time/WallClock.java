package com.questrail.transition.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability timestamps.
 *
 * <p>
 * Transition functions never see this clock. Anything that influences the
 * next state must arrive inside a {@code StateChange}.
 * </p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();

    /**
     * Returns a clock that always reports the given instant.
     */
    static WallClock fixed(Instant instant) {
        return () -> instant;
    }
}

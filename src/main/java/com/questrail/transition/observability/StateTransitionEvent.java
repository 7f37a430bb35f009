package com.questrail.transition.observability;

import com.questrail.transition.api.Event;
import com.questrail.transition.api.State;
import com.questrail.transition.api.StateChange;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Record representing one committed dispatch.
 *
 * @param oldState state before the dispatch, {@code null} if absent
 * @param newState state after the dispatch, {@code null} if absent
 */
public record StateTransitionEvent(
    Instant timestamp,
    String managerName,
    State oldState,
    State newState,
    StateChange triggeringChange,
    List<? extends Event> resultingEvents
) {
    /**
     * Checks if the manager moved between has-state and absent.
     */
    public boolean isPresenceChange() {
        return (oldState == null) != (newState == null);
    }

    /**
     * Checks if the committed state differs in value from the previous one.
     */
    public boolean isStateChanged() {
        return !Objects.equals(oldState, newState);
    }
}

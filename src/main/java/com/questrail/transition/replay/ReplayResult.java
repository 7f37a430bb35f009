package com.questrail.transition.replay;

import com.questrail.transition.api.Event;
import com.questrail.transition.api.State;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a replay: the final state and every event, in dispatch order.
 */
public record ReplayResult<S extends State, E extends Event>(Optional<S> finalState, List<E> events)
{
    public ReplayResult {
        Objects.requireNonNull(finalState, "finalState");
        events = List.copyOf(events);
    }
}

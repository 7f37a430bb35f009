package com.questrail.transition.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Iteration
 * -----------------------------------------------------------------------------
 * Result of applying one {@link StateChange} to a {@link State}: the next
 * state, which may be absent, and the ordered events the transition produced.
 *
 * <p>Event order is significant and preserved. The event list is copied on
 * construction; element validation is left to the manager so that an invalid
 * element is reported as a contract violation rather than coerced.</p>
 *
 * @param newState the next state, or {@code null} to clear the manager
 * @param events   events in production order
 */
public record Iteration<S extends State, E extends Event>(S newState, List<E> events)
{
    public Iteration {
        if (events == null) {
            throw new ContractViolationException("Iteration events must not be null");
        }
        events = Collections.unmodifiableList(new ArrayList<>(events));
    }

    /**
     * Returns the next state, empty when the transition cleared the manager.
     */
    public Optional<S> nextState() {
        return Optional.ofNullable(newState);
    }

    public boolean isCleared() {
        return newState == null;
    }

    @SafeVarargs
    public static <S extends State, E extends Event> Iteration<S, E> of(S newState, E... events) {
        return new Iteration<>(newState, Arrays.asList(events));
    }

    /**
     * No-op result: same state, no events.
     */
    public static <S extends State, E extends Event> Iteration<S, E> unchanged(S state) {
        return new Iteration<>(state, List.of());
    }

    /**
     * Tear-down result: no next state, followed by the given events.
     */
    @SafeVarargs
    public static <S extends State, E extends Event> Iteration<S, E> cleared(E... events) {
        return new Iteration<>(null, Arrays.asList(events));
    }
}

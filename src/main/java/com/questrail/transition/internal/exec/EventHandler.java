package com.questrail.transition.internal.exec;

import com.questrail.transition.api.Event;

import java.util.List;

/**
 * EventHandler
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure state manager and the impure world of
 * network senders, loggers and persistence writers.
 *
 * <h2>Role in the architecture</h2>
 * The state manager decides <b>what happened</b>; an event handler decides
 * <b>what to do about it</b>. It is the only layer allowed to perform I/O in
 * response to a dispatch.
 *
 * Any outcome of that I/O that matters to the state (a reply, a failure, a
 * timeout) must come back in as a new {@code StateChange}, never as a return
 * value.
 *
 * @param <E> the domain event type
 */
@FunctionalInterface
public interface EventHandler<E extends Event>
{
    /**
     * Handle the events of one committed dispatch.
     *
     * @param events immutable, ordered events; may be empty
     */
    void handle(List<E> events);
}

package com.questrail.transition.core;

import com.questrail.transition.api.ConfigurationException;
import com.questrail.transition.api.ContractViolationException;
import com.questrail.transition.api.Event;
import com.questrail.transition.api.Iteration;
import com.questrail.transition.api.State;
import com.questrail.transition.api.StateChange;
import com.questrail.transition.api.StateTransition;
import com.questrail.transition.config.StateManagerConfig;
import com.questrail.transition.internal.time.WallClock;
import com.questrail.transition.observability.ContractViolationEvent;
import com.questrail.transition.observability.StateTransitionEvent;
import com.questrail.transition.observability.TransitionObservabilitySink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * StateManager
 * -----------------------------------------------------------------------------
 * The single authoritative holder of application state.
 *
 * <h2>Role in the architecture</h2>
 * The manager owns the current {@link State} and changes it only in response
 * to explicit {@link StateChange}s. For each change it:
 * <ol>
 *   <li>checks the change against the declared change type</li>
 *   <li>copies the current state (see {@link StateCopier})</li>
 *   <li>invokes the registered {@link StateTransition} on the copy</li>
 *   <li>checks the returned {@link Iteration}</li>
 *   <li>commits the next state and returns the events in production order</li>
 * </ol>
 *
 * The manager never interprets states, changes or events, and never performs
 * I/O. Routing the returned events is the caller's responsibility.
 *
 * <h2>Atomicity</h2>
 * Nothing is committed until the iteration has been fully checked. If the
 * transition function throws, or any check fails, the current state is left
 * exactly as it was and no events are returned.
 *
 * <h2>Threading model</h2>
 * A manager has a single logical writer. It performs no locking or queuing;
 * callers that dispatch from several threads must serialize access themselves
 * (see {@code SerializedDispatchDriver}).
 *
 * <h2>Absent state</h2>
 * A transition may return no next state, which clears the manager. Whether a
 * cleared manager still accepts dispatch is governed by
 * {@link AbsentStatePolicy}.
 *
 * @param <S> the domain state type
 * @param <C> the domain change type
 * @param <E> the domain event type
 */
public final class StateManager<S extends State, C extends StateChange, E extends Event>
{
    private final StateTransition<S, C, E> transition;
    private final StateCopier<S> copier;
    private final ContractValidator validator;
    private final AbsentStatePolicy absentStatePolicy;
    private final TransitionObservabilitySink observabilitySink;
    private final WallClock clock;
    private final String name;

    private S currentState;

    /**
     * Creates a manager with {@link StateManagerConfig#defaults()} and the
     * identity copier.
     *
     * @param transition   the transition function
     * @param initialState the initial state, or {@code null} to start absent
     * @throws ConfigurationException if {@code transition} is {@code null}
     */
    public StateManager(StateTransition<S, C, E> transition, S initialState) {
        this(transition, initialState, StateCopier.immutable(), StateManagerConfig.defaults());
    }

    /**
     * Creates a manager for an immutable state type.
     *
     * @see #StateManager(StateTransition, State, StateCopier, StateManagerConfig)
     */
    public StateManager(StateTransition<S, C, E> transition, S initialState, StateManagerConfig config) {
        this(transition, initialState, StateCopier.immutable(), config);
    }

    /**
     * Creates a manager.
     *
     * <p>The initial state is copied, so the caller's instance never becomes the
     * committed state.</p>
     *
     * @param transition   the transition function
     * @param initialState the initial state, or {@code null} to start absent
     * @param copier       copy strategy for {@code S}
     * @param config       manager configuration
     * @throws ConfigurationException if {@code transition}, {@code copier} or
     *         {@code config} is {@code null}, if {@code initialState} is not of the
     *         configured state type, or if the copier cannot copy it
     */
    public StateManager(StateTransition<S, C, E> transition,
                        S initialState,
                        StateCopier<S> copier,
                        StateManagerConfig config)
    {
        if (transition == null) {
            throw new ConfigurationException("Transition function must not be null");
        }
        if (copier == null) {
            throw new ConfigurationException("State copier must not be null");
        }
        if (config == null) {
            throw new ConfigurationException("Configuration must not be null");
        }

        this.validator = new ContractValidator(config);
        if (!validator.isValidState(initialState)) {
            throw new ConfigurationException("Initial state " + initialState.getClass().getName()
                + " is not a " + config.stateType().getName());
        }

        S seeded = null;
        if (initialState != null) {
            seeded = copier.copy(initialState);
            if (seeded == null) {
                throw new ConfigurationException("State copier returned null for the initial state");
            }
        }

        this.transition = transition;
        this.copier = copier;
        this.absentStatePolicy = config.absentStatePolicy();
        this.observabilitySink = config.observabilitySink();
        this.clock = config.clock();
        this.name = config.name();
        this.currentState = seeded;
    }

    /**
     * Applies one change and commits the result.
     *
     * @param change the change to apply
     * @return the events produced by the transition, in production order
     * @throws ContractViolationException if the change is not a valid change,
     *         or if the transition function breaks the iteration contract
     */
    public List<E> dispatch(C change) {
        try {
            return apply(change);
        } catch (ContractViolationException e) {
            observabilitySink.onContractViolation(
                new ContractViolationEvent(clock.now(), name, change, e));
            throw e;
        }
    }

    /**
     * Dispatches each change in order and returns the concatenated events.
     *
     * <p>Each change is committed individually, exactly as if
     * {@link #dispatch(StateChange)} had been called in sequence. If a change
     * fails, the changes before it stay committed and the failure
     * propagates.</p>
     *
     * @param changes the changes to apply
     * @return all events, in order
     */
    public List<E> dispatchAll(List<? extends C> changes) {
        Objects.requireNonNull(changes, "changes");

        List<E> all = new ArrayList<>();
        for (C change : changes) {
            all.addAll(dispatch(change));
        }
        return Collections.unmodifiableList(all);
    }

    /**
     * Returns a copy of the current state, empty if the manager holds none.
     * The returned value never aliases the committed state.
     */
    public Optional<S> currentState() {
        return Optional.ofNullable(snapshot(currentState));
    }

    public boolean hasState() {
        return currentState != null;
    }

    public String name() {
        return name;
    }

    // ---------------------------------------------------------------------
    // Dispatch internals
    // ---------------------------------------------------------------------

    private List<E> apply(C change) {
        validator.checkChange(change);

        final S before = currentState;
        if (before == null && absentStatePolicy == AbsentStatePolicy.REJECT) {
            throw new ContractViolationException("Manager '" + name + "' holds no state");
        }

        S working = snapshot(before);

        Iteration<S, E> iteration = transition.apply(working, change);
        validator.checkIteration(iteration);

        S next = iteration.newState();
        List<E> events = iteration.events();

        // A throwing sink aborts the dispatch before anything is committed.
        // The sink only ever sees copies.
        observabilitySink.onStateTransition(new StateTransitionEvent(
            clock.now(),
            name,
            snapshot(before),
            snapshot(next),
            change,
            events
        ));

        currentState = next;
        return events;
    }

    private S snapshot(S state) {
        if (state == null) {
            return null;
        }
        S copy = copier.copy(state);
        validator.checkCopy(state, copy);
        return copy;
    }
}

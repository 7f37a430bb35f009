package com.questrail.transition.replay;

import com.questrail.transition.api.Event;
import com.questrail.transition.api.State;
import com.questrail.transition.api.StateChange;
import com.questrail.transition.api.StateTransition;
import com.questrail.transition.config.StateManagerConfig;
import com.questrail.transition.core.StateCopier;
import com.questrail.transition.core.StateManager;

import java.util.List;
import java.util.Objects;

/**
 * Replayer
 * -----------------------------------------------------------------------------
 * Rebuilds state from a recorded history of changes.
 *
 * Each replay runs on a freshly constructed {@link StateManager}, so two
 * replays of the same history against the same initial state end in equal
 * states with equal event sequences. The manager copies the initial state
 * with the supplied copier, so the caller's instance is never touched; a
 * mutable state type therefore needs its deep copier here as well.
 */
public final class Replayer
{
    private Replayer() {}

    public static <S extends State, C extends StateChange, E extends Event> ReplayResult<S, E> replay(
            StateTransition<S, C, E> transition,
            S initialState,
            StateCopier<S> copier,
            List<? extends C> changes,
            StateManagerConfig config)
    {
        Objects.requireNonNull(changes, "changes");

        StateManager<S, C, E> manager = new StateManager<>(transition, initialState, copier, config);
        List<E> events = manager.dispatchAll(changes);
        return new ReplayResult<>(manager.currentState(), events);
    }

    /**
     * Replays a history of an immutable state type.
     */
    public static <S extends State, C extends StateChange, E extends Event> ReplayResult<S, E> replay(
            StateTransition<S, C, E> transition,
            S initialState,
            List<? extends C> changes,
            StateManagerConfig config)
    {
        return replay(transition, initialState, StateCopier.immutable(), changes, config);
    }

    public static <S extends State, C extends StateChange, E extends Event> ReplayResult<S, E> replay(
            StateTransition<S, C, E> transition,
            S initialState,
            StateCopier<S> copier,
            ChangeJournal<? extends C> journal,
            StateManagerConfig config)
    {
        Objects.requireNonNull(journal, "journal");
        return replay(transition, initialState, copier, journal.entries(), config);
    }

    /**
     * Replays a journal of an immutable state type with default configuration.
     */
    public static <S extends State, C extends StateChange, E extends Event> ReplayResult<S, E> replay(
            StateTransition<S, C, E> transition,
            S initialState,
            ChangeJournal<? extends C> journal)
    {
        return replay(transition, initialState, StateCopier.immutable(), journal, StateManagerConfig.defaults());
    }
}

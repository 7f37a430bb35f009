package com.questrail.transition.replay;

import com.questrail.transition.api.Event;
import com.questrail.transition.api.State;
import com.questrail.transition.api.StateChange;
import com.questrail.transition.core.StateManager;

import java.util.List;
import java.util.Objects;

/**
 * Dispatches through a {@link StateManager} and records each change in a
 * {@link ChangeJournal} once its dispatch has committed.
 *
 * <p>A failed dispatch leaves the journal untouched, so the journal always
 * describes exactly the committed history.</p>
 */
public final class JournalingDispatcher<S extends State, C extends StateChange, E extends Event>
{
    private final StateManager<S, C, E> manager;
    private final ChangeJournal<C> journal;

    public JournalingDispatcher(StateManager<S, C, E> manager, ChangeJournal<C> journal) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    public List<E> dispatch(C change) {
        List<E> events = manager.dispatch(change);
        journal.append(change);
        return events;
    }

    public StateManager<S, C, E> manager() {
        return manager;
    }

    public ChangeJournal<C> journal() {
        return journal;
    }
}

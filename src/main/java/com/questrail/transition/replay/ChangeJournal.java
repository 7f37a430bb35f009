package com.questrail.transition.replay;

import com.questrail.transition.api.StateChange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ChangeJournal
 * -----------------------------------------------------------------------------
 * Append-only, ordered record of committed state changes.
 *
 * Replaying the entries of a journal against the initial state it was
 * started from reproduces the final state and the full event history.
 * The journal is in-memory; persisting it is left to the caller.
 */
public final class ChangeJournal<C extends StateChange>
{
    private final List<C> entries = new ArrayList<>();

    public synchronized void append(C change) {
        entries.add(Objects.requireNonNull(change, "change"));
    }

    /**
     * Returns an immutable snapshot of the entries, oldest first.
     */
    public synchronized List<C> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public synchronized int size() {
        return entries.size();
    }
}

package com.questrail.transition.core;

import com.questrail.transition.api.State;

/**
 * StateCopier
 * -----------------------------------------------------------------------------
 * Produces a copy of a state that shares no mutable reference with the
 * original.
 *
 * <p>Immutable states (records whose components are themselves immutable)
 * need no copying at all; {@link #immutable()} returns them as-is. Domains
 * that hold mutable data inside their states pass a deep copier to the
 * {@link StateManager} constructor.</p>
 *
 * @param <S> the state type
 */
@FunctionalInterface
public interface StateCopier<S extends State>
{
    /**
     * Returns an independent copy of {@code state}.
     *
     * @param state a non-null state
     * @return the copy (never {@code null})
     */
    S copy(S state);

    /**
     * Identity copier for immutable state types.
     */
    static <S extends State> StateCopier<S> immutable() {
        return state -> state;
    }
}

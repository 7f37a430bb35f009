package com.questrail.transition.api;

/**
 * StateChange
 * -----------------------------------------------------------------------------
 * Marker interface for an immutable record of one external occurrence
 * (an incoming message, a detected ledger event, a timeout firing).
 *
 * <p>State changes are the <em>only</em> way information enters the engine.
 * Applying the same change to the same state must always yield an equal
 * {@link Iteration}: a change carries every input its transition needs, so
 * the transition never consults wall-clock time, randomness or I/O.</p>
 */
public interface StateChange
{
}

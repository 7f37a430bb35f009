package com.questrail.transition.api;

/**
 * State
 * -----------------------------------------------------------------------------
 * Marker interface for application state held by a
 * {@link com.questrail.transition.core.StateManager}.
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>States are pure data (no behavior)</li>
 *   <li>States are never mutated in place once committed</li>
 *   <li>A state never shares a mutable reference with another live state;
 *       nested sub-states are referenced by identifier or value</li>
 * </ul>
 *
 * Domains are expected to declare a {@code sealed} sub-interface with
 * {@code record} variants so that transition functions can handle every
 * variant explicitly.
 */
public interface State
{
}

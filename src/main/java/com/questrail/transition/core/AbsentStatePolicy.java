package com.questrail.transition.core;

/**
 * How a {@link StateManager} treats dispatch while it holds no state.
 */
public enum AbsentStatePolicy
{
    /** Invoke the transition function with a {@code null} state; it may re-seed. */
    PASS_THROUGH,

    /** Absent is terminal: dispatch fails before the transition function runs. */
    REJECT
}

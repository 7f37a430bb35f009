package com.questrail.transition.api;

/**
 * StateTransition
 * -----------------------------------------------------------------------------
 * The transition function registered with a
 * {@link com.questrail.transition.core.StateManager}.
 *
 * <h2>Contract</h2>
 * Implementations must be:
 * <ul>
 *   <li>Pure (no I/O, no timers, no randomness)</li>
 *   <li>Total over every change variant the domain declares reachable</li>
 *   <li>Non-retaining: the {@code state} argument is a private copy that must
 *       not be stored or shared with the returned state</li>
 * </ul>
 *
 * Unrecognized or no-op changes return {@link Iteration#unchanged(State)}
 * rather than throwing.
 *
 * @param <S> the domain state type
 * @param <C> the domain change type
 * @param <E> the domain event type
 */
@FunctionalInterface
public interface StateTransition<S extends State, C extends StateChange, E extends Event>
{
    /**
     * Computes the next iteration for a single change.
     *
     * @param state  private copy of the current state, or {@code null} when the
     *               manager holds no state
     * @param change the change to apply (never {@code null})
     * @return the next state and the ordered events (never {@code null})
     */
    Iteration<S, E> apply(S state, C change);
}

package com.questrail.transition.observability;

/**
 * Main interface for receiving state manager observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks observe; they must not mutate the states they are handed.</p>
 */
public interface TransitionObservabilitySink {
    /**
     * Called once a dispatch has passed every contract check, immediately
     * before its result is committed. Throwing from here aborts the dispatch.
     * @param event the transition details
     */
    void onStateTransition(StateTransitionEvent event);

    /**
     * Called when a dispatch is aborted by a contract violation, just before the
     * violation is rethrown to the caller.
     * @param event the violation details
     */
    void onContractViolation(ContractViolationEvent event);

    /**
     * Called when a collaborator around the manager (e.g. an event handler)
     * fails.
     * @param event the error details
     */
    void onError(DispatchErrorEvent event);
}

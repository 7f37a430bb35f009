package com.questrail.transition.observability;

/**
 * No-op implementation of TransitionObservabilitySink.
 */
public final class NullObservabilitySink implements TransitionObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(StateTransitionEvent event) {}

    @Override
    public void onContractViolation(ContractViolationEvent event) {}

    @Override
    public void onError(DispatchErrorEvent event) {}
}

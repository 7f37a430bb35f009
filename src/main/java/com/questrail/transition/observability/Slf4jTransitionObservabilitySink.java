package com.questrail.transition.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TransitionObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jTransitionObservabilitySink implements TransitionObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTransitionObservabilitySink.class);

    @Override
    public void onStateTransition(StateTransitionEvent event) {
        if (event.isPresenceChange()) {
            log.info("[{}] State {} -> {}",
                event.managerName(),
                event.oldState() == null ? "ABSENT" : "PRESENT",
                event.newState() == null ? "ABSENT" : "PRESENT");
        }

        if (log.isDebugEnabled()) {
            log.debug("[{}] Applied {} (state changed: {}, events: {})",
                event.managerName(),
                event.triggeringChange().getClass().getSimpleName(),
                event.isStateChanged(),
                event.resultingEvents().size());
        }
    }

    @Override
    public void onContractViolation(ContractViolationEvent event) {
        log.error("[{}] Contract violation while dispatching {}: {}",
            event.managerName(),
            event.offendingChange(),
            event.violation().getMessage(),
            event.violation());
    }

    @Override
    public void onError(DispatchErrorEvent event) {
        log.error("[{}] {}", event.managerName(), event.message(), event.cause());
    }
}

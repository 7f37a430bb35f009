package com.questrail.transition.observability;

import com.questrail.transition.api.ContractViolationException;

import java.time.Instant;

/**
 * Record representing an aborted dispatch.
 *
 * @param offendingChange the change being dispatched, possibly {@code null}
 */
public record ContractViolationEvent(
    Instant timestamp,
    String managerName,
    Object offendingChange,
    ContractViolationException violation
) {
}

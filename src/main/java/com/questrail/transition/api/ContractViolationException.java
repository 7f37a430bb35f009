package com.questrail.transition.api;

/**
 * Indicates that a caller or a registered transition function broke the
 * dispatch contract.
 *
 * This typically reflects:
 * <ul>
 *   <li>A change that is {@code null} or not of the declared change type</li>
 *   <li>A transition function returning {@code null}, a wrongly-typed next
 *       state, or a {@code null} / wrongly-typed event</li>
 *   <li>Dispatch against an absent state when the manager rejects it</li>
 * </ul>
 *
 * This is a programmer error, not a recoverable runtime condition. The manager
 * never commits the offending transition and never suppresses this exception.
 */
public final class ContractViolationException extends RuntimeException
{
    public ContractViolationException(String message) {
        super(message);
    }

    public ContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}

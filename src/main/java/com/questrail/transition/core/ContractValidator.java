package com.questrail.transition.core;

import com.questrail.transition.api.ContractViolationException;
import com.questrail.transition.api.Event;
import com.questrail.transition.api.Iteration;
import com.questrail.transition.api.State;
import com.questrail.transition.api.StateChange;
import com.questrail.transition.config.StateManagerConfig;

import java.util.List;

/**
 * Runtime half of the dispatch contract.
 *
 * <p>Generics make most violations impossible to express, but erasure still
 * lets raw types and unchecked casts through, so the manager re-checks every
 * value that crosses the boundary.</p>
 */
final class ContractValidator
{
    private final Class<? extends State> stateType;
    private final Class<? extends StateChange> changeType;
    private final Class<? extends Event> eventType;

    ContractValidator(StateManagerConfig config) {
        this.stateType = config.stateType();
        this.changeType = config.changeType();
        this.eventType = config.eventType();
    }

    boolean isValidState(Object state) {
        return state == null || stateType.isInstance(state);
    }

    void checkChange(Object change) {
        if (change == null) {
            throw new ContractViolationException("State change must not be null");
        }
        if (!changeType.isInstance(change)) {
            throw new ContractViolationException("Expected a " + changeType.getName()
                + " but got " + change.getClass().getName());
        }
    }

    void checkIteration(Object iteration) {
        if (iteration == null) {
            throw new ContractViolationException("Transition function returned null");
        }
        if (!(iteration instanceof Iteration<?, ?> it)) {
            throw new ContractViolationException("Transition function returned "
                + iteration.getClass().getName() + " instead of an Iteration");
        }

        Object next = it.newState();
        if (!isValidState(next)) {
            throw new ContractViolationException("Next state " + next.getClass().getName()
                + " is not a " + stateType.getName());
        }

        List<?> events = it.events();
        for (int i = 0; i < events.size(); i++) {
            Object e = events.get(i);
            if (e == null) {
                throw new ContractViolationException("Event at index " + i + " is null");
            }
            if (!eventType.isInstance(e)) {
                throw new ContractViolationException("Event at index " + i + " ("
                    + e.getClass().getName() + ") is not a " + eventType.getName());
            }
        }
    }

    void checkCopy(Object original, Object copy) {
        if (original != null && copy == null) {
            throw new ContractViolationException("State copier returned null");
        }
    }
}

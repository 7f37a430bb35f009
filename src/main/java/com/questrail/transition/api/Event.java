package com.questrail.transition.api;

/**
 * Marker interface for an externally observable consequence of a transition.
 *
 * <p>The engine is oblivious to event semantics. It guarantees only that the
 * events of one dispatch are delivered in full and in the order the
 * transition function produced them. Domain-level rejections are events too.</p>
 */
public interface Event
{
}

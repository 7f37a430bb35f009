package com.questrail.transition.api;

/**
 * Indicates that a state manager could not be constructed from the supplied
 * transition function, initial state or configuration.
 *
 * Raised eagerly at construction; a manager that fails this way is never
 * usable.
 */
public final class ConfigurationException extends RuntimeException
{
    public ConfigurationException(String message) {
        super(message);
    }
}

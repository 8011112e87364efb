package com.tyron.keystone.api.error;

/**
 * Thrown when a service or component cannot be instantiated: every constructor was exhausted,
 * the chosen constructor threw, or a lifecycle hook failed.
 */
public class InstanceCreationException extends KeystoneException {

    private final Class<?> type;

    public InstanceCreationException(Class<?> type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public InstanceCreationException(Class<?> type, String message) {
        this(type, message, null);
    }

    public Class<?> getType() {
        return type;
    }
}

package com.tyron.keystone.api.error;

/**
 * Base class of every failure raised by the registry and the service container.
 */
public class KeystoneException extends RuntimeException {

    public KeystoneException(String message) {
        super(message);
    }

    public KeystoneException(String message, Throwable cause) {
        super(message, cause);
    }
}

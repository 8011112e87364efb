package com.tyron.keystone.api.error;

/**
 * Thrown when a type is resolved that has no registration, no factory and no discoverable
 * implementation.
 */
public class UnregisteredServiceException extends KeystoneException {

    private final Class<?> serviceType;

    public UnregisteredServiceException(Class<?> serviceType) {
        super("Service of type " + serviceType.getName() + " is not registered and could not be discovered");
        this.serviceType = serviceType;
    }

    public Class<?> getServiceType() {
        return serviceType;
    }
}

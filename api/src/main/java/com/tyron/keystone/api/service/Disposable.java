package com.tyron.keystone.api.service;

/**
 * Implemented by components and services that hold resources.
 * <p>
 * Containers call {@link #dispose()} once during teardown, in reverse initialization order.
 */
public interface Disposable {

    void dispose();
}

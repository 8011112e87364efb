package com.tyron.keystone.api.container;

/**
 * Instance reuse policy of a container registration.
 */
public enum Lifetime {

    /**
     * Created once, reused for the rest of the container's life.
     */
    SINGLETON,

    /**
     * A new instance for every resolution.
     */
    TRANSIENT,

    /**
     * Every resolution delegates to a caller-supplied {@link ServiceFactory}.
     */
    FACTORY,

    /**
     * Reused until the resolution cache entry expires, then rebuilt.
     */
    CACHED
}

package com.tyron.keystone.core.service;

import com.tyron.keystone.core.config.KeystoneConfig;

import java.time.Clock;

/**
 * Context passed to a {@link DefaultServiceContainer}: the configuration it runs under and the
 * clock used for cache expiry.
 */
public final class ServiceContext {

    private final KeystoneConfig config;
    private final Clock clock;

    private ServiceContext(KeystoneConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public static ServiceContext of(KeystoneConfig config, Clock clock) {
        if (config == null) throw new IllegalArgumentException("config == null");
        if (clock == null) throw new IllegalArgumentException("clock == null");
        return new ServiceContext(config, clock);
    }

    public static ServiceContext of(KeystoneConfig config) {
        return of(config, Clock.systemUTC());
    }

    /**
     * Default configuration on the system clock.
     */
    public static ServiceContext defaults() {
        return of(KeystoneConfig.defaults());
    }

    public KeystoneConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }
}

package com.tyron.keystone.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable runtime configuration.
 * <p>
 * Built programmatically via {@link #builder()}, from one of the presets, or loaded from YAML by
 * {@link KeystoneConfigLoader}.
 */
public final class KeystoneConfig {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    private final boolean strictInitialization;
    private final boolean validateBeforeInitialization;
    private final boolean cacheEnabled;
    private final Duration cacheTtl;
    private final boolean discoveryEnabled;
    private final boolean verboseLogging;

    private KeystoneConfig(Builder builder) {
        this.strictInitialization = builder.strictInitialization;
        this.validateBeforeInitialization = builder.validateBeforeInitialization;
        this.cacheEnabled = builder.cacheEnabled;
        this.cacheTtl = builder.cacheTtl;
        this.discoveryEnabled = builder.discoveryEnabled;
        this.verboseLogging = builder.verboseLogging;
    }

    public static KeystoneConfig defaults() {
        return builder().build();
    }

    /**
     * Verbose logging, strict initialization.
     */
    public static KeystoneConfig development() {
        return builder().verboseLogging(true).strictInitialization(true).build();
    }

    /**
     * Quiet logging; a failing component is skipped instead of aborting startup.
     */
    public static KeystoneConfig production() {
        return builder().verboseLogging(false).strictInitialization(false).build();
    }

    /**
     * Strict initialization with the resolution cache disabled, so every test observes fresh
     * construction.
     */
    public static KeystoneConfig testing() {
        return builder().strictInitialization(true).cacheEnabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .strictInitialization(strictInitialization)
                .validateBeforeInitialization(validateBeforeInitialization)
                .cacheEnabled(cacheEnabled)
                .cacheTtl(cacheTtl)
                .discoveryEnabled(discoveryEnabled)
                .verboseLogging(verboseLogging);
    }

    public boolean isStrictInitialization() {
        return strictInitialization;
    }

    public boolean isValidateBeforeInitialization() {
        return validateBeforeInitialization;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public boolean isDiscoveryEnabled() {
        return discoveryEnabled;
    }

    public boolean isVerboseLogging() {
        return verboseLogging;
    }

    @Override
    public String toString() {
        return "KeystoneConfig{strict=" + strictInitialization
                + ", validateFirst=" + validateBeforeInitialization
                + ", cache=" + cacheEnabled + "/" + cacheTtl.toSeconds() + "s"
                + ", discovery=" + discoveryEnabled
                + ", verbose=" + verboseLogging + "}";
    }

    public static final class Builder {
        private boolean strictInitialization = true;
        private boolean validateBeforeInitialization = true;
        private boolean cacheEnabled = true;
        private Duration cacheTtl = DEFAULT_CACHE_TTL;
        private boolean discoveryEnabled = true;
        private boolean verboseLogging;

        private Builder() {
        }

        public Builder strictInitialization(boolean strict) {
            this.strictInitialization = strict;
            return this;
        }

        public Builder validateBeforeInitialization(boolean validate) {
            this.validateBeforeInitialization = validate;
            return this;
        }

        public Builder cacheEnabled(boolean enabled) {
            this.cacheEnabled = enabled;
            return this;
        }

        public Builder cacheTtl(Duration ttl) {
            Objects.requireNonNull(ttl, "ttl");
            if (ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("cache ttl must be positive: " + ttl);
            }
            this.cacheTtl = ttl;
            return this;
        }

        public Builder discoveryEnabled(boolean enabled) {
            this.discoveryEnabled = enabled;
            return this;
        }

        public Builder verboseLogging(boolean verbose) {
            this.verboseLogging = verbose;
            return this;
        }

        public KeystoneConfig build() {
            return new KeystoneConfig(this);
        }
    }
}

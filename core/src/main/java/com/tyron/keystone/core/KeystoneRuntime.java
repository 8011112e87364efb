package com.tyron.keystone.core;

import com.tyron.keystone.api.component.ComponentRegistry;
import com.tyron.keystone.api.component.InitializationReport;
import com.tyron.keystone.api.component.ValidationResult;
import com.tyron.keystone.api.container.ServiceContainer;
import com.tyron.keystone.core.config.KeystoneConfig;
import com.tyron.keystone.core.config.KeystoneConfigLoader;
import com.tyron.keystone.core.discovery.ImplementationCatalog;
import com.tyron.keystone.core.registry.DefaultComponentRegistry;
import com.tyron.keystone.core.service.DefaultServiceContainer;
import com.tyron.keystone.core.service.ServiceContext;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The application runtime: one service container and one component registry wired together.
 * <p>
 * Create it once at startup and hand it to whoever needs it. The runtime, its registry and its
 * container are registered in the container as singletons, so components can take any of them
 * as constructor parameters.
 * <pre>
 * try (KeystoneRuntime runtime = KeystoneRuntime.create()) {
 *     runtime.getRegistry().register(EventManager.class, 100);
 *     runtime.start();
 *     ...
 * }
 * </pre>
 */
public final class KeystoneRuntime implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(KeystoneRuntime.class.getName());

    static final String ROOT_LOGGER = "com.tyron.keystone";

    // Strong reference, otherwise the configured level is lost when the logger is collected.
    private static final Logger ROOT = Logger.getLogger(ROOT_LOGGER);

    private final KeystoneConfig config;
    private final DefaultServiceContainer container;
    private final DefaultComponentRegistry registry;

    private KeystoneRuntime(KeystoneConfig config, Clock clock, ImplementationCatalog catalog) {
        this.config = config;
        if (config.isVerboseLogging()) {
            ROOT.setLevel(Level.FINE);
        }

        this.container = new DefaultServiceContainer(ServiceContext.of(config, clock), catalog);
        this.registry = new DefaultComponentRegistry(container, config, clock);

        container.registerSingleton(KeystoneRuntime.class, this);
        container.registerSingleton(ServiceContainer.class, container);
        container.registerSingleton(ComponentRegistry.class, registry);
    }

    /**
     * Runtime configured from the {@code keystone.yaml} classpath resource, or defaults.
     */
    public static KeystoneRuntime create() {
        return create(KeystoneConfigLoader.loadDefault());
    }

    public static KeystoneRuntime create(KeystoneConfig config) {
        return create(config, Clock.systemUTC());
    }

    public static KeystoneRuntime create(KeystoneConfig config, Clock clock) {
        return create(config, clock, ImplementationCatalog.fromServiceFiles(defaultClassLoader()));
    }

    public static KeystoneRuntime create(KeystoneConfig config, Clock clock, ImplementationCatalog catalog) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(catalog, "catalog");
        return new KeystoneRuntime(config, clock, catalog);
    }

    public KeystoneConfig getConfig() {
        return config;
    }

    public ServiceContainer getContainer() {
        return container;
    }

    public ComponentRegistry getRegistry() {
        return registry;
    }

    /**
     * Validates the registered components, logging the outcome, and initializes them.
     */
    public InitializationReport start() {
        ValidationResult validation = registry.validateDependencies();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(validation.getSummary());
        }
        InitializationReport report = registry.initializeAll();
        LOG.info("Keystone started: " + container.getStatistics().report());
        return report;
    }

    public <T> T resolve(Class<T> type) {
        return container.resolve(type);
    }

    /**
     * Disposes the components, then every remaining container singleton.
     */
    @Override
    public void close() {
        registry.dispose();
        container.disposeAll();
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        return loader != null ? loader : KeystoneRuntime.class.getClassLoader();
    }
}

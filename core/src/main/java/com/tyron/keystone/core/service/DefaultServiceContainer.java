package com.tyron.keystone.core.service;

import com.tyron.keystone.api.container.ContainerStatistics;
import com.tyron.keystone.api.container.Instantiator;
import com.tyron.keystone.api.container.Lifetime;
import com.tyron.keystone.api.container.Resolution;
import com.tyron.keystone.api.container.ServiceContainer;
import com.tyron.keystone.api.container.ServiceFactory;
import com.tyron.keystone.api.error.CircularDependencyException;
import com.tyron.keystone.api.error.InstanceCreationException;
import com.tyron.keystone.api.error.KeystoneException;
import com.tyron.keystone.api.error.UnregisteredServiceException;
import com.tyron.keystone.api.service.Disposable;
import com.tyron.keystone.core.cache.ResolutionCache;
import com.tyron.keystone.core.discovery.ImplementationCatalog;
import com.tyron.keystone.core.discovery.ImplementationDiscovery;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link ServiceContainer} implementation.
 * <p>
 * - Constructor injection with most-dependencies-first fallback
 * - Cycle detection through a per-thread resolution stack
 * - Time-bounded reuse of {@link Lifetime#CACHED} services
 * - Best-effort discovery for unregistered types
 * <p>
 * Every public operation holds a single reentrant lock, so factories and constructors may
 * resolve from the same container while it is building.
 */
public class DefaultServiceContainer implements ServiceContainer {

    private static final Logger LOG = Logger.getLogger(DefaultServiceContainer.class.getName());

    private final ServiceContext context;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<Class<?>, ServiceEntry> entries = new LinkedHashMap<>();
    // Insertion order is creation order, disposal walks it backwards.
    private final Map<Class<?>, Object> singletons = new LinkedHashMap<>();

    private final ResolutionCache cache;
    private final @Nullable ImplementationDiscovery discovery;
    private final ConstructorPlans constructorPlans = new ConstructorPlans();

    private final ThreadLocal<Deque<Class<?>>> resolutionStack = ThreadLocal.withInitial(ArrayDeque::new);

    private long nextSequence;
    private long totalResolutions;
    private long successfulResolutions;
    private long failedResolutions;
    private final Map<Class<?>, Integer> resolutionCounts = new LinkedHashMap<>();

    public DefaultServiceContainer(ServiceContext context) {
        this(context, ImplementationCatalog.fromServiceFiles(defaultClassLoader()));
    }

    public DefaultServiceContainer(ServiceContext context, ImplementationCatalog catalog) {
        if (context == null) throw new IllegalArgumentException("context == null");
        this.context = context;
        this.cache = new ResolutionCache(context.getClock(), context.getConfig().getCacheTtl(),
                context.getConfig().isCacheEnabled());
        this.discovery = context.getConfig().isDiscoveryEnabled() ? new ImplementationDiscovery(catalog) : null;
    }

    public ServiceContext getContext() {
        return context;
    }

    public ResolutionCache getCache() {
        return cache;
    }

    // --- Registration ---

    @Override
    public <T> void register(Class<T> serviceType,
                             Class<? extends T> implementationType,
                             Lifetime lifetime,
                             @Nullable T instance,
                             @Nullable ServiceFactory<? extends T> factory) {
        Objects.requireNonNull(serviceType, "serviceType");
        Objects.requireNonNull(implementationType, "implementationType");
        Objects.requireNonNull(lifetime, "lifetime");
        if (!serviceType.isAssignableFrom(implementationType)) {
            throw new IllegalArgumentException(implementationType.getName() + " does not implement " + serviceType.getName());
        }
        if (lifetime == Lifetime.FACTORY && factory == null) {
            throw new IllegalArgumentException("A factory is required for " + serviceType.getName());
        }
        if (lifetime != Lifetime.FACTORY && factory != null) {
            throw new IllegalArgumentException("Factories require Lifetime.FACTORY, got " + lifetime);
        }
        if (instance != null && lifetime != Lifetime.SINGLETON) {
            throw new IllegalArgumentException("Pre-built instances require Lifetime.SINGLETON, got " + lifetime);
        }

        lock.lock();
        try {
            putEntry(serviceType, implementationType, lifetime, factory, null);
            if (instance != null) {
                singletons.put(serviceType, instance);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> void registerSingleton(Class<T> serviceType, T instance) {
        Objects.requireNonNull(instance, "instance");
        @SuppressWarnings("unchecked")
        Class<? extends T> implementationType = (Class<? extends T>) instance.getClass();
        register(serviceType, implementationType, Lifetime.SINGLETON, instance, null);
    }

    @Override
    public <T> void registerFactory(Class<T> serviceType, ServiceFactory<? extends T> factory) {
        register(serviceType, serviceType, Lifetime.FACTORY, null, factory);
    }

    @Override
    public <T> void registerConstructor(Class<T> serviceType,
                                        Lifetime lifetime,
                                        List<Class<?>> dependencies,
                                        Instantiator<? extends T> instantiator) {
        Objects.requireNonNull(serviceType, "serviceType");
        Objects.requireNonNull(dependencies, "dependencies");
        Objects.requireNonNull(instantiator, "instantiator");
        if (lifetime == Lifetime.FACTORY) {
            throw new IllegalArgumentException("Use registerFactory for Lifetime.FACTORY");
        }

        List<ConstructorPlan> plans = List.of(ConstructorPlan.declared(serviceType, dependencies, instantiator));
        lock.lock();
        try {
            putEntry(serviceType, serviceType, lifetime, null, plans);
        } finally {
            lock.unlock();
        }
    }

    private void putEntry(Class<?> serviceType,
                          Class<?> implementationType,
                          Lifetime lifetime,
                          @Nullable ServiceFactory<?> factory,
                          @Nullable List<ConstructorPlan> plans) {
        if (singletons.containsKey(serviceType)) {
            throw new IllegalStateException("Cannot register " + serviceType.getName() + " because it is already instantiated.");
        }
        ServiceEntry previous = entries.remove(serviceType);
        if (previous != null) {
            LOG.warning("Replacing registration of " + serviceType.getName()
                    + " (" + previous.lifetime() + " -> " + lifetime + ")");
            cache.invalidate(serviceType);
        }
        entries.put(serviceType, new ServiceEntry(serviceType, implementationType, lifetime, factory, plans, nextSequence++));
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Registered " + serviceType.getName() + " -> " + implementationType.getName() + " as " + lifetime);
        }
    }

    @Override
    public boolean unregister(Class<?> serviceType) {
        lock.lock();
        try {
            ServiceEntry removed = entries.remove(serviceType);
            singletons.remove(serviceType);
            cache.invalidate(serviceType);
            if (removed != null) {
                constructorPlans.forget(removed.implementationType());
            }
            return removed != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean evict(Class<?> serviceType) {
        lock.lock();
        try {
            boolean dropped = singletons.remove(serviceType) != null;
            dropped |= cache.invalidate(serviceType);
            if (dropped && LOG.isLoggable(Level.FINE)) {
                LOG.fine("Evicted instance of " + serviceType.getName());
            }
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    // --- Resolution ---

    @Override
    public <T> Resolution<T> resolveResult(Class<T> serviceType) {
        Objects.requireNonNull(serviceType, "serviceType");
        lock.lock();
        try {
            totalResolutions++;
            resolutionCounts.merge(serviceType, 1, Integer::sum);
            Object instance = resolveInternal(serviceType);
            successfulResolutions++;
            return Resolution.success(serviceType.cast(instance));
        } catch (KeystoneException e) {
            failedResolutions++;
            if (LOG.isLoggable(Level.FINE)) {
                LOG.log(Level.FINE, "Failed to resolve " + serviceType.getName(), e);
            }
            return Resolution.failure(e);
        } finally {
            if (resolutionStack.get().isEmpty()) {
                resolutionStack.remove();
            }
            lock.unlock();
        }
    }

    @Override
    public <T> List<T> resolveAll(Class<T> serviceType) {
        Objects.requireNonNull(serviceType, "serviceType");
        lock.lock();
        try {
            List<T> result = new ArrayList<>();
            for (ServiceEntry entry : List.copyOf(entries.values())) {
                if (serviceType.isAssignableFrom(entry.implementationType())) {
                    result.add(serviceType.cast(resolve(entry.serviceType())));
                }
            }
            return Collections.unmodifiableList(result);
        } finally {
            lock.unlock();
        }
    }

    private Object resolveInternal(Class<?> type) {
        Deque<Class<?>> stack = resolutionStack.get();
        if (stack.contains(type)) {
            throw new CircularDependencyException(cycleOnStack(stack, type));
        }

        stack.addLast(type);
        try {
            Object singleton = singletons.get(type);
            if (singleton != null) {
                return singleton;
            }

            ServiceEntry entry = entries.get(type);
            if (entry != null && entry.lifetime() == Lifetime.CACHED) {
                Object cached = cache.tryGet(type);
                if (cached != null) {
                    return cached;
                }
            }

            if (entry != null && entry.isFactory()) {
                return invokeFactory(entry);
            }

            if (entry == null) {
                return discoverOrFail(type);
            }

            Object created = construct(entry);
            if (entry.lifetime() == Lifetime.SINGLETON) {
                singletons.put(type, created);
            } else if (entry.lifetime() == Lifetime.CACHED) {
                cache.put(type, created);
            }
            return created;
        } finally {
            stack.removeLast();
        }
    }

    private static List<Class<?>> cycleOnStack(Deque<Class<?>> stack, Class<?> type) {
        List<Class<?>> path = new ArrayList<>(stack);
        List<Class<?>> cycle = new ArrayList<>(path.subList(path.indexOf(type), path.size()));
        cycle.add(type);
        return cycle;
    }

    private Object invokeFactory(ServiceEntry entry) {
        Object created;
        try {
            created = entry.factory().create(this);
        } catch (KeystoneException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InstanceCreationException(entry.serviceType(),
                    "Factory for " + entry.serviceType().getName() + " threw an exception.", e);
        }
        if (created == null) {
            throw new InstanceCreationException(entry.serviceType(),
                    "Factory for " + entry.serviceType().getName() + " returned null.");
        }
        return created;
    }

    private Object discoverOrFail(Class<?> type) {
        if (discovery == null) {
            throw new UnregisteredServiceException(type);
        }
        Optional<Object> discovered = discovery.tryDiscover(type);
        if (discovered.isEmpty()) {
            throw new UnregisteredServiceException(type);
        }

        Object instance = discovered.get();
        entries.put(type, new ServiceEntry(type, instance.getClass(), Lifetime.SINGLETON, null, null, nextSequence++));
        singletons.put(type, instance);
        LOG.info("Discovered " + instance.getClass().getName() + " for unregistered " + type.getName());
        return instance;
    }

    private Object construct(ServiceEntry entry) {
        Class<?> implementation = entry.implementationType();
        List<ConstructorPlan> plans = entry.plans() != null
                ? entry.plans()
                : constructorPlans.plansFor(implementation);
        if (plans.isEmpty()) {
            throw new InstanceCreationException(implementation,
                    "Class " + implementation.getName() + " must be concrete and have a public constructor.");
        }

        List<String> rejected = new ArrayList<>();
        for (ConstructorPlan plan : plans) {
            Object[] arguments = new Object[plan.arity()];
            KeystoneException unresolved = null;
            for (int i = 0; i < arguments.length; i++) {
                try {
                    arguments[i] = resolveInternal(plan.dependencies().get(i));
                } catch (CircularDependencyException e) {
                    throw e;
                } catch (KeystoneException e) {
                    unresolved = e;
                    break;
                }
            }

            if (unresolved != null) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Skipping " + plan + ": " + unresolved.getMessage());
                }
                rejected.add(plan + ": " + unresolved.getMessage());
                continue;
            }
            return instantiate(implementation, plan, arguments);
        }

        throw new InstanceCreationException(implementation,
                "No constructor of " + implementation.getName() + " could be satisfied: " + String.join("; ", rejected));
    }

    private static Object instantiate(Class<?> implementation, ConstructorPlan plan, Object[] arguments) {
        Object created;
        try {
            created = plan.instantiator().newInstance(arguments);
        } catch (InvocationTargetException e) {
            throw new InstanceCreationException(implementation,
                    "Class " + implementation.getName() + " threw an exception during construction.", e.getCause());
        } catch (KeystoneException e) {
            throw e;
        } catch (Exception e) {
            throw new InstanceCreationException(implementation,
                    "Failed to instantiate " + implementation.getName() + " via " + plan, e);
        }
        if (created == null) {
            throw new InstanceCreationException(implementation, plan + " returned null.");
        }
        return created;
    }

    // --- Introspection ---

    @Override
    public boolean isRegistered(Class<?> serviceType) {
        lock.lock();
        try {
            return entries.containsKey(serviceType);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<Class<?>> getRegisteredServiceTypes() {
        lock.lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(entries.keySet()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getServiceCount() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getSingletonCount() {
        lock.lock();
        try {
            return singletons.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ContainerStatistics getStatistics() {
        lock.lock();
        try {
            Map<Lifetime, Integer> byLifetime = new LinkedHashMap<>();
            for (ServiceEntry entry : entries.values()) {
                byLifetime.merge(entry.lifetime(), 1, Integer::sum);
            }
            return new ContainerStatistics(
                    entries.size(),
                    byLifetime.getOrDefault(Lifetime.SINGLETON, 0),
                    byLifetime.getOrDefault(Lifetime.TRANSIENT, 0),
                    byLifetime.getOrDefault(Lifetime.FACTORY, 0),
                    byLifetime.getOrDefault(Lifetime.CACHED, 0),
                    totalResolutions,
                    successfulResolutions,
                    failedResolutions,
                    cache.getHits(),
                    cache.getMisses(),
                    resolutionCounts);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> verify() {
        lock.lock();
        try {
            List<String> problems = new ArrayList<>();
            for (ServiceEntry entry : entries.values()) {
                if (entry.isFactory() || singletons.containsKey(entry.serviceType())) {
                    continue;
                }
                List<ConstructorPlan> plans = entry.plans() != null
                        ? entry.plans()
                        : constructorPlans.plansFor(entry.implementationType());
                if (plans.isEmpty()) {
                    problems.add(entry.implementationType().getName() + " has no public constructor");
                    continue;
                }
                boolean satisfiable = plans.stream()
                        .anyMatch(plan -> entries.keySet().containsAll(plan.dependencies()));
                if (!satisfiable) {
                    problems.add(entry.serviceType().getName()
                            + " has no constructor whose dependencies are all registered (tried " + plans + ")");
                }
            }
            return problems;
        } finally {
            lock.unlock();
        }
    }

    // --- Cleanup ---

    @Override
    public void disposeAll() {
        lock.lock();
        try {
            List<Object> created = new ArrayList<>(singletons.values());
            ListIterator<Object> it = created.listIterator(created.size());
            while (it.hasPrevious()) {
                disposeIfDisposable(it.previous());
            }
            singletons.clear();
            entries.clear();
            cache.clear();
            if (discovery != null) {
                discovery.clear();
            }
            resolutionCounts.clear();
            totalResolutions = 0;
            successfulResolutions = 0;
            failedResolutions = 0;
        } finally {
            lock.unlock();
        }
    }

    private static void disposeIfDisposable(Object obj) {
        if (obj instanceof Disposable disposable) {
            try {
                disposable.dispose();
            } catch (Exception e) {
                LOG.log(Level.SEVERE, "Error disposing " + obj.getClass().getName(), e);
            }
        }
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        return loader != null ? loader : DefaultServiceContainer.class.getClassLoader();
    }
}

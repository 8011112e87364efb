package com.tyron.keystone.core.service;

import com.tyron.keystone.api.container.ContainerStatistics;
import com.tyron.keystone.api.container.Lifetime;
import com.tyron.keystone.api.container.Resolution;
import com.tyron.keystone.api.error.CircularDependencyException;
import com.tyron.keystone.api.error.InstanceCreationException;
import com.tyron.keystone.api.error.UnregisteredServiceException;
import com.tyron.keystone.api.service.Disposable;
import com.tyron.keystone.core.config.KeystoneConfig;
import com.tyron.keystone.core.discovery.ImplementationCatalog;
import com.tyron.keystone.testFramework.BaseKeystoneTest;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class DefaultServiceContainerTest extends BaseKeystoneTest {

    private DefaultServiceContainer container;

    @Override
    protected void beforeEach() {
        container = newContainer(KeystoneConfig.defaults(), ImplementationCatalog.empty());
    }

    private DefaultServiceContainer newContainer(KeystoneConfig config, ImplementationCatalog catalog) {
        return new DefaultServiceContainer(ServiceContext.of(config, clock), catalog);
    }

    // --- fixtures ---

    public static class Logger {
    }

    public static class Worker {
        final Logger logger;

        public Worker(Logger logger) {
            this.logger = logger;
        }
    }

    public interface Greeter {
        String greet();
    }

    public static class EnglishGreeter implements Greeter {
        @Override
        public String greet() {
            return "hello";
        }
    }

    public static class FrenchGreeter implements Greeter {
        @Override
        public String greet() {
            return "bonjour";
        }
    }

    public static class Unregistered {
    }

    public static class Flexible {
        final int constructor;

        public Flexible(Logger logger, Unregistered missing) {
            this.constructor = 2;
        }

        public Flexible(Logger logger) {
            this.constructor = 1;
        }

        public Flexible() {
            this.constructor = 0;
        }
    }

    public static class OnlyNoArg {
        final boolean viaNoArg;

        public OnlyNoArg(Unregistered missing) {
            this.viaNoArg = false;
        }

        public OnlyNoArg() {
            this.viaNoArg = true;
        }
    }

    public static class Unsatisfiable {
        public Unsatisfiable(Unregistered missing) {
        }
    }

    public static class Exploding {
        public Exploding(Logger logger) {
            throw new IllegalStateException("boom");
        }

        public Exploding() {
        }
    }

    public static class CycleA {
        public CycleA(CycleB b) {
        }

        public CycleA() {
        }
    }

    public static class CycleB {
        public CycleB(CycleA a) {
        }
    }

    public static class Recorder {
        final List<String> disposed = new ArrayList<>();
    }

    public static class FirstResource implements Disposable {
        private final Recorder recorder;

        public FirstResource(Recorder recorder) {
            this.recorder = recorder;
        }

        @Override
        public void dispose() {
            recorder.disposed.add("first");
        }
    }

    public static class SecondResource implements Disposable {
        private final Recorder recorder;

        public SecondResource(FirstResource first, Recorder recorder) {
            this.recorder = recorder;
        }

        @Override
        public void dispose() {
            recorder.disposed.add("second");
            throw new IllegalStateException("dispose failure is logged");
        }
    }

    // --- lifetimes ---

    @Test
    public void registeredSingletonInstanceIsReturnedForEveryResolve() {
        Logger logger = new Logger();
        container.registerSingleton(Logger.class, logger);

        Assertions.assertSame(logger, container.resolve(Logger.class));
        Assertions.assertSame(logger, container.resolve(Logger.class));
        Assertions.assertEquals(1, container.getServiceCount());
        Assertions.assertEquals(1, container.getSingletonCount());
    }

    @Test
    public void singletonIsConstructedOnce() {
        container.registerSingleton(Logger.class);

        Logger first = container.resolve(Logger.class);
        Assertions.assertSame(first, container.resolve(Logger.class));
        Assertions.assertEquals(1, container.getSingletonCount());
    }

    @Test
    public void transientWorkersShareTheSingletonLogger() {
        container.registerSingleton(Logger.class, new Logger());
        container.registerTransient(Worker.class);

        Worker a = container.resolve(Worker.class);
        Worker b = container.resolve(Worker.class);

        Assertions.assertNotSame(a, b);
        Assertions.assertSame(a.logger, b.logger);
        Assertions.assertSame(container.resolve(Logger.class), a.logger);
        Assertions.assertEquals(1, container.getSingletonCount());
    }

    @Test
    public void interfaceBindingResolvesImplementation() {
        container.registerSingleton(Greeter.class, EnglishGreeter.class);

        Assertions.assertEquals("hello", container.resolve(Greeter.class).greet());
    }

    @Test
    public void factoryRunsOnEveryResolveAndIsNeverStored() {
        int[] calls = {0};
        container.registerFactory(Greeter.class, c -> {
            calls[0]++;
            return new FrenchGreeter();
        });

        Greeter a = container.resolve(Greeter.class);
        Greeter b = container.resolve(Greeter.class);

        Assertions.assertNotSame(a, b);
        Assertions.assertEquals(2, calls[0]);
        Assertions.assertEquals(0, container.getSingletonCount());
    }

    @Test
    public void factoryCanResolveFromTheContainer() {
        container.registerSingleton(Logger.class);
        container.registerFactory(Worker.class, c -> new Worker(c.resolve(Logger.class)));

        Assertions.assertSame(container.resolve(Logger.class), container.resolve(Worker.class).logger);
    }

    @Test
    public void factoryReturningNullIsACreationFailure() {
        container.registerFactory(Greeter.class, c -> null);

        InstanceCreationException e = Assertions.assertThrows(InstanceCreationException.class,
                () -> container.resolve(Greeter.class));
        Assertions.assertEquals(Greeter.class, e.getType());
    }

    @Test
    public void cachedServiceIsReusedUntilTheTtlExpires() {
        container.registerCached(Greeter.class, EnglishGreeter.class);

        Greeter first = container.resolve(Greeter.class);
        clock.advance(KeystoneConfig.DEFAULT_CACHE_TTL.minusSeconds(1));
        Assertions.assertSame(first, container.resolve(Greeter.class));

        clock.advance(Duration.ofSeconds(2));
        Greeter rebuilt = container.resolve(Greeter.class);
        Assertions.assertNotSame(first, rebuilt);
        Assertions.assertEquals(0, container.getSingletonCount());
    }

    @Test
    public void cachedServiceIsRebuiltEveryTimeWhenTheCacheIsDisabled() {
        DefaultServiceContainer uncached = newContainer(KeystoneConfig.testing(), ImplementationCatalog.empty());
        uncached.registerCached(Greeter.class, EnglishGreeter.class);

        Assertions.assertNotSame(uncached.resolve(Greeter.class), uncached.resolve(Greeter.class));
    }

    @Test
    public void declaredConstructorReceivesResolvedDependencies() {
        container.registerSingleton(Logger.class);
        container.registerConstructor(Worker.class, Lifetime.TRANSIENT, List.of(Logger.class),
                args -> new Worker((Logger) args[0]));

        Worker worker = container.resolve(Worker.class);
        Assertions.assertSame(container.resolve(Logger.class), worker.logger);
        Assertions.assertNotSame(worker, container.resolve(Worker.class));
    }

    @Test
    public void declaredConstructorCannotUseFactoryLifetime() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> container.registerConstructor(Worker.class, Lifetime.FACTORY, List.of(), args -> null));
    }

    // --- failures ---

    @Test
    public void unregisteredTypeFailsOnResolveAndIsAbsentOnTryResolve() {
        UnregisteredServiceException e = Assertions.assertThrows(UnregisteredServiceException.class,
                () -> container.resolve(Unregistered.class));
        Assertions.assertEquals(Unregistered.class, e.getServiceType());

        Assertions.assertNull(container.tryResolve(Unregistered.class));

        Resolution<Unregistered> result = container.resolveResult(Unregistered.class);
        Assertions.assertFalse(result.isSuccess());
        Assertions.assertTrue(result.getReason().contains(Unregistered.class.getName()));
    }

    @Test
    public void mostSatisfiableConstructorWins() {
        container.registerSingleton(Logger.class);
        container.registerTransient(Flexible.class);

        Assertions.assertEquals(1, container.resolve(Flexible.class).constructor);
    }

    @Test
    public void fallsBackToTheNoArgConstructor() {
        container.registerTransient(OnlyNoArg.class);

        Assertions.assertTrue(container.resolve(OnlyNoArg.class).viaNoArg);
    }

    @Test
    public void failsWhenNoConstructorCanBeSatisfied() {
        container.registerTransient(Unsatisfiable.class);

        InstanceCreationException e = Assertions.assertThrows(InstanceCreationException.class,
                () -> container.resolve(Unsatisfiable.class));
        Assertions.assertTrue(e.getMessage().contains("Unsatisfiable(Unregistered)"), e.getMessage());
    }

    @Test
    public void throwingConstructorIsNotMaskedByFallback() {
        container.registerSingleton(Logger.class);
        container.registerTransient(Exploding.class);

        InstanceCreationException e = Assertions.assertThrows(InstanceCreationException.class,
                () -> container.resolve(Exploding.class));
        Assertions.assertInstanceOf(IllegalStateException.class, e.getCause());
        Assertions.assertEquals("boom", e.getCause().getMessage());
    }

    @Test
    public void interfaceWithoutImplementationCannotBeConstructed() {
        container.registerTransient(Greeter.class);

        Assertions.assertThrows(InstanceCreationException.class, () -> container.resolve(Greeter.class));
    }

    @Test
    public void constructorCycleIsReportedWithItsPath() {
        container.registerTransient(CycleA.class);
        container.registerTransient(CycleB.class);

        CircularDependencyException e = Assertions.assertThrows(CircularDependencyException.class,
                () -> container.resolve(CycleA.class));
        Assertions.assertEquals(List.of(CycleA.class, CycleB.class, CycleA.class), e.getCycle());

        // the resolution stack is unwound, so the same failure repeats
        Assertions.assertThrows(CircularDependencyException.class, () -> container.resolve(CycleB.class));
        Assertions.assertNull(container.tryResolve(CycleA.class));
    }

    @Test
    public void reRegisteringAnInstantiatedSingletonIsRejected() {
        container.registerSingleton(Logger.class);
        container.resolve(Logger.class);

        Assertions.assertThrows(IllegalStateException.class, () -> container.registerTransient(Logger.class));
    }

    @Test
    public void registrationMustMatchItsServiceType() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> container.register(Greeter.class, EnglishGreeter.class, Lifetime.FACTORY, null, null));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> container.register(Logger.class, Logger.class, Lifetime.TRANSIENT, new Logger(), null));
    }

    // --- discovery ---

    @Test
    public void discoveredImplementationIsRegisteredAsSingleton() {
        DefaultServiceContainer discovering = newContainer(KeystoneConfig.defaults(),
                ImplementationCatalog.empty().add(Greeter.class, FrenchGreeter.class));

        Greeter greeter = discovering.resolve(Greeter.class);
        Assertions.assertEquals("bonjour", greeter.greet());
        Assertions.assertTrue(discovering.isRegistered(Greeter.class));
        Assertions.assertSame(greeter, discovering.resolve(Greeter.class));
    }

    @Test
    public void discoveryCanBeDisabled() {
        DefaultServiceContainer plain = newContainer(KeystoneConfig.builder().discoveryEnabled(false).build(),
                ImplementationCatalog.empty().add(Greeter.class, FrenchGreeter.class));

        Assertions.assertThrows(UnregisteredServiceException.class, () -> plain.resolve(Greeter.class));
    }

    // --- introspection ---

    @Test
    public void resolveAllReturnsEveryAssignableRegistration() {
        container.registerSingleton(EnglishGreeter.class);
        container.registerTransient(FrenchGreeter.class);
        container.registerSingleton(Logger.class);

        List<Greeter> greeters = container.resolveAll(Greeter.class);
        Assertions.assertEquals(List.of("hello", "bonjour"), greeters.stream().map(Greeter::greet).toList());
    }

    @Test
    public void unregisterForgetsTheRegistrationAndInstance() {
        container.registerSingleton(Logger.class);
        container.resolve(Logger.class);

        Assertions.assertTrue(container.unregister(Logger.class));
        Assertions.assertFalse(container.isRegistered(Logger.class));
        Assertions.assertEquals(0, container.getSingletonCount());
        Assertions.assertFalse(container.unregister(Logger.class));
    }

    @Test
    public void evictDropsTheInstanceButKeepsTheRegistration() {
        container.registerSingleton(Logger.class);
        container.registerCached(Greeter.class, EnglishGreeter.class);
        Logger first = container.resolve(Logger.class);
        Greeter greeter = container.resolve(Greeter.class);

        Assertions.assertTrue(container.evict(Logger.class));
        Assertions.assertTrue(container.evict(Greeter.class));
        Assertions.assertFalse(container.evict(Logger.class));

        Assertions.assertTrue(container.isRegistered(Logger.class));
        Assertions.assertEquals(0, container.getSingletonCount());
        Assertions.assertNotSame(first, container.resolve(Logger.class));
        Assertions.assertNotSame(greeter, container.resolve(Greeter.class));
    }

    @Test
    public void statisticsCountResolutionsByOutcome() {
        container.registerSingleton(Logger.class);
        container.registerTransient(Worker.class);
        container.registerCached(Greeter.class, EnglishGreeter.class);
        container.registerFactory(Flexible.class, c -> new Flexible());

        container.resolve(Worker.class);
        container.resolve(Worker.class);
        container.resolve(Greeter.class);
        container.resolve(Greeter.class);
        container.tryResolve(Unregistered.class);

        ContainerStatistics stats = container.getStatistics();
        Assertions.assertEquals(4, stats.totalServices());
        Assertions.assertEquals(1, stats.singletonServices());
        Assertions.assertEquals(1, stats.transientServices());
        Assertions.assertEquals(1, stats.factoryServices());
        Assertions.assertEquals(1, stats.cachedServices());
        Assertions.assertEquals(5, stats.totalResolutions());
        Assertions.assertEquals(4, stats.successfulResolutions());
        Assertions.assertEquals(1, stats.failedResolutions());
        Assertions.assertEquals(1, stats.cacheHits());
        Assertions.assertEquals(1, stats.cacheMisses());
        Assertions.assertEquals(2, stats.resolutionCounts().get(Worker.class));
        Assertions.assertTrue(stats.report().contains("4/5"), stats.report());
    }

    @Test
    public void verifyReportsUnsatisfiableRegistrations() {
        container.registerSingleton(Logger.class);
        container.registerTransient(Worker.class);
        container.registerTransient(OnlyNoArg.class);
        Assertions.assertEquals(List.of(), container.verify());

        container.registerTransient(Unsatisfiable.class);
        container.registerTransient(Greeter.class);

        List<String> problems = container.verify();
        Assertions.assertEquals(2, problems.size(), problems.toString());
        Assertions.assertTrue(problems.get(0).contains(Unsatisfiable.class.getName()));
        Assertions.assertTrue(problems.get(1).contains("no public constructor"));
    }

    @Test
    public void disposeAllRunsInReverseCreationOrderAndClears() {
        Recorder recorder = new Recorder();
        container.registerSingleton(Recorder.class, recorder);
        container.registerSingleton(FirstResource.class);
        container.registerSingleton(SecondResource.class);

        container.resolve(SecondResource.class);
        container.disposeAll();

        Assertions.assertEquals(List.of("second", "first"), recorder.disposed);
        Assertions.assertEquals(0, container.getServiceCount());
        Assertions.assertTrue(logs.contains(java.util.logging.Level.SEVERE, SecondResource.class.getName()));
    }
}

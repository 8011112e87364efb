package com.tyron.keystone.core.discovery;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

public class ImplementationDiscoveryTest {

    @BeforeEach
    public void setUp() {
        CountingGreeter.CREATED.set(0);
    }

    private static ImplementationCatalog serviceFiles() {
        return ImplementationCatalog.fromServiceFiles(ImplementationDiscoveryTest.class.getClassLoader());
    }

    @Test
    public void catalogReadsProviderFilesWithoutInstantiating() {
        List<Class<?>> candidates = serviceFiles().candidatesFor(Greeter.class);

        Assertions.assertEquals(List.of(AbstractGreeter.class, NamedGreeter.class, CountingGreeter.class), candidates);
        Assertions.assertEquals(0, CountingGreeter.CREATED.get());
    }

    @Test
    public void firstConcreteCandidateWithNoArgConstructorWins() {
        ImplementationDiscovery discovery = new ImplementationDiscovery(serviceFiles());

        Optional<Object> found = discovery.tryDiscover(Greeter.class);

        Assertions.assertTrue(found.isPresent());
        Assertions.assertInstanceOf(CountingGreeter.class, found.get());
        Assertions.assertEquals(1, discovery.getDiscoveredCount());
    }

    @Test
    public void eachTypeIsAttemptedOnce() {
        ImplementationDiscovery discovery = new ImplementationDiscovery(serviceFiles());

        Object first = discovery.tryDiscover(Greeter.class).orElseThrow();
        Object second = discovery.tryDiscover(Greeter.class).orElseThrow();

        Assertions.assertSame(first, second);
        Assertions.assertEquals(1, CountingGreeter.CREATED.get());
        Assertions.assertEquals(1, discovery.getAttemptCount());
    }

    @Test
    public void failedAttemptIsRememberedToo() {
        ImplementationCatalog catalog = ImplementationCatalog.empty();
        ImplementationDiscovery discovery = new ImplementationDiscovery(catalog);

        Assertions.assertTrue(discovery.tryDiscover(Runnable.class).isEmpty());
        Assertions.assertTrue(discovery.wasAttempted(Runnable.class));

        catalog.add(Greeter.class, CountingGreeter.class);
        Assertions.assertTrue(discovery.tryDiscover(Runnable.class).isEmpty());
        Assertions.assertEquals(0, discovery.getDiscoveredCount());
    }

    @Test
    public void explicitAdditionsComeBeforeProviderFiles() {
        ImplementationCatalog catalog = serviceFiles().add(Greeter.class, ExplicitGreeter.class);

        Assertions.assertEquals(ExplicitGreeter.class, catalog.candidatesFor(Greeter.class).get(0));
        Object found = new ImplementationDiscovery(catalog).tryDiscover(Greeter.class).orElseThrow();
        Assertions.assertInstanceOf(ExplicitGreeter.class, found);
        Assertions.assertEquals(0, CountingGreeter.CREATED.get());
    }

    @Test
    public void unknownTypeIsNotFound() {
        ImplementationDiscovery discovery = new ImplementationDiscovery(serviceFiles());

        Assertions.assertEquals(Optional.empty(), discovery.tryDiscover(Comparable.class));
    }

    public static class ExplicitGreeter implements Greeter {
        @Override
        public String greet() {
            return "hi";
        }
    }
}

package com.tyron.keystone.api.container;

import com.tyron.keystone.api.error.UnregisteredServiceException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

public class ResolutionTest {

    @Test
    public void successCarriesTheValue() {
        Resolution<String> result = Resolution.success("value");

        Assertions.assertTrue(result.isSuccess());
        Assertions.assertEquals("value", result.getOrThrow());
        Assertions.assertEquals(Optional.of(5), result.map(String::length).toOptional());
        Assertions.assertNull(result.getReason());
    }

    @Test
    public void failureRethrowsTheRecordedException() {
        UnregisteredServiceException failure = new UnregisteredServiceException(Runnable.class);
        Resolution<Runnable> result = Resolution.failure(failure);

        Assertions.assertFalse(result.isSuccess());
        Assertions.assertNull(result.getOrNull());
        Assertions.assertSame(failure, Assertions.assertThrows(UnregisteredServiceException.class, result::getOrThrow));
        Assertions.assertSame(failure, result.map(Object::toString).getFailure());
        Assertions.assertTrue(result.getReason().contains("java.lang.Runnable"));
    }

    @Test
    public void statisticsReport() {
        ContainerStatistics stats = new ContainerStatistics(3, 1, 1, 1, 0, 4, 3, 1, 2, 2, Map.of());

        Assertions.assertEquals(0.75, stats.successRate(), 1e-9);
        Assertions.assertTrue(stats.report().startsWith("Services: 3 (S:1, T:1, F:1, C:0)"), stats.report());
    }
}

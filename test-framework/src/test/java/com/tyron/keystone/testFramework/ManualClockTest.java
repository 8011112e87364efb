package com.tyron.keystone.testFramework;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

public class ManualClockTest {

    @Test
    public void onlyMovesWhenAdvanced() {
        ManualClock clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));

        Assertions.assertEquals(clock.instant(), clock.instant());
        clock.advance(Duration.ofMinutes(5));
        Assertions.assertEquals(Instant.parse("2024-01-01T00:05:00Z"), clock.instant());

        clock.set(Instant.EPOCH);
        Assertions.assertEquals(0, clock.millis());
        Assertions.assertEquals(ZoneId.of("Europe/Paris"), clock.withZone(ZoneId.of("Europe/Paris")).getZone());
    }
}

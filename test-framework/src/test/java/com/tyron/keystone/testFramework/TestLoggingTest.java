package com.tyron.keystone.testFramework;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class TestLoggingTest {

    @Test
    public void unknownLevelFallsBackToInfo() {
        Assertions.assertEquals(Level.INFO, TestLogging.parseLevel("LOUD"));
        Assertions.assertEquals(Level.INFO, TestLogging.parseLevel(null));
        Assertions.assertEquals(Level.FINE, TestLogging.parseLevel(" fine "));
    }

    @Test
    public void installsOneConsoleHandlerOnTheKeystoneLoggerOnly() {
        TestLogging.configureOnce();
        TestLogging.configureOnce();

        Logger keystone = Logger.getLogger("com.tyron.keystone");
        long consoles = Arrays.stream(keystone.getHandlers()).filter(ConsoleHandler.class::isInstance).count();

        Assertions.assertEquals(1, consoles);
        Assertions.assertFalse(keystone.getUseParentHandlers());
    }
}

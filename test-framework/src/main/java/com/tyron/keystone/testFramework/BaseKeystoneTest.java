package com.tyron.keystone.testFramework;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Base class for tests that bootstrap components.
 * <p>
 * - Configures test logging once.
 * - Provides a {@link ManualClock} starting at a fixed instant.
 * - Captures everything logged under {@code com.tyron.keystone}.
 * - Closes whatever was handed to {@link #closeAfterTest}, most recent first.
 */
public abstract class BaseKeystoneTest {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    protected ManualClock clock;
    protected LogCapture logs;

    private final Deque<AutoCloseable> closeables = new ArrayDeque<>();

    @BeforeEach
    public final void baseSetUp() throws Exception {
        TestLogging.configureOnce();
        clock = new ManualClock(START);
        logs = LogCapture.attach("com.tyron.keystone");

        beforeEach();
    }

    @AfterEach
    public final void baseTearDown() throws Exception {
        try {
            afterEach();
        } finally {
            try {
                while (!closeables.isEmpty()) {
                    closeables.pop().close();
                }
            } finally {
                logs.close();
            }
        }
    }

    protected <T extends AutoCloseable> T closeAfterTest(T closeable) {
        closeables.push(closeable);
        return closeable;
    }

    /**
     * Subclasses override for per-test setup.
     * Called after the clock and log capture are ready.
     */
    protected void beforeEach() throws Exception {
    }

    /**
     * Subclasses override for per-test teardown.
     * Called before registered closeables are closed.
     */
    protected void afterEach() throws Exception {
    }
}

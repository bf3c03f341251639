package com.e2eq.amper.util;

import org.jboss.logging.Logger;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExceptionLoggingUtilsTest {

    private static final Logger LOG = Logger.getLogger(ExceptionLoggingUtilsTest.class);

    @Test
    public void testGetStackTrace() {
        String trace = ExceptionLoggingUtils.getStackTrace(new IllegalStateException("boom"));

        assertTrue(trace.startsWith("java.lang.IllegalStateException: boom"));
        assertTrue(trace.contains("testGetStackTrace"));
        assertEquals("", ExceptionLoggingUtils.getStackTrace(null));
    }

    @Test
    public void testDescribe() {
        assertEquals("boom", ExceptionLoggingUtils.describe(new RuntimeException("boom")));
        assertEquals("java.lang.NullPointerException", ExceptionLoggingUtils.describe(new NullPointerException()));
        assertEquals("", ExceptionLoggingUtils.describe(null));
    }

    @Test
    public void testLoggingDoesNotThrow() {
        Exception e = new RuntimeException("failure", new IllegalArgumentException("cause"));
        assertDoesNotThrow(() -> {
            ExceptionLoggingUtils.logError(LOG, e, "Failed to process %s", "item");
            ExceptionLoggingUtils.logWarn(LOG, null, "No exception for %s", "item");
            ExceptionLoggingUtils.logDebug(LOG, e, "Plain message with 100% literal");
        });
    }
}

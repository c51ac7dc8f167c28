package com.qaplatform.util;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

public class LoggingUtilTest {

    @Test
    public void testParseLevel() {
        assertEquals(Level.SEVERE, LoggingUtil.parseLevel("error"));
        assertEquals(Level.WARNING, LoggingUtil.parseLevel("WARN"));
        assertEquals(Level.FINE, LoggingUtil.parseLevel("debug"));
        assertEquals(Level.FINEST, LoggingUtil.parseLevel("TRACE"));
        assertEquals(Level.OFF, LoggingUtil.parseLevel("off"));
        assertEquals(Level.INFO, LoggingUtil.parseLevel("verbose"));
        assertEquals(Level.INFO, LoggingUtil.parseLevel(null));
    }

    @Test
    public void testLoggingDoesNotThrow() {
        LoggingUtil.debug("debug %s", "message");
        LoggingUtil.info("info message");
        LoggingUtil.warn("warn message", new IllegalStateException("test"));
    }
}

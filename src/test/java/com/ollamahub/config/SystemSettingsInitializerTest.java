package com.ollamahub.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SystemSettingsInitializerTest {

    @Test
    void testAppliesConfiguredLevel() {
        HubProperties properties = new HubProperties();
        properties.getSystemSettings().setLogLevel("warning");
        LoggingSystem loggingSystem = mock(LoggingSystem.class);

        new SystemSettingsInitializer(properties, loggingSystem).apply();

        verify(loggingSystem).setLogLevel(SystemSettingsInitializer.APPLICATION_LOGGER, LogLevel.WARN);
    }

    @Test
    void testMapsLevelNames() {
        assertEquals(LogLevel.INFO, SystemSettingsInitializer.toLogLevel(null));
        assertEquals(LogLevel.DEBUG, SystemSettingsInitializer.toLogLevel("DEBUG"));
        assertEquals(LogLevel.WARN, SystemSettingsInitializer.toLogLevel("WARN"));
        assertEquals(LogLevel.ERROR, SystemSettingsInitializer.toLogLevel("CRITICAL"));
    }

    @Test
    void testRejectsUnknownLevel() {
        assertThrows(IllegalStateException.class, () -> SystemSettingsInitializer.toLogLevel("VERBOSE"));
    }
}

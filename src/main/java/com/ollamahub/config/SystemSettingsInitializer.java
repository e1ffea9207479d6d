package com.ollamahub.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Applies {@code ollamahub.system-settings} that act on the running process rather than on
 * individual agents.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SystemSettingsInitializer {

    static final String APPLICATION_LOGGER = "com.ollamahub";

    private final HubProperties properties;
    private final LoggingSystem loggingSystem;

    @PostConstruct
    public void apply() {
        HubProperties.SystemSettings settings = properties.getSystemSettings();
        LogLevel level = toLogLevel(settings.getLogLevel());
        loggingSystem.setLogLevel(APPLICATION_LOGGER, level);
        log.info("Log level for {} set to {}.", APPLICATION_LOGGER, level);
        if (settings.isStream()) {
            log.warn("ollamahub.system-settings.stream=true is not supported. Requests are sent with stream=false.");
        }
    }

    static LogLevel toLogLevel(String configured) {
        if (!StringUtils.hasText(configured)) {
            return LogLevel.INFO;
        }
        return switch (configured.trim().toUpperCase(Locale.ROOT)) {
            case "DEBUG" -> LogLevel.DEBUG;
            case "INFO" -> LogLevel.INFO;
            case "WARNING", "WARN" -> LogLevel.WARN;
            case "ERROR", "CRITICAL" -> LogLevel.ERROR;
            default -> throw new IllegalStateException(
                    "ollamahub.system-settings.log-level must be one of DEBUG, INFO, WARNING, ERROR, CRITICAL but was "
                            + configured);
        };
    }
}

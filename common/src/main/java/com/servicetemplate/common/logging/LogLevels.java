package com.servicetemplate.common.logging;

import java.util.Locale;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

/**
 * Runtime control of the root log level.
 */
public final class LogLevels {

    private static final org.slf4j.Logger logger = LoggerFactory.getLogger(LogLevels.class);

    private LogLevels() {}

    /**
     * Maps a configured level name to a Logback level. Unknown names fall back to INFO.
     */
    public static Level parse(String level) {
        if (level == null) {
            return Level.INFO;
        }
        switch (level.trim().toUpperCase(Locale.ROOT)) {
            case "DEBUG":
                return Level.DEBUG;
            case "INFO":
                return Level.INFO;
            case "WARN":
            case "WARNING":
                return Level.WARN;
            case "ERROR":
                return Level.ERROR;
            default:
                return Level.INFO;
        }
    }

    /**
     * Sets the root logger level. Has no effect when SLF4J is not bound to Logback.
     */
    public static Level apply(String level) {
        Level parsed = parse(level);
        if (LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME) instanceof Logger root) {
            root.setLevel(parsed);
            logger.debug("Log level set to {}", parsed);
        } else {
            logger.warn("Logback is not the active SLF4J binding; log level {} not applied", parsed);
        }
        return parsed;
    }

    public static Level current() {
        if (LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME) instanceof Logger root) {
            return root.getLevel();
        }
        return null;
    }
}

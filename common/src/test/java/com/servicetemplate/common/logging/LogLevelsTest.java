package com.servicetemplate.common.logging;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

@DisplayName("Log levels")
class LogLevelsTest {

    private Level original;

    @BeforeEach
    void rememberLevel() {
        original = LogLevels.current();
    }

    @AfterEach
    void restoreLevel() {
        ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(original);
    }

    @Test
    @DisplayName("Should map level names case-insensitively")
    void testParse() {
        assertThat(LogLevels.parse("debug")).isEqualTo(Level.DEBUG);
        assertThat(LogLevels.parse("INFO")).isEqualTo(Level.INFO);
        assertThat(LogLevels.parse("Warning")).isEqualTo(Level.WARN);
        assertThat(LogLevels.parse("WARN")).isEqualTo(Level.WARN);
        assertThat(LogLevels.parse(" error ")).isEqualTo(Level.ERROR);
    }

    @Test
    @DisplayName("Unknown names fall back to INFO")
    void testUnknown() {
        assertThat(LogLevels.parse("verbose")).isEqualTo(Level.INFO);
        assertThat(LogLevels.parse(null)).isEqualTo(Level.INFO);
    }

    @Test
    @DisplayName("Should change the root logger level at runtime")
    void testApply() {
        LogLevels.apply("ERROR");
        assertThat(LogLevels.current()).isEqualTo(Level.ERROR);

        LogLevels.apply("debug");
        assertThat(LogLevels.current()).isEqualTo(Level.DEBUG);
    }
}

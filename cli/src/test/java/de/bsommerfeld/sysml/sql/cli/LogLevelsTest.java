package de.bsommerfeld.sysml.sql.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelsTest {

    private final Logger appLogger = (Logger) LoggerFactory.getLogger(LogLevels.APP_LOGGER);
    private final Level original = appLogger.getLevel();

    @AfterEach
    void tearDown() {
        appLogger.setLevel(original);
    }

    @Test
    void forVerbosity_shouldRaiseLevelPerFlag() {
        assertEquals(Level.INFO, LogLevels.forVerbosity(0));
        assertEquals(Level.DEBUG, LogLevels.forVerbosity(1));
        assertEquals(Level.TRACE, LogLevels.forVerbosity(2));
        assertEquals(Level.TRACE, LogLevels.forVerbosity(5));
    }

    @Test
    void apply_shouldSetApplicationLoggerLevel() {
        LogLevels.apply(2);

        assertEquals(Level.TRACE, appLogger.getLevel());
        assertTrue(LoggerFactory.getLogger("de.bsommerfeld.sysml.sql.importer.ElementImporter").isTraceEnabled());
    }

    @Test
    void apply_shouldKeepConfiguredLevelWithoutFlag() {
        LogLevels.apply(0);

        assertEquals(original, appLogger.getLevel());
    }
}

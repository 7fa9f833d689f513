package de.bsommerfeld.sysml.sql.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps the {@code -v} count onto the level of the application's loggers. */
final class LogLevels {

    static final String APP_LOGGER = "de.bsommerfeld.sysml";

    private LogLevels() {
    }

    static Level forVerbosity(int verbosity) {
        if (verbosity <= 0) {
            return Level.INFO;
        }
        return verbosity == 1 ? Level.DEBUG : Level.TRACE;
    }

    static void apply(int verbosity) {
        if (verbosity <= 0) {
            return;
        }
        Logger logger = LoggerFactory.getLogger(APP_LOGGER);
        if (logger instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(forVerbosity(verbosity));
        } else {
            logger.warn("Logging backend is not logback, -v has no effect");
        }
    }
}

package de.bsommerfeld.sysml.sql.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the application. In {@link #TEST} mode every command runs
 * against a throwaway in-memory database, so nothing is written to the
 * database file given on the command line.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the current application mode from the system property
     * ("app.mode") or the environment variable ("APP_MODE"). Defaults to PROD
     * if neither is set or the value is unknown.
     */
    public static ApplicationMode get() {
        return resolve(System.getProperty("app.mode"), System.getenv("APP_MODE"));
    }

    static ApplicationMode resolve(String property, String environment) {
        String mode = property;
        if (mode == null || mode.isBlank()) {
            mode = environment;
        }

        if (mode == null || mode.isBlank()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}

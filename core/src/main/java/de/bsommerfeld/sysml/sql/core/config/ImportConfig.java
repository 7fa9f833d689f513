package de.bsommerfeld.sysml.sql.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Import behaviour. Command line flags can only switch these on, never off.
 */
public class ImportConfig {

    @JsonProperty("vacuum")
    @JsonPropertyDescription("Run VACUUM after every import (default: false)")
    private boolean vacuum;

    @JsonProperty("syside-automator-compat-mode")
    @JsonPropertyDescription("Accept the quirks of SysIDE Automator JSON exports (default: false)")
    private boolean sysideAutomatorCompatMode;

    @JsonProperty("status-report-interval-seconds")
    @JsonPropertyDescription("Minimum seconds between two progress log lines (default: 5)")
    private long statusReportIntervalSeconds = 5;

    public boolean isVacuum() {
        return vacuum;
    }

    public boolean isSysideAutomatorCompatMode() {
        return sysideAutomatorCompatMode;
    }

    public long getStatusReportIntervalSeconds() {
        return statusReportIntervalSeconds;
    }
}

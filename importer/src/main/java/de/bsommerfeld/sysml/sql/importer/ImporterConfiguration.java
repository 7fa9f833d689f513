package de.bsommerfeld.sysml.sql.importer;

import de.bsommerfeld.sysml.sql.core.config.ImportConfig;
import de.bsommerfeld.sysml.sql.core.config.SchemaConfig;
import de.bsommerfeld.sysml.sql.core.domain.RelationConvention;

/**
 * Per-run import options.
 *
 * @param vacuum                    compact the database file after the import
 * @param sysideAutomatorCompatMode accept {@code "true"}/{@code "false"} strings in
 *                                  {@code is*} columns and reference objects with extra keys
 * @param convention                which records are relation-like
 */
public record ImporterConfiguration(boolean vacuum, boolean sysideAutomatorCompatMode, RelationConvention convention) {

    public static ImporterConfiguration defaults() {
        return new ImporterConfiguration(false, false, RelationConvention.embeddedOnly());
    }

    public static ImporterConfiguration from(ImportConfig importConfig, SchemaConfig schemaConfig) {
        return new ImporterConfiguration(importConfig.isVacuum(), importConfig.isSysideAutomatorCompatMode(),
                RelationConvention.from(schemaConfig));
    }

    public ImporterConfiguration withVacuum(boolean enabled) {
        return new ImporterConfiguration(vacuum || enabled, sysideAutomatorCompatMode, convention);
    }

    public ImporterConfiguration withCompatMode(boolean enabled) {
        return new ImporterConfiguration(vacuum, sysideAutomatorCompatMode || enabled, convention);
    }
}

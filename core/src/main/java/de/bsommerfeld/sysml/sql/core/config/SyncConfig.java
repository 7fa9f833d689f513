package de.bsommerfeld.sysml.sql.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Every section is optional, missing keys keep
 * their defaults.
 */
public class SyncConfig {

    @JsonProperty("fetch")
    private FetchConfig fetch = new FetchConfig();

    @JsonProperty("import")
    private ImportConfig importing = new ImportConfig();

    @JsonProperty("schema")
    private SchemaConfig schema = new SchemaConfig();

    public FetchConfig getFetch() {
        return fetch;
    }

    public ImportConfig getImport() {
        return importing;
    }

    public SchemaConfig getSchema() {
        return schema;
    }
}

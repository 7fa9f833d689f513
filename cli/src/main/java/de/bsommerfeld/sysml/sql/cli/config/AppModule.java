package de.bsommerfeld.sysml.sql.cli.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Names;
import de.bsommerfeld.sysml.sql.api.FetchOptions;
import de.bsommerfeld.sysml.sql.core.config.ApplicationMode;
import de.bsommerfeld.sysml.sql.core.config.FetchConfig;
import de.bsommerfeld.sysml.sql.core.config.ImportConfig;
import de.bsommerfeld.sysml.sql.core.config.SchemaConfig;
import de.bsommerfeld.sysml.sql.core.config.SyncConfig;
import de.bsommerfeld.sysml.sql.db.DatabaseService;
import de.bsommerfeld.sysml.sql.db.SqlDatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module wiring configuration and the database for one command run.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    static final String IN_MEMORY_URL = "jdbc:sqlite::memory:";

    private final Path dbFile;
    private final SyncConfig config;
    private final ApplicationMode mode;

    public AppModule(Path dbFile, SyncConfig config, ApplicationMode mode) {
        this.dbFile = dbFile;
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(SyncConfig.class).toInstance(config);

        // Sub-configs for convenience
        bind(FetchConfig.class).toInstance(config.getFetch());
        bind(ImportConfig.class).toInstance(config.getImport());
        bind(SchemaConfig.class).toInstance(config.getSchema());

        bind(ApplicationMode.class).toInstance(mode);
        LOG.debug("Application Mode initialized: {}", mode);

        if (mode.isTest()) {
            // Dry run: nothing reaches the database file
            LOG.warn("TEST mode, working on an in-memory database instead of {}", dbFile);
            bindConstant().annotatedWith(Names.named("database.url")).to(IN_MEMORY_URL);
        } else {
            bindConstant().annotatedWith(Names.named("database.url"))
                    .to("jdbc:sqlite:" + dbFile.toAbsolutePath());
        }
        bind(DatabaseService.class).to(SqlDatabaseService.class);
    }

    @Provides
    @Singleton
    FetchOptions fetchOptions(FetchConfig fetchConfig) {
        return FetchOptions.from(fetchConfig);
    }
}

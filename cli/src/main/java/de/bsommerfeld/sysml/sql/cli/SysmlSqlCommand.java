package de.bsommerfeld.sysml.sql.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import de.bsommerfeld.sysml.sql.cli.command.FetchCommand;
import de.bsommerfeld.sysml.sql.cli.command.ImportJsonCommand;
import de.bsommerfeld.sysml.sql.cli.command.InitDbCommand;
import de.bsommerfeld.sysml.sql.cli.command.SchemaToSqlCommand;
import de.bsommerfeld.sysml.sql.cli.config.AppModule;
import de.bsommerfeld.sysml.sql.core.config.ApplicationMode;
import de.bsommerfeld.sysml.sql.core.config.ConfigLoader;
import de.bsommerfeld.sysml.sql.core.config.SyncConfig;
import de.bsommerfeld.sysml.sql.core.event.ApplicationEventBus;
import de.bsommerfeld.sysml.sql.core.util.StoragePaths;
import de.bsommerfeld.sysml.sql.db.DatabaseService;
import de.bsommerfeld.sysml.sql.db.SchemaInitializer;
import de.bsommerfeld.sysml.sql.importer.ElementImporter;
import de.bsommerfeld.sysml.sql.importer.ElementSource;
import de.bsommerfeld.sysml.sql.importer.ImportException;
import de.bsommerfeld.sysml.sql.importer.ImportReport;
import de.bsommerfeld.sysml.sql.importer.ImporterConfiguration;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Root command. Holds the options every subcommand shares and builds the
 * Guice injector for them.
 */
@CommandLine.Command(name = "sysml-v2-sql", mixinStandardHelpOptions = true, version = "sysml-v2-sql 0.3.0",
        description = "Loads SysML v2 models into a queryable SQLite database.",
        subcommands = {
                InitDbCommand.class,
                ImportJsonCommand.class,
                SchemaToSqlCommand.class,
                FetchCommand.class
        })
public class SysmlSqlCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "-v", description = "More log output, -v for debug, -vv for trace")
    boolean[] verbosity = new boolean[0];

    @CommandLine.Option(names = "--config", paramLabel = "FILE",
            description = "Configuration file (default: config.toml in the user configuration directory)")
    Path configFile;

    @CommandLine.Parameters(index = "0", paramLabel = "DB_FILE", description = "SQLite database file")
    Path dbFile;

    private final ApplicationMode mode;

    public SysmlSqlCommand() {
        this(ApplicationMode.get());
    }

    SysmlSqlCommand(ApplicationMode mode) {
        this.mode = mode;
    }

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(),
                "Missing command, expected one of " + spec.subcommands().keySet());
    }

    public Path dbFile() {
        return dbFile;
    }

    public ApplicationMode mode() {
        return mode;
    }

    int verbosity() {
        return verbosity.length;
    }

    public PrintWriter out() {
        return spec.commandLine().getOut();
    }

    public SyncConfig loadConfig() throws IOException {
        if (configFile != null) {
            if (!Files.isRegularFile(configFile)) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file not found: " + configFile);
            }
            return ConfigLoader.load(configFile);
        }
        return ConfigLoader.load(StoragePaths.defaultConfigFile());
    }

    public Injector injector(Module... extra) throws IOException {
        List<Module> modules = new ArrayList<>();
        modules.add(new AppModule(dbFile, loadConfig(), mode));
        modules.addAll(Arrays.asList(extra));
        return Guice.createInjector(modules);
    }

    public ProgressReporter attachProgressReporter(Injector injector) {
        SyncConfig config = injector.getInstance(SyncConfig.class);
        ProgressReporter reporter = new ProgressReporter(
                Duration.ofSeconds(config.getImport().getStatusReportIntervalSeconds()));
        injector.getInstance(ApplicationEventBus.class).register(reporter);
        return reporter;
    }

    public ImporterConfiguration importerConfiguration(Injector injector, boolean vacuum, boolean compatMode) {
        SyncConfig config = injector.getInstance(SyncConfig.class);
        return ImporterConfiguration.from(config.getImport(), config.getSchema())
                .withVacuum(vacuum)
                .withCompatMode(compatMode);
    }

    /**
     * Imports into the configured database and closes it afterwards. In TEST
     * mode the in-memory database starts out empty, so the bundled schema is
     * applied first.
     */
    public ImportReport importElements(Injector injector, ElementSource source, ImporterConfiguration configuration)
            throws ImportException, SQLException {
        DatabaseService database = injector.getInstance(DatabaseService.class);
        try {
            if (mode.isTest()) {
                injector.getInstance(SchemaInitializer.class).initialize();
            }
            return injector.getInstance(ElementImporter.class).importElements(source, configuration);
        } finally {
            database.close();
        }
    }
}

package de.bsommerfeld.sysml.sql.cli.command;

import com.google.inject.Injector;
import de.bsommerfeld.sysml.sql.cli.ProgressReporter;
import de.bsommerfeld.sysml.sql.cli.SysmlSqlCommand;
import de.bsommerfeld.sysml.sql.core.event.ApplicationEventBus;
import de.bsommerfeld.sysml.sql.importer.ImportReport;
import de.bsommerfeld.sysml.sql.importer.ImporterConfiguration;
import de.bsommerfeld.sysml.sql.importer.JsonFileElementSource;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Imports a JSON file holding an array of elements, as written by
 * {@code fetch --dump-json} or exported by other SysML v2 tools.
 */
@CommandLine.Command(name = "import-json", mixinStandardHelpOptions = true,
        description = "Imports a JSON array of SysML v2 elements into the database.")
public class ImportJsonCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    SysmlSqlCommand parent;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "JSON file with an array of elements")
    Path file;

    @CommandLine.Option(names = "--vacuum", description = "Run VACUUM after the import")
    boolean vacuum;

    @CommandLine.Option(names = "--syside-automator-compat-mode",
            description = "Accept the quirks of SysIDE Automator exports")
    boolean sysideAutomatorCompatMode;

    @Override
    public Integer call() throws Exception {
        Injector injector = parent.injector();
        ImporterConfiguration configuration =
                parent.importerConfiguration(injector, vacuum, sysideAutomatorCompatMode);

        ProgressReporter reporter = parent.attachProgressReporter(injector);
        try {
            ImportReport report = parent.importElements(injector, new JsonFileElementSource(file), configuration);
            parent.out().println(report.summary());
        } finally {
            injector.getInstance(ApplicationEventBus.class).unregister(reporter);
        }
        return 0;
    }
}

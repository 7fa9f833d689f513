package de.bsommerfeld.sysml.sql.cli.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Injector;
import de.bsommerfeld.sysml.sql.api.CommitSelector;
import de.bsommerfeld.sysml.sql.api.Credentials;
import de.bsommerfeld.sysml.sql.api.JsonDumpWriter;
import de.bsommerfeld.sysml.sql.api.ModelReference;
import de.bsommerfeld.sysml.sql.api.PageListener;
import de.bsommerfeld.sysml.sql.api.PaginatedFetcher;
import de.bsommerfeld.sysml.sql.api.ProjectSelector;
import de.bsommerfeld.sysml.sql.api.SysmlApiClient;
import de.bsommerfeld.sysml.sql.cli.ProgressReporter;
import de.bsommerfeld.sysml.sql.cli.SysmlSqlCommand;
import de.bsommerfeld.sysml.sql.cli.config.FetchModule;
import de.bsommerfeld.sysml.sql.core.config.SyncConfig;
import de.bsommerfeld.sysml.sql.core.event.ApplicationEventBus;
import de.bsommerfeld.sysml.sql.importer.ElementSource;
import de.bsommerfeld.sysml.sql.importer.ImportReport;
import de.bsommerfeld.sysml.sql.importer.ImporterConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Downloads a model from a SysML v2 API server and imports it.
 *
 * <p>
 * The commit is picked by id, by branch or, if none of these is given, from
 * the project's default branch. All pages are fetched before the import
 * starts; a failed fetch leaves the database untouched.
 */
@CommandLine.Command(name = "fetch", mixinStandardHelpOptions = true,
        description = "Fetches a model from a SysML v2 API server and imports it.")
public class FetchCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(FetchCommand.class);

    @CommandLine.ParentCommand
    SysmlSqlCommand parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "BASE_URL",
            description = "Base URL of the API, e.g. http://localhost:9000")
    URI baseUrl;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    ProjectOptions project;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "0..1")
    CommitOptions commit;

    @CommandLine.Option(names = {"-a", "--allow-invalid-certs"},
            description = "Accept any TLS certificate. Only use this with servers you trust")
    boolean allowInvalidCerts;

    @CommandLine.Option(names = {"-d", "--dump-json"}, paramLabel = "FILE",
            description = "Also write the fetched elements to FILE")
    Path dumpJson;

    @CommandLine.Option(names = {"-y", "--pretty"}, description = "Pretty-print the --dump-json file")
    boolean pretty;

    @CommandLine.Option(names = {"-p", "--page-size"}, paramLabel = "N",
            description = "Elements per page (default: server default)")
    Integer pageSize;

    @CommandLine.Option(names = {"-n", "--no-import"}, description = "Only fetch, do not touch the database")
    boolean noImport;

    @CommandLine.Option(names = "--vacuum", description = "Run VACUUM after the import")
    boolean vacuum;

    @CommandLine.Option(names = "--syside-automator-compat-mode",
            description = "Accept the quirks of SysIDE Automator exports")
    boolean sysideAutomatorCompatMode;

    static class ProjectOptions {

        @CommandLine.Option(names = "--project-id", paramLabel = "ID", required = true)
        String id;

        @CommandLine.Option(names = "--project-name", paramLabel = "NAME", required = true,
                description = "Unique prefix of the project name")
        String name;

        ProjectSelector toSelector() {
            return id != null ? ProjectSelector.byId(id) : ProjectSelector.byName(name);
        }
    }

    static class CommitOptions {

        @CommandLine.Option(names = "--commit-id", paramLabel = "ID", required = true)
        String commitId;

        @CommandLine.Option(names = "--branch-id", paramLabel = "ID", required = true,
                description = "Head commit of this branch")
        String branchId;

        @CommandLine.Option(names = "--branch-name", paramLabel = "NAME", required = true,
                description = "Head commit of the branch with this unique name prefix")
        String branchName;

        CommitSelector toSelector() {
            if (commitId != null) {
                return CommitSelector.commitId(commitId);
            }
            return branchId != null ? CommitSelector.branchId(branchId) : CommitSelector.branchName(branchName);
        }
    }

    @Override
    public Integer call() throws Exception {
        if (pageSize != null && pageSize < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--page-size must be at least 1");
        }
        if (pretty && dumpJson == null) {
            LOG.warn("--pretty has no effect without --dump-json");
        }

        Injector injector = parent.injector(new FetchModule(Credentials.fromEnvironment(), allowInvalidCerts));
        SyncConfig config = injector.getInstance(SyncConfig.class);
        Integer effectivePageSize = pageSize != null ? pageSize : config.getFetch().getPageSize();
        CommitSelector commitSelector = commit != null ? commit.toSelector() : CommitSelector.defaultBranch();

        ProgressReporter reporter = parent.attachProgressReporter(injector);
        try (PaginatedFetcher fetcher = injector.getInstance(PaginatedFetcher.class)) {
            SysmlApiClient client = new SysmlApiClient(baseUrl, fetcher);
            ModelReference reference = client.resolve(project.toSelector(), commitSelector);
            URI elements = client.elementsUri(reference, effectivePageSize);

            List<JsonNode> records;
            if (dumpJson != null) {
                try (JsonDumpWriter dump = new JsonDumpWriter(dumpJson, pretty)) {
                    records = fetcher.fetchAll(elements, dump);
                    LOG.info("Wrote {} elements to {}", dump.getWritten(), dumpJson);
                }
            } else {
                records = fetcher.fetchAll(elements, PageListener.NONE);
            }

            if (noImport) {
                parent.out().println("Fetched " + records.size() + " elements of project " + reference.projectId()
                        + " at commit " + reference.commitId());
                return 0;
            }

            ImporterConfiguration configuration =
                    parent.importerConfiguration(injector, vacuum, sysideAutomatorCompatMode);
            ImportReport report = parent.importElements(injector, ElementSource.of(records), configuration);
            parent.out().println(report.summary());
        } finally {
            injector.getInstance(ApplicationEventBus.class).unregister(reporter);
        }
        return 0;
    }
}

package de.bsommerfeld.sysml.sql.cli;

import de.bsommerfeld.sysml.sql.api.FetchException;
import de.bsommerfeld.sysml.sql.core.config.ApplicationMode;
import de.bsommerfeld.sysml.sql.importer.ImportException;
import de.bsommerfeld.sysml.sql.schema.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.sql.SQLException;

/**
 * Entry point of the {@code sysml-v2-sql} command line tool.
 */
public class SysmlSqlApp {

    private static final Logger LOG = LoggerFactory.getLogger(SysmlSqlApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String... args) {
        return commandLine(ApplicationMode.get()).execute(args);
    }

    public static CommandLine commandLine(ApplicationMode mode) {
        SysmlSqlCommand root = new SysmlSqlCommand(mode);
        CommandLine commandLine = new CommandLine(root);
        commandLine.setExecutionStrategy(parseResult -> {
            LogLevels.apply(root.verbosity());
            return new CommandLine.RunLast().execute(parseResult);
        });
        commandLine.setParameterExceptionHandler(SysmlSqlApp::handleParameterException);
        commandLine.setExecutionExceptionHandler((e, failed, parseResult) -> {
            LOG.error(describe(e));
            LOG.debug("Stack trace", e);
            return EXIT_FAILURE;
        });
        return commandLine;
    }

    private static int handleParameterException(CommandLine.ParameterException e, String[] args) {
        CommandLine failed = e.getCommandLine();
        PrintWriter err = failed.getErr();
        err.println(e.getMessage());
        if (!CommandLine.UnmatchedArgumentException.printSuggestions(e, err)) {
            failed.usage(err);
        }
        return EXIT_FAILURE;
    }

    /** The one line a failed run reports. */
    static String describe(Exception e) {
        if (e instanceof ImportException importException) {
            String element = importException.getElementId() != null
                    ? " [element " + importException.getElementId() + "]"
                    : "";
            return "Import failed (" + importException.getKind() + "): " + e.getMessage() + element;
        }
        if (e instanceof FetchException fetchException) {
            return "Fetch failed (" + fetchException.getKind() + "): " + e.getMessage();
        }
        if (e instanceof SchemaException schemaException) {
            return "Schema conversion failed (" + schemaException.getKind() + "): " + e.getMessage();
        }
        if (e instanceof SQLException) {
            return "Database error: " + e.getMessage();
        }
        if (e instanceof IOException) {
            return "I/O error: " + e.getMessage();
        }
        if (e instanceof InterruptedException) {
            return "Interrupted";
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}

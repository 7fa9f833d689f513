package de.bsommerfeld.sysml.sql.cli.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Injector;
import de.bsommerfeld.sysml.sql.cli.SysmlSqlCommand;
import de.bsommerfeld.sysml.sql.core.config.SyncConfig;
import de.bsommerfeld.sysml.sql.db.DatabaseService;
import de.bsommerfeld.sysml.sql.schema.ResolvedSchema;
import de.bsommerfeld.sysml.sql.schema.SchemaResolver;
import de.bsommerfeld.sysml.sql.schema.ddl.DdlEmitter;
import de.bsommerfeld.sysml.sql.schema.ddl.DdlScript;
import de.bsommerfeld.sysml.sql.schema.ddl.EmitterOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Turns a SysML v2 JSON schema into the SQLite schema. The script is applied
 * to the database unless {@code --no-init} is given; with {@code --no-init}
 * and no {@code --dump-sql} it goes to standard output.
 */
@CommandLine.Command(name = "json-schema-to-sql-schema", mixinStandardHelpOptions = true,
        description = "Generates the SQLite schema from a SysML v2 JSON schema.")
public class SchemaToSqlCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaToSqlCommand.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @CommandLine.ParentCommand
    SysmlSqlCommand parent;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "SysML v2 JSON schema")
    Path schemaFile;

    @CommandLine.Option(names = {"-d", "--dump-sql"}, paramLabel = "FILE",
            description = "Write the generated SQL to FILE")
    Path dumpSql;

    @CommandLine.Option(names = {"-n", "--no-init"}, description = "Do not apply the schema to the database")
    boolean noInit;

    @Override
    public Integer call() throws Exception {
        SyncConfig config = parent.loadConfig();
        JsonNode document = MAPPER.readTree(schemaFile.toFile());
        ResolvedSchema schema = new SchemaResolver().resolve(document);
        DdlScript script = new DdlEmitter(EmitterOptions.from(config.getSchema())).emit(schema);
        String sql = script.toSql();

        if (dumpSql != null) {
            Files.writeString(dumpSql, sql, StandardCharsets.UTF_8);
            LOG.info("Wrote {} statements to {}", script.statements().size(), dumpSql);
        }
        if (noInit) {
            if (dumpSql == null) {
                parent.out().print(sql);
                parent.out().flush();
            }
            return 0;
        }

        Injector injector = parent.injector();
        DatabaseService database = injector.getInstance(DatabaseService.class);
        try {
            int statements = database.executeScript(sql);
            parent.out().println("Applied " + statements + " statements to " + parent.dbFile() + " ("
                    + script.elements().columns().size() + " element columns, "
                    + script.relations().columns().size() + " relation columns)");
        } finally {
            database.close();
        }
        return 0;
    }
}

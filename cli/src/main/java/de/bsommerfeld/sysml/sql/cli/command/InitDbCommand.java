package de.bsommerfeld.sysml.sql.cli.command;

import com.google.inject.Injector;
import de.bsommerfeld.sysml.sql.cli.SysmlSqlCommand;
import de.bsommerfeld.sysml.sql.db.DatabaseService;
import de.bsommerfeld.sysml.sql.db.SchemaInitializer;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "init-db", mixinStandardHelpOptions = true,
        description = "Creates the elements and relations tables from the bundled SysML v2 schema.")
public class InitDbCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    SysmlSqlCommand parent;

    @Override
    public Integer call() throws Exception {
        Injector injector = parent.injector();
        DatabaseService database = injector.getInstance(DatabaseService.class);
        try {
            int statements = injector.getInstance(SchemaInitializer.class).initialize();
            parent.out().println("Initialized " + parent.dbFile() + " (" + statements + " statements)");
        } finally {
            database.close();
        }
        return 0;
    }
}

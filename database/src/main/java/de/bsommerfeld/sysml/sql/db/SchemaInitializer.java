package de.bsommerfeld.sysml.sql.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;

/**
 * Creates the bundled schema ({@code schema.sql}) in a database. Every
 * statement is {@code IF NOT EXISTS}, so running it on an initialized
 * database changes nothing.
 *
 * <p>
 * {@code schema.sql} is the output of {@code json-schema-to-sql-schema} for
 * {@code sysml-core-schemas.json}, which sits next to it on the classpath.
 */
@Singleton
public class SchemaInitializer {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaInitializer.class);

    public static final String BUNDLED_SCHEMA = "schema.sql";
    public static final String BUNDLED_SCHEMA_SOURCE = "sysml-core-schemas.json";

    private final DatabaseService database;

    @Inject
    public SchemaInitializer(DatabaseService database) {
        this.database = database;
    }

    /** @return number of statements executed */
    public int initialize() throws SQLException {
        int statements = database.executeScript(loadBundledSchema());
        LOG.info("Database schema applied ({} statements).", statements);
        return statements;
    }

    public static String loadBundledSchema() {
        return readClasspath(BUNDLED_SCHEMA);
    }

    static String readClasspath(String resource) {
        try (InputStream in = SchemaInitializer.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource, e);
        }
    }
}

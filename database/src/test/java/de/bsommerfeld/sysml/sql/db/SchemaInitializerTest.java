package de.bsommerfeld.sysml.sql.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SchemaInitializerTest {

    @TempDir
    Path tempDir;

    @Test
    void initialize_shouldCreateElementsAndRelations() throws SQLException {
        try (SqlDatabaseService db = SqlDatabaseService.forFile(tempDir.resolve("init.db"))) {
            new SchemaInitializer(db).initialize();

            assertFalse(db.tableColumns("elements").isEmpty());
            assertEquals("@id", db.tableColumns("elements").get(0).name());
            assertEquals(5, db.tableColumns("relations").size());
        }
    }

    @Test
    void initialize_shouldBeIdempotent() throws SQLException {
        try (SqlDatabaseService db = SqlDatabaseService.forFile(tempDir.resolve("init.db"))) {
            SchemaInitializer initializer = new SchemaInitializer(db);
            int first = initializer.initialize();
            db.upsert("elements", java.util.List.of("@id", "@type"), java.util.List.of("a", "Element"));
            int second = initializer.initialize();

            assertEquals(first, second);
            assertEquals(1, db.countRows("elements"));
        }
    }

    @Test
    void initialize_shouldPassBundledScriptToGateway() throws SQLException {
        DatabaseService db = mock(DatabaseService.class);
        when(db.executeScript(contains("CREATE TABLE IF NOT EXISTS \"elements\""))).thenReturn(11);

        assertEquals(11, new SchemaInitializer(db).initialize());
        verify(db).executeScript(contains("STRICT"));
    }

    @Test
    void loadBundledSchema_shouldContainOnlyIdempotentStatements() {
        for (String statement : SqlLoader.split(SchemaInitializer.loadBundledSchema())) {
            assertTrue(statement.contains("IF NOT EXISTS"), statement);
        }
    }

    @Test
    void bundledSchemaSource_shouldBeOnClasspath() {
        assertTrue(SchemaInitializer.readClasspath(SchemaInitializer.BUNDLED_SCHEMA_SOURCE).contains("\"$defs\""));
    }
}

package de.bsommerfeld.sysml.sql.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL from classpath resource files under {@code sql/}.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 * Files holding a single statement are used with {@link #load}; files with
 * several statements (the bulk-insert pragmas) go through
 * {@link #loadStatements}, which applies the same splitting as the schema
 * scripts.
 *
 * @see SqlDatabaseService
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the SQL from {@code sql/<name>.sql} on the classpath, trimmed.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /** Returns the statements of {@code sql/<name>.sql}, split as by {@link #split}. */
    public static List<String> loadStatements(String name) {
        return split(load(name));
    }

    /**
     * Splits a script into statements on a semicolon at the end of a line.
     * Chunks consisting only of comments and whitespace are dropped; leading
     * comment lines stay attached to their statement.
     */
    public static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        for (String chunk : script.split(";\\s*(\\r?\\n|$)")) {
            String statement = chunk.trim();
            if (!isCommentOnly(statement)) {
                statements.add(statement);
            }
        }
        return statements;
    }

    private static boolean isCommentOnly(String chunk) {
        for (String line : chunk.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("--")) {
                return false;
            }
        }
        return true;
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}

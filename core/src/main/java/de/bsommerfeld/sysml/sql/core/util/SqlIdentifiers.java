package de.bsommerfeld.sysml.sql.core.util;

/**
 * Quoting for SQLite identifiers. SysML attribute names such as {@code @id}
 * are not valid bare identifiers, so every generated table, column and index
 * name goes through {@link #quote(String)}.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {
    }

    public static String quote(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("SQL identifier must not be empty");
        }
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }
}

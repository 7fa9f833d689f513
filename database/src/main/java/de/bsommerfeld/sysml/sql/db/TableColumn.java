package de.bsommerfeld.sysml.sql.db;

/**
 * A column as reported by SQLite's {@code pragma_table_info}.
 *
 * @param name       column name
 * @param type       declared type, e.g. {@code TEXT} or {@code ANY}
 * @param notNull    whether the column is declared {@code NOT NULL}
 * @param primaryKey whether the column is part of the primary key
 */
public record TableColumn(String name, String type, boolean notNull, boolean primaryKey) {
}

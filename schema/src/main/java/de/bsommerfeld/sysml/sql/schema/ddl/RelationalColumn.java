package de.bsommerfeld.sysml.sql.schema.ddl;

import static de.bsommerfeld.sysml.sql.core.util.SqlIdentifiers.quote;

/**
 * One column of a generated table.
 *
 * @param name       column name, identical to the JSON attribute name
 * @param type       storage type
 * @param nullable   data columns are always nullable
 * @param primaryKey whether this is the table's {@code @id} column
 * @param references table whose {@code @id} this column points at, or {@code null}
 */
public record RelationalColumn(String name, ColumnType type, boolean nullable, boolean primaryKey, String references) {

    public static RelationalColumn data(String name, ColumnType type) {
        return new RelationalColumn(name, type, true, false, null);
    }

    public static RelationalColumn primaryKey(String name) {
        return new RelationalColumn(name, ColumnType.TEXT, false, true, null);
    }

    public static RelationalColumn required(String name) {
        return new RelationalColumn(name, ColumnType.TEXT, false, false, null);
    }

    public static RelationalColumn foreignKey(String name, String table) {
        return new RelationalColumn(name, ColumnType.TEXT, false, false, table);
    }

    /** Column definition as it appears inside {@code CREATE TABLE}. */
    public String definition() {
        StringBuilder sql = new StringBuilder(quote(name)).append(' ').append(type.name());
        if (!nullable) {
            sql.append(" NOT NULL");
        }
        if (primaryKey) {
            sql.append(" PRIMARY KEY");
        }
        if (references != null) {
            sql.append(" REFERENCES ").append(quote(references)).append('(').append(quote("@id")).append(')')
                    .append(" DEFERRABLE INITIALLY DEFERRED");
        }
        return sql.toString();
    }
}

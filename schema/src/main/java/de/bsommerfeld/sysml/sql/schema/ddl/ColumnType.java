package de.bsommerfeld.sysml.sql.schema.ddl;

import de.bsommerfeld.sysml.sql.schema.FieldKind;

/**
 * Column types of a SQLite {@code STRICT} table.
 */
public enum ColumnType {
    TEXT,
    INTEGER,
    REAL,
    ANY;

    /**
     * Storage type for a field kind. Booleans are stored as 0/1, arrays and
     * objects as canonical JSON text.
     *
     * @throws IllegalArgumentException for {@link FieldKind#REFERENCE}, which
     *                                  is lowered into relation rows instead
     */
    public static ColumnType of(FieldKind kind) {
        switch (kind) {
            case STRING:
            case ARRAY:
            case OBJECT:
                return TEXT;
            case INTEGER:
            case BOOLEAN:
                return INTEGER;
            case NUMBER:
                return REAL;
            default:
                throw new IllegalArgumentException("No column type for " + kind);
        }
    }
}

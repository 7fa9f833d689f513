package de.bsommerfeld.sysml.sql.schema;

/**
 * What a schema property holds. {@link #REFERENCE} marks properties that point
 * at other elements; they never become columns.
 */
public enum FieldKind {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT,
    REFERENCE;

    /** Maps a JSON schema {@code type} keyword, {@code null} for unknown names. */
    static FieldKind ofJsonType(String type) {
        switch (type) {
            case "string":
                return STRING;
            case "integer":
                return INTEGER;
            case "number":
                return NUMBER;
            case "boolean":
                return BOOLEAN;
            case "array":
                return ARRAY;
            case "object":
                return OBJECT;
            default:
                return null;
        }
    }

    public boolean isScalar() {
        return this == STRING || this == INTEGER || this == NUMBER || this == BOOLEAN;
    }
}

package de.bsommerfeld.sysml.sql.schema;

import java.util.List;

/**
 * Thrown when a JSON schema cannot be turned into a relational schema. The
 * {@link Kind} tells callers what went wrong; the offending type and field
 * names are kept for the error message and for tests.
 */
public class SchemaException extends Exception {

    public enum Kind {
        CYCLIC_INHERITANCE,
        UNSUPPORTED_COMBINATOR,
        UNRESOLVED_REFERENCE,
        COLUMN_TYPE_CONFLICT,
        MALFORMED_SCHEMA
    }

    private final Kind kind;
    private final String typeName;
    private final String field;
    private final String typeA;
    private final String typeB;

    private SchemaException(Kind kind, String message, String typeName, String field, String typeA, String typeB) {
        super(message);
        this.kind = kind;
        this.typeName = typeName;
        this.field = field;
        this.typeA = typeA;
        this.typeB = typeB;
    }

    public static SchemaException cyclicInheritance(List<String> cycle) {
        return new SchemaException(Kind.CYCLIC_INHERITANCE,
                "Cyclic inheritance: " + String.join(" -> ", cycle), cycle.get(0), null, null, null);
    }

    public static SchemaException unsupportedCombinator(String typeName, String field, String detail) {
        String where = field == null ? typeName : typeName + "." + field;
        return new SchemaException(Kind.UNSUPPORTED_COMBINATOR,
                "Unsupported schema construct in " + where + ": " + detail, typeName, field, null, null);
    }

    public static SchemaException unresolvedReference(String typeName, String reference) {
        return new SchemaException(Kind.UNRESOLVED_REFERENCE,
                "Unresolved reference '" + reference + "' in " + typeName, typeName, null, null, null);
    }

    public static SchemaException columnTypeConflict(String field, String typeA, String typeB) {
        return new SchemaException(Kind.COLUMN_TYPE_CONFLICT,
                "Column '" + field + "' is declared as both " + typeA + " and " + typeB, null, field, typeA, typeB);
    }

    public static SchemaException malformedSchema(String detail) {
        return new SchemaException(Kind.MALFORMED_SCHEMA, "Malformed schema: " + detail, null, null, null, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getField() {
        return field;
    }

    public String getTypeA() {
        return typeA;
    }

    public String getTypeB() {
        return typeB;
    }
}

package de.bsommerfeld.sysml.sql.importer;

/**
 * A fatal import failure. The import transaction has been rolled back when
 * this reaches the caller.
 */
public class ImportException extends Exception {

    public enum Kind {
        /** The input is not a JSON array of records. */
        MALFORMED_DOCUMENT,
        /** A record lacks its identifier or type tag. */
        MALFORMED_ELEMENT,
        /** Two records share an identifier but differ in content. */
        CONFLICTING_ELEMENT,
        /** The database has no {@code elements}/{@code relations} tables. */
        SCHEMA_MISSING,
        /** The input could not be read. */
        IO,
        DATABASE
    }

    private final Kind kind;
    private final String elementId;

    public ImportException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public ImportException(Kind kind, String message, String elementId, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.elementId = elementId;
    }

    static ImportException malformedElement(long index, String elementId, String detail) {
        String where = elementId != null ? "element " + elementId : "record #" + index;
        return new ImportException(Kind.MALFORMED_ELEMENT, "Malformed " + where + ": " + detail, elementId, null);
    }

    static ImportException conflictingElement(String elementId) {
        return new ImportException(Kind.CONFLICTING_ELEMENT,
                "Element " + elementId + " occurs more than once with different content", elementId, null);
    }

    static ImportException database(String action, Throwable cause) {
        return new ImportException(Kind.DATABASE, "Database error while " + action + ": " + cause.getMessage(),
                null, cause);
    }

    public Kind getKind() {
        return kind;
    }

    /** The offending element, if the failure concerns one. */
    public String getElementId() {
        return elementId;
    }
}

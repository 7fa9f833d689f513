package de.bsommerfeld.sysml.sql.schema;

/**
 * One property of a resolved definition.
 *
 * @param name           property name as it appears in element records
 * @param kind           value category
 * @param nullable       whether the schema allows the property to be absent or null
 * @param referencedType target type name for {@link FieldKind#REFERENCE}, may be
 *                       {@code null} when the property accepts several types
 * @param many           {@code true} for arrays of references
 */
public record FieldDescriptor(String name, FieldKind kind, boolean nullable, String referencedType, boolean many) {

    public static FieldDescriptor scalar(String name, FieldKind kind, boolean nullable) {
        return new FieldDescriptor(name, kind, nullable, null, false);
    }

    public static FieldDescriptor reference(String name, String referencedType, boolean nullable, boolean many) {
        return new FieldDescriptor(name, FieldKind.REFERENCE, nullable, referencedType, many);
    }

    public boolean isReference() {
        return kind == FieldKind.REFERENCE;
    }
}

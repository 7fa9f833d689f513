package de.bsommerfeld.sysml.sql.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fully resolved definition: its own fields merged with those of every
 * supertype, in first-seen order.
 *
 * @param name          key of the definition in the schema document
 * @param discriminator the {@code @type} tag records of this definition carry
 * @param kind          object-like or plain value (e.g. an enumeration)
 * @param valueKind     scalar kind of a {@link Kind#VALUE} definition, otherwise {@code null}
 * @param fields        merged fields by name, unmodifiable
 * @param supertypes    direct supertypes in declaration order
 */
public record SchemaDefinition(String name, String discriminator, Kind kind, FieldKind valueKind,
        Map<String, FieldDescriptor> fields, List<String> supertypes) {

    public enum Kind {
        OBJECT,
        VALUE
    }

    public SchemaDefinition {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        supertypes = List.copyOf(supertypes);
    }

    public FieldDescriptor field(String fieldName) {
        return fields.get(fieldName);
    }

    public boolean isObject() {
        return kind == Kind.OBJECT;
    }
}

package de.bsommerfeld.sysml.sql.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Result of {@link SchemaResolver#resolve}: every definition of the document,
 * keyed and iterated by name in natural order.
 */
public final class ResolvedSchema {

    private final SortedMap<String, SchemaDefinition> definitions;

    ResolvedSchema(SortedMap<String, SchemaDefinition> definitions) {
        this.definitions = Collections.unmodifiableSortedMap(new TreeMap<>(definitions));
    }

    public SchemaDefinition get(String name) {
        return definitions.get(name);
    }

    public Collection<SchemaDefinition> definitions() {
        return definitions.values();
    }

    public int size() {
        return definitions.size();
    }
}

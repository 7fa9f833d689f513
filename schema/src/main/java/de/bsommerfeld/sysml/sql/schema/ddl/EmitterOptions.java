package de.bsommerfeld.sysml.sql.schema.ddl;

import de.bsommerfeld.sysml.sql.core.config.SchemaConfig;
import de.bsommerfeld.sysml.sql.core.domain.RelationConvention;

import java.util.List;
import java.util.Set;

/**
 * Knobs of the {@link DdlEmitter}.
 *
 * @param convention            which definitions are relation-like
 * @param polymorphicProperties names stored in one {@code ANY} column whatever their declared types
 * @param indexedColumns        element columns that get an index when they exist
 */
public record EmitterOptions(RelationConvention convention, Set<String> polymorphicProperties,
        List<String> indexedColumns) {

    public EmitterOptions {
        polymorphicProperties = Set.copyOf(polymorphicProperties);
        indexedColumns = List.copyOf(indexedColumns);
    }

    public static EmitterOptions defaults() {
        return from(new SchemaConfig());
    }

    public static EmitterOptions from(SchemaConfig config) {
        return new EmitterOptions(RelationConvention.from(config), Set.copyOf(config.getPolymorphicProperties()),
                config.getIndexedColumns());
    }
}

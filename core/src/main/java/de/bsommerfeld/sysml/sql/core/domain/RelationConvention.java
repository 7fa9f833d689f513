package de.bsommerfeld.sysml.sql.core.domain;

import de.bsommerfeld.sysml.sql.core.config.SchemaConfig;

import java.util.Set;

/**
 * Tells element-like records apart from relation-like ones. Records whose
 * type tag is listed in {@code relationTypes} are stored in the
 * {@code relations} table, with origin and target read from the two named
 * reference properties. SysML v2 API output needs no relation types: all its
 * references are embedded in element attributes.
 */
public record RelationConvention(Set<String> relationTypes, String originProperty, String targetProperty) {

    public RelationConvention {
        relationTypes = Set.copyOf(relationTypes);
    }

    public static RelationConvention embeddedOnly() {
        return new RelationConvention(Set.of(), "source", "target");
    }

    public static RelationConvention from(SchemaConfig config) {
        return new RelationConvention(Set.copyOf(config.getRelationTypes()),
                config.getOriginProperty(), config.getTargetProperty());
    }

    public boolean isRelationType(String typeTag) {
        return relationTypes.contains(typeTag);
    }
}

package de.bsommerfeld.sysml.sql.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;

/**
 * Controls how JSON schema definitions are mapped onto the
 * {@code elements} and {@code relations} tables.
 */
public class SchemaConfig {

    @JsonProperty("polymorphic-properties")
    @JsonPropertyDescription("Properties declared with different types across definitions, stored in one ANY column")
    private List<String> polymorphicProperties = List.of("value");

    @JsonProperty("relation-types")
    @JsonPropertyDescription("Type tags of records that are stored as rows of the relations table")
    private List<String> relationTypes = List.of();

    @JsonProperty("origin-property")
    @JsonPropertyDescription("Property of a relation record that references its origin (default: source)")
    private String originProperty = "source";

    @JsonProperty("target-property")
    @JsonPropertyDescription("Property of a relation record that references its target (default: target)")
    private String targetProperty = "target";

    @JsonProperty("indexed-columns")
    @JsonPropertyDescription("Element columns that get an index when present in the schema")
    private List<String> indexedColumns = List.of(
            "declaredName", "declaredShortName", "isLibraryElement", "name", "qualifiedName");

    public List<String> getPolymorphicProperties() {
        return polymorphicProperties;
    }

    public List<String> getRelationTypes() {
        return relationTypes;
    }

    public String getOriginProperty() {
        return originProperty;
    }

    public String getTargetProperty() {
        return targetProperty;
    }

    public List<String> getIndexedColumns() {
        return indexedColumns;
    }
}

package de.bsommerfeld.sysml.sql.schema.ddl;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.sysml.sql.core.domain.RelationConvention;
import de.bsommerfeld.sysml.sql.schema.ResolvedSchema;
import de.bsommerfeld.sysml.sql.schema.SchemaException;
import de.bsommerfeld.sysml.sql.schema.SchemaResolver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DdlEmitterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String PARTS = """
            {"$defs": {
              "Identified": {"type": "object", "properties": {"@id": {"type": "string"}}},
              "Element": {"type": "object", "properties": {
                "@id": {"type": "string"}, "@type": {"type": "string", "const": "Element"},
                "name": {"oneOf": [{"type": "string"}, {"type": "null"}]},
                "owner": {"oneOf": [{"$ref": "#/$defs/Identified"}, {"type": "null"}]}}},
              "PartDefinition": {"allOf": [{"$ref": "#/$defs/Element"}, {"properties": {
                "@type": {"const": "PartDefinition"}, "isAbstract": {"type": "boolean"}}}]},
              "PartUsage": {"allOf": [{"$ref": "#/$defs/Element"}, {"properties": {
                "@type": {"const": "PartUsage"},
                "definition": {"type": "array", "items": {"$ref": "#/$defs/Identified"}},
                "multiplicity": {"type": "integer"}, "mass": {"type": "number"},
                "aliasIds": {"type": "array", "items": {"type": "string"}}}}]}
            }}
            """;

    private static ResolvedSchema schema(String json) throws Exception {
        return new SchemaResolver().resolve(MAPPER.readTree(json));
    }

    // -- Columns --

    @Test
    void emit_shouldUnionColumnsInFirstSeenOrder() throws Exception {
        DdlScript script = new DdlEmitter().emit(schema(PARTS));

        assertEquals(List.of("@id", "@type", "name", "isAbstract", "multiplicity", "mass", "aliasIds"),
                script.elements().columnNames());
    }

    @Test
    void emit_shouldMapFieldKindsToColumnTypes() throws Exception {
        TableLayout elements = new DdlEmitter().emit(schema(PARTS)).elements();

        assertEquals(ColumnType.TEXT, elements.column("name").type());
        assertEquals(ColumnType.INTEGER, elements.column("isAbstract").type());
        assertEquals(ColumnType.INTEGER, elements.column("multiplicity").type());
        assertEquals(ColumnType.REAL, elements.column("mass").type());
        assertEquals(ColumnType.TEXT, elements.column("aliasIds").type());
    }

    @Test
    void emit_shouldKeepReferencesOutOfColumns() throws Exception {
        TableLayout elements = new DdlEmitter().emit(schema(PARTS)).elements();

        assertNull(elements.column("owner"));
        assertNull(elements.column("definition"));
        assertEquals(Set.of("owner", "definition"), elements.referenceProperties());
    }

    @Test
    void emit_shouldMakeEveryDataColumnNullable() throws Exception {
        TableLayout elements = new DdlEmitter().emit(schema(PARTS)).elements();

        assertTrue(elements.column("@id").primaryKey());
        assertFalse(elements.column("@id").nullable());
        for (RelationalColumn column : elements.columns().subList(2, elements.columns().size())) {
            assertTrue(column.nullable(), column.name());
            assertFalse(column.primaryKey(), column.name());
        }
    }

    @Test
    void emit_shouldCreateRelationsTableWithForeignKeys() throws Exception {
        TableLayout relations = new DdlEmitter().emit(schema(PARTS)).relations();

        assertEquals(List.of("@id", "@type", "name", "origin_id", "target_id"), relations.columnNames());
        assertEquals("elements", relations.column("origin_id").references());
        assertEquals("elements", relations.column("target_id").references());
    }

    // -- Output --

    @Test
    void emit_shouldBeByteIdenticalAcrossRuns() throws Exception {
        String first = new DdlEmitter().emit(schema(PARTS)).toSql();
        String second = new DdlEmitter().emit(schema(PARTS)).toSql();

        assertEquals(first, second);
    }

    @Test
    void emit_shouldNotDependOnDefinitionOrderInDocument() throws Exception {
        String forward = new DdlEmitter().emit(schema("""
                {"A": {"type": "object", "properties": {"a": {"type": "string"}}},
                 "B": {"type": "object", "properties": {"b": {"type": "string"}}}}
                """)).toSql();
        String backward = new DdlEmitter().emit(schema("""
                {"B": {"type": "object", "properties": {"b": {"type": "string"}}},
                 "A": {"type": "object", "properties": {"a": {"type": "string"}}}}
                """)).toSql();

        assertEquals(forward, backward);
    }

    @Test
    void toSql_shouldRenderStrictTablesAndIndexes() throws Exception {
        String sql = new DdlEmitter().emit(schema(PARTS)).toSql();

        assertTrue(sql.startsWith("-- Generated by sysml-v2-sql"));
        assertTrue(sql.contains("CREATE TABLE IF NOT EXISTS \"elements\" (\n\t\"@id\" TEXT NOT NULL PRIMARY KEY,\n"));
        assertTrue(sql.contains("\t\"mass\" REAL,\n"));
        assertTrue(sql.contains("\"origin_id\" TEXT NOT NULL REFERENCES \"elements\"(\"@id\") DEFERRABLE INITIALLY DEFERRED"));
        assertTrue(sql.contains(") STRICT;"));
        assertTrue(sql.contains("CREATE INDEX IF NOT EXISTS \"elements.@type\" ON \"elements\" (\"@type\");"));
        assertTrue(sql.contains("CREATE INDEX IF NOT EXISTS \"elements.name\" ON \"elements\" (\"name\");"));
        assertFalse(sql.contains("elements.qualifiedName"));
        assertTrue(sql.endsWith("(\"target_id\");\n"));
    }

    // -- Conflicts --

    @Test
    void emit_shouldRejectColumnTypeConflict() throws Exception {
        ResolvedSchema conflicting = schema("""
                {"A": {"type": "object", "properties": {"size": {"type": "string"}}},
                 "B": {"type": "object", "properties": {"size": {"type": "number"}}}}
                """);

        SchemaException e = assertThrows(SchemaException.class, () -> new DdlEmitter().emit(conflicting));

        assertEquals(SchemaException.Kind.COLUMN_TYPE_CONFLICT, e.getKind());
        assertEquals("size", e.getField());
        assertEquals("TEXT", e.getTypeA());
        assertEquals("REAL", e.getTypeB());
    }

    @Test
    void emit_shouldTreatBooleanAndIntegerAsSameColumnType() throws Exception {
        DdlScript script = new DdlEmitter().emit(schema("""
                {"A": {"type": "object", "properties": {"flag": {"type": "boolean"}}},
                 "B": {"type": "object", "properties": {"flag": {"type": "integer"}}}}
                """));

        assertEquals(ColumnType.INTEGER, script.elements().column("flag").type());
    }

    @Test
    void emit_shouldRejectReferenceAndScalarUnderOneName() throws Exception {
        ResolvedSchema conflicting = schema("""
                {"T": {"type": "object", "properties": {"@id": {"type": "string"}}},
                 "A": {"type": "object", "properties": {"target": {"$ref": "T"}}},
                 "B": {"type": "object", "properties": {"target": {"type": "string"}}}}
                """);

        SchemaException e = assertThrows(SchemaException.class, () -> new DdlEmitter().emit(conflicting));

        assertEquals(SchemaException.Kind.COLUMN_TYPE_CONFLICT, e.getKind());
        assertEquals("RELATION", e.getTypeA());
        assertEquals("TEXT", e.getTypeB());
    }

    @Test
    void emit_shouldStorePolymorphicPropertiesInAnyColumn() throws Exception {
        DdlScript script = new DdlEmitter().emit(schema("""
                {"T": {"type": "object", "properties": {"@id": {"type": "string"}}},
                 "FeatureValue": {"type": "object", "properties": {"value": {"$ref": "T"}}},
                 "LiteralInteger": {"type": "object", "properties": {"value": {"type": "integer"}}},
                 "LiteralString": {"type": "object", "properties": {"value": {"type": "string"}}}}
                """));

        assertEquals(ColumnType.ANY, script.elements().column("value").type());
        assertTrue(script.elements().referenceProperties().contains("value"));
    }

    // -- Relation-like definitions --

    @Test
    void emit_shouldPlaceRelationLikeDefinitionsInRelationsTable() throws Exception {
        EmitterOptions options = new EmitterOptions(
                new RelationConvention(Set.of("FeatureTyping"), "source", "target"), Set.of(), List.of());
        DdlScript script = new DdlEmitter(options).emit(schema("""
                {"Identified": {"type": "object", "properties": {"@id": {"type": "string"}}},
                 "PartUsage": {"type": "object", "properties": {"declaredName": {"type": "string"}}},
                 "FeatureTyping": {"type": "object", "properties": {
                   "@type": {"const": "FeatureTyping"},
                   "source": {"type": "array", "items": {"$ref": "Identified"}},
                   "target": {"type": "array", "items": {"$ref": "Identified"}},
                   "isImplied": {"type": "boolean"}, "name": {"type": "string"}}}}
                """));

        assertEquals(List.of("@id", "@type", "declaredName"), script.elements().columnNames());
        assertEquals(List.of("@id", "@type", "name", "origin_id", "target_id", "isImplied"),
                script.relations().columnNames());
    }
}

package de.bsommerfeld.sysml.sql.schema.ddl;

import de.bsommerfeld.sysml.sql.core.domain.RelationConvention;
import de.bsommerfeld.sysml.sql.schema.FieldDescriptor;
import de.bsommerfeld.sysml.sql.schema.ResolvedSchema;
import de.bsommerfeld.sysml.sql.schema.SchemaDefinition;
import de.bsommerfeld.sysml.sql.schema.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static de.bsommerfeld.sysml.sql.core.util.SqlIdentifiers.quote;

/**
 * Generates the {@code elements} and {@code relations} tables for a
 * {@link ResolvedSchema}.
 *
 * <p>
 * Each table's columns are the union of the fields of its definitions.
 * Definitions are visited in name order and fields in resolved order, so the
 * column order, and with it the whole script, is identical on every run for
 * the same schema. Reference fields are not columns: the importer lowers them
 * into {@code relations} rows named after the field.
 *
 * <h3>Type conflicts</h3>
 * A name declared with two different storage types fails with
 * {@link SchemaException.Kind#COLUMN_TYPE_CONFLICT}, except for the
 * configured polymorphic properties, which always get an {@code ANY} column.
 */
public class DdlEmitter {

    private static final Logger LOG = LoggerFactory.getLogger(DdlEmitter.class);

    public static final String ELEMENTS = "elements";
    public static final String RELATIONS = "relations";
    public static final String ID = "@id";
    public static final String TYPE = "@type";
    public static final String NAME = "name";
    public static final String ORIGIN_ID = "origin_id";
    public static final String TARGET_ID = "target_id";

    private final EmitterOptions options;

    public DdlEmitter() {
        this(EmitterOptions.defaults());
    }

    public DdlEmitter(EmitterOptions options) {
        this.options = options;
    }

    public DdlScript emit(ResolvedSchema schema) throws SchemaException {
        RelationConvention convention = options.convention();

        ColumnUnion elementColumns = new ColumnUnion(Set.of(ID, TYPE));
        ColumnUnion relationColumns = new ColumnUnion(Set.of(ID, TYPE, NAME, ORIGIN_ID, TARGET_ID,
                convention.originProperty(), convention.targetProperty()));

        int elementTypes = 0;
        int relationTypes = 0;
        for (SchemaDefinition definition : schema.definitions()) {
            if (!definition.isObject()) {
                continue;
            }
            boolean relationLike = convention.isRelationType(definition.discriminator())
                    || convention.isRelationType(definition.name());
            ColumnUnion target = relationLike ? relationColumns : elementColumns;
            for (FieldDescriptor field : definition.fields().values()) {
                target.add(field);
            }
            if (relationLike) {
                relationTypes++;
            } else {
                elementTypes++;
            }
        }

        List<RelationalColumn> elements = new ArrayList<>();
        elements.add(RelationalColumn.primaryKey(ID));
        elements.add(RelationalColumn.required(TYPE));
        elements.addAll(elementColumns.columns());

        List<RelationalColumn> relations = new ArrayList<>();
        relations.add(RelationalColumn.primaryKey(ID));
        relations.add(RelationalColumn.data(TYPE, ColumnType.TEXT));
        relations.add(RelationalColumn.required(NAME));
        relations.add(RelationalColumn.foreignKey(ORIGIN_ID, ELEMENTS));
        relations.add(RelationalColumn.foreignKey(TARGET_ID, ELEMENTS));
        relations.addAll(relationColumns.columns());

        TableLayout elementLayout = new TableLayout(ELEMENTS, elements, elementColumns.references);
        TableLayout relationLayout = new TableLayout(RELATIONS, relations, relationColumns.references);

        List<String> statements = new ArrayList<>();
        statements.add(createTable(elementLayout));
        statements.add(createTable(relationLayout));
        statements.add(createIndex(ELEMENTS, TYPE));
        for (String column : options.indexedColumns()) {
            if (elementLayout.column(column) != null) {
                statements.add(createIndex(ELEMENTS, column));
            }
        }
        statements.add(createIndex(RELATIONS, NAME));
        statements.add(createIndex(RELATIONS, ORIGIN_ID));
        statements.add(createIndex(RELATIONS, TARGET_ID));

        LOG.info("Generated {} element columns from {} definitions, {} relation columns from {} definitions",
                elements.size(), elementTypes, relations.size(), relationTypes);
        return new DdlScript(statements, elementLayout, relationLayout);
    }

    static String createTable(TableLayout layout) {
        StringBuilder sql = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
                .append(quote(layout.name())).append(" (\n");
        List<RelationalColumn> columns = layout.columns();
        for (int i = 0; i < columns.size(); i++) {
            sql.append('\t').append(columns.get(i).definition());
            sql.append(i < columns.size() - 1 ? ",\n" : "\n");
        }
        return sql.append(") STRICT;").toString();
    }

    static String createIndex(String table, String column) {
        return "CREATE INDEX IF NOT EXISTS " + quote(table + "." + column)
                + " ON " + quote(table) + " (" + quote(column) + ");";
    }

    /** First-seen-ordered union of the columns of one table. */
    private final class ColumnUnion {

        private final Set<String> reserved;
        private final Map<String, ColumnType> columns = new LinkedHashMap<>();
        private final Set<String> references = new LinkedHashSet<>();

        ColumnUnion(Set<String> reserved) {
            this.reserved = reserved;
        }

        void add(FieldDescriptor field) throws SchemaException {
            String name = field.name();
            if (reserved.contains(name)) {
                return;
            }
            if (options.polymorphicProperties().contains(name)) {
                columns.putIfAbsent(name, ColumnType.ANY);
                if (field.isReference()) {
                    references.add(name);
                }
                return;
            }
            if (field.isReference()) {
                ColumnType existing = columns.get(name);
                if (existing != null) {
                    throw SchemaException.columnTypeConflict(name, existing.name(), "RELATION");
                }
                references.add(name);
                return;
            }

            ColumnType type = ColumnType.of(field.kind());
            if (references.contains(name)) {
                throw SchemaException.columnTypeConflict(name, "RELATION", type.name());
            }
            ColumnType existing = columns.putIfAbsent(name, type);
            if (existing != null && existing != type) {
                throw SchemaException.columnTypeConflict(name, existing.name(), type.name());
            }
        }

        List<RelationalColumn> columns() {
            List<RelationalColumn> result = new ArrayList<>();
            columns.forEach((name, type) -> result.add(RelationalColumn.data(name, type)));
            return result;
        }
    }
}

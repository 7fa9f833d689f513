package de.bsommerfeld.sysml.sql.importer;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Stopwatch;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sysml.sql.core.domain.Element;
import de.bsommerfeld.sysml.sql.core.domain.Relation;
import de.bsommerfeld.sysml.sql.core.domain.RelationConvention;
import de.bsommerfeld.sysml.sql.core.event.ApplicationEventBus;
import de.bsommerfeld.sysml.sql.core.event.SyncEvents;
import de.bsommerfeld.sysml.sql.core.util.CanonicalJson;
import de.bsommerfeld.sysml.sql.db.DatabaseService;
import de.bsommerfeld.sysml.sql.db.TableColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Writes a collection of element records into the {@code elements} and
 * {@code relations} tables.
 *
 * <h3>Two passes</h3>
 * The first pass writes one {@code elements} row per element and records
 * every known id with its type. Relations originating from the imported
 * elements are then deleted, and the second pass writes one
 * {@code relations} row per reference, now that every target's type is
 * known. A target outside the collection resolves against the elements
 * already stored, so importing part of a model keeps its links into the
 * rest. Targets missing from both become {@link DanglingReference}s in the
 * report instead of failing the import.
 *
 * <h3>Atomicity</h3>
 * Both passes run in a single transaction. Any {@link ImportException}
 * rolls it back, leaving the database as it was. Rows are written with
 * {@code INSERT OR REPLACE}, so importing the same collection twice yields
 * the same database state.
 *
 * <pre>
 * importElements()
 *   ├ enableForeignKeys / prepareBulkInsert
 *   ├ BEGIN
 *   │   ├ pass 1: records → elements rows
 *   │   ├ delete relations of re-imported elements
 *   │   └ pass 2: references → relations rows
 *   ├ COMMIT
 *   └ finishBulkInsert / ANALYZE [/ VACUUM]
 * </pre>
 */
@Singleton
public class ElementImporter {

    private static final Logger LOG = LoggerFactory.getLogger(ElementImporter.class);

    static final String ELEMENTS = "elements";
    static final String RELATIONS = "relations";
    static final String NAME = "name";
    static final String ORIGIN_ID = "origin_id";
    static final String TARGET_ID = "target_id";

    /** Rows between two progress events. */
    static final int PROGRESS_INTERVAL = 1000;

    private static final Pattern BOOLEAN_COLUMN = Pattern.compile("is[A-Z].*");
    private static final HashFunction DIGEST = Hashing.sha256();

    private final DatabaseService database;
    private final ApplicationEventBus eventBus;

    @Inject
    public ElementImporter(DatabaseService database, ApplicationEventBus eventBus) {
        this.database = database;
        this.eventBus = eventBus;
    }

    public ImportReport importElements(ElementSource source, ImporterConfiguration config) throws ImportException {
        Stopwatch stopwatch = Stopwatch.createStarted();
        LOG.info("Importing elements from {}", source.describe());

        List<TableColumn> elementColumns;
        List<TableColumn> relationColumns;
        try {
            elementColumns = database.tableColumns(ELEMENTS);
            relationColumns = database.tableColumns(RELATIONS);
        } catch (SQLException e) {
            throw ImportException.database("reading the table layout", e);
        }
        if (elementColumns.isEmpty() || relationColumns.isEmpty()) {
            throw new ImportException(ImportException.Kind.SCHEMA_MISSING,
                    "The database has no elements/relations tables, run init-db first");
        }

        try {
            database.enableForeignKeys();
            database.prepareBulkInsert();
        } catch (SQLException e) {
            throw ImportException.database("preparing the import", e);
        }

        Run run = new Run(config, elementColumns, relationColumns, stopwatch);
        try {
            database.beginTransaction();
            run.writeElements(source);
            int stale = database.deleteWhereIn(RELATIONS, ORIGIN_ID, run.typeById.keySet());
            LOG.debug("Deleted {} relations of re-imported elements", stale);
            run.writeRelations(source);
            database.commit();
        } catch (ImportException e) {
            abort(e);
            throw e;
        } catch (SQLException e) {
            ImportException failure = ImportException.database("writing the import", e);
            abort(failure);
            throw failure;
        }

        try {
            database.finishBulkInsert();
            database.optimize(config.vacuum());
        } catch (SQLException e) {
            throw ImportException.database("optimizing the database", e);
        }

        ImportReport report = run.report(stopwatch.elapsed());
        eventBus.post(new SyncEvents.ImportFinishedEvent(report.elements(), report.relations(),
                report.danglingReferences().size(), report.elapsed()));
        LOG.info(report.summary());
        return report;
    }

    private void abort(ImportException failure) {
        LOG.error("Import failed, rolling back: {}", failure.getMessage());
        try {
            database.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
        try {
            database.finishBulkInsert();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    /** State of one import run. */
    private final class Run {

        private final RelationConvention convention;
        private final boolean lenient;
        private final List<TableColumn> elementColumns;
        private final List<String> elementColumnNames = new ArrayList<>();
        private final Map<String, TableColumn> elementColumnsByName = new HashMap<>();
        private final Map<String, TableColumn> relationColumnsByName = new HashMap<>();
        private final Stopwatch stopwatch;

        /** Element ids of this collection with their type tags, in document order. */
        final Map<String, String> typeById = new LinkedHashMap<>();
        /** Types looked up in the database for targets outside the collection; null when absent. */
        private final Map<String, String> storedTypes = new HashMap<>();
        private final Map<String, HashCode> digests = new HashMap<>();
        private final Set<String> relationRecordIds = new HashSet<>();
        private final Set<String> writtenInPass2 = new HashSet<>();

        private long elements;
        private long relations;
        private final List<DanglingReference> dangling = new ArrayList<>();
        private final Set<String> unmapped = new TreeSet<>();
        private final Map<String, Integer> nulled = new TreeMap<>();

        Run(ImporterConfiguration config, List<TableColumn> elementColumns, List<TableColumn> relationColumns,
                Stopwatch stopwatch) {
            this.convention = config.convention();
            this.lenient = config.sysideAutomatorCompatMode();
            this.elementColumns = elementColumns;
            this.stopwatch = stopwatch;
            for (TableColumn column : elementColumns) {
                elementColumnNames.add(column.name());
                elementColumnsByName.put(column.name(), column);
            }
            for (TableColumn column : relationColumns) {
                relationColumnsByName.put(column.name(), column);
            }
        }

        // -- Pass 1 --

        void writeElements(ElementSource source) throws ImportException {
            source.forEach((record, index) -> {
                Element element = ElementReader.read(record, index);
                if (isDuplicate(element.id(), record)) {
                    LOG.debug("Skipping identical duplicate of {}", element.id());
                    return;
                }
                if (convention.isRelationType(element.type())) {
                    relationRecordIds.add(element.id());
                    return;
                }
                typeById.put(element.id(), element.type());
                upsert(ELEMENTS, elementColumnNames, elementRow(element));
                elements++;
                if (elements % PROGRESS_INTERVAL == 0) {
                    eventBus.post(new SyncEvents.ImportProgressEvent(ELEMENTS, elements, stopwatch.elapsed()));
                }
            });
            LOG.debug("Wrote {} element rows", elements);
        }

        private boolean isDuplicate(String id, JsonNode record) throws ImportException {
            HashCode digest = DIGEST.hashString(CanonicalJson.write(record), StandardCharsets.UTF_8);
            HashCode previous = digests.putIfAbsent(id, digest);
            if (previous == null) {
                return false;
            }
            if (!previous.equals(digest)) {
                throw ImportException.conflictingElement(id);
            }
            return true;
        }

        private List<Object> elementRow(Element element) {
            Map<String, Object> values = new HashMap<>();
            values.put(Element.ID, element.id());
            values.put(Element.TYPE, element.type());
            element.properties().forEach((name, value) -> {
                TableColumn column = elementColumnsByName.get(name);
                if (column == null) {
                    if (!References.isAbsent(value) && References.targets(value, lenient) == null) {
                        unmapped.add(name);
                    }
                } else if (References.targets(value, lenient) == null) {
                    values.put(name, convert(column, value));
                }
            });
            List<Object> row = new ArrayList<>(elementColumns.size());
            for (String name : elementColumnNames) {
                row.add(values.get(name));
            }
            return row;
        }

        private Object convert(TableColumn column, JsonNode value) {
            boolean coerce = lenient && BOOLEAN_COLUMN.matcher(column.name()).matches();
            try {
                return ColumnValues.convert(value, column.type(), coerce);
            } catch (IllegalArgumentException e) {
                if (nulled.merge(column.name(), 1, Integer::sum) == 1) {
                    LOG.warn("Storing NULL in column '{}': {}", column.name(), e.getMessage());
                }
                return null;
            }
        }

        // -- Pass 2 --

        void writeRelations(ElementSource source) throws ImportException {
            source.forEach((record, index) -> {
                Element element = ElementReader.read(record, index);
                if (!writtenInPass2.add(element.id())) {
                    return;
                }
                if (relationRecordIds.contains(element.id())) {
                    writeRelationRecord(element, index);
                } else {
                    writeEmbeddedReferences(element);
                }
            });
            LOG.debug("Wrote {} relation rows, {} dangling references", relations, dangling.size());
        }

        private void writeEmbeddedReferences(Element element) throws ImportException {
            Set<String> written = new LinkedHashSet<>();
            for (Map.Entry<String, JsonNode> property : element.properties().entrySet()) {
                List<String> targets = References.targets(property.getValue(), lenient);
                if (targets == null) {
                    continue;
                }
                for (String targetId : targets) {
                    String targetType = typeOf(targetId);
                    Relation relation = Relation.lowered(element.id(), property.getKey(), targetId, targetType);
                    if (targetType == null) {
                        dangle(relation);
                    } else if (written.add(relation.id())) {
                        writeRelation(relation, Map.of());
                    }
                }
            }
        }

        private void writeRelationRecord(Element record, long index) throws ImportException {
            String originId = singleTarget(record, convention.originProperty(), index);
            String targetId = singleTarget(record, convention.targetProperty(), index);
            Relation relation = new Relation(record.id(), record.type(), record.type(), originId, targetId);
            if (typeOf(originId) == null || typeOf(targetId) == null) {
                dangle(relation);
                return;
            }
            Map<String, Object> extra = new HashMap<>();
            record.properties().forEach((name, value) -> {
                if (name.equals(convention.originProperty()) || name.equals(convention.targetProperty())) {
                    return;
                }
                TableColumn column = relationColumnsByName.get(name);
                if (column == null || isFrameworkRelationColumn(name)) {
                    if (!References.isAbsent(value)) {
                        unmapped.add(name);
                    }
                } else {
                    extra.put(name, convert(column, value));
                }
            });
            writeRelation(relation, extra);
        }

        private String typeOf(String elementId) throws ImportException {
            String type = typeById.get(elementId);
            if (type != null || relationRecordIds.contains(elementId)) {
                return type;
            }
            if (!storedTypes.containsKey(elementId)) {
                try {
                    storedTypes.put(elementId, database.elementType(elementId));
                } catch (SQLException e) {
                    throw ImportException.database("looking up element " + elementId, e);
                }
            }
            return storedTypes.get(elementId);
        }

        private String singleTarget(Element record, String property, long index) throws ImportException {
            List<String> targets = References.targets(record.property(property), lenient);
            if (targets == null || targets.size() != 1) {
                throw ImportException.malformedElement(index, record.id(),
                        "relation record without a single '" + property + "' reference");
            }
            return targets.get(0);
        }

        private boolean isFrameworkRelationColumn(String name) {
            return Element.ID.equals(name) || Element.TYPE.equals(name) || NAME.equals(name)
                    || ORIGIN_ID.equals(name) || TARGET_ID.equals(name);
        }

        private void dangle(Relation relation) {
            DanglingReference reference = new DanglingReference(relation.id(), relation.originId(),
                    relation.name(), relation.targetId());
            LOG.debug("Dangling reference {}", reference);
            dangling.add(reference);
        }

        private void writeRelation(Relation relation, Map<String, Object> extra) throws ImportException {
            List<String> columns = new ArrayList<>(List.of(Element.ID, Element.TYPE, NAME, ORIGIN_ID, TARGET_ID));
            List<Object> values = new ArrayList<>(List.of(relation.id(), relation.type(), relation.name(),
                    relation.originId(), relation.targetId()));
            new TreeMap<>(extra).forEach((name, value) -> {
                columns.add(name);
                values.add(value);
            });
            upsert(RELATIONS, columns, values);
            relations++;
            if (relations % PROGRESS_INTERVAL == 0) {
                eventBus.post(new SyncEvents.ImportProgressEvent(RELATIONS, relations, stopwatch.elapsed()));
            }
        }

        private void upsert(String table, List<String> columns, List<Object> values) throws ImportException {
            try {
                database.upsert(table, columns, values);
            } catch (SQLException e) {
                throw ImportException.database("writing to " + table, e);
            }
        }

        ImportReport report(Duration elapsed) {
            if (!unmapped.isEmpty()) {
                LOG.warn("Attributes without a column were not imported: {}", unmapped);
            }
            if (!dangling.isEmpty()) {
                LOG.warn("Skipped {} references to elements neither imported nor stored", dangling.size());
            }
            return new ImportReport(elements, relations, dangling, new TreeSet<>(unmapped), nulled, elapsed);
        }
    }
}

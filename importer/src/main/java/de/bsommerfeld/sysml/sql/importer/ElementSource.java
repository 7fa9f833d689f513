package de.bsommerfeld.sysml.sql.importer;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A collection of raw element records that can be walked more than once.
 * The importer makes two passes, so a source must yield the same records in
 * the same order every time.
 */
public interface ElementSource {

    @FunctionalInterface
    interface RecordVisitor {
        void visit(JsonNode record, long index) throws ImportException;
    }

    void forEach(RecordVisitor visitor) throws ImportException;

    /** Human readable origin for log messages. */
    String describe();

    static ElementSource of(List<? extends JsonNode> records) {
        List<JsonNode> snapshot = List.copyOf(records);
        return new ElementSource() {
            @Override
            public void forEach(RecordVisitor visitor) throws ImportException {
                long index = 0;
                for (JsonNode record : snapshot) {
                    visitor.visit(record, index++);
                }
            }

            @Override
            public String describe() {
                return snapshot.size() + " fetched records";
            }
        };
    }
}

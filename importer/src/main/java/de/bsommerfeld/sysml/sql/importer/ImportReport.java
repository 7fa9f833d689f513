package de.bsommerfeld.sysml.sql.importer;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Outcome of a successful import.
 *
 * @param elements           element rows written
 * @param relations          relation rows written
 * @param danglingReferences references skipped because their target is unknown
 * @param unmappedAttributes attribute names that are neither a column nor a reference
 * @param nulledValues       per column, values stored as NULL because they did not fit its type
 * @param elapsed            wall-clock duration of the import
 */
public record ImportReport(long elements, long relations, List<DanglingReference> danglingReferences,
        SortedSet<String> unmappedAttributes, Map<String, Integer> nulledValues, Duration elapsed) {

    public ImportReport {
        danglingReferences = List.copyOf(danglingReferences);
        unmappedAttributes = Collections.unmodifiableSortedSet(new TreeSet<>(unmappedAttributes));
        nulledValues = Collections.unmodifiableMap(new TreeMap<>(nulledValues));
    }

    public String summary() {
        StringBuilder summary = new StringBuilder()
                .append("Imported ").append(elements).append(" elements and ")
                .append(relations).append(" relations in ").append(elapsed.toMillis()).append(" ms");
        if (!danglingReferences.isEmpty()) {
            summary.append(", skipped ").append(danglingReferences.size()).append(" dangling references");
        }
        if (!unmappedAttributes.isEmpty()) {
            summary.append(", ignored attributes ").append(unmappedAttributes);
        }
        return summary.toString();
    }
}

package de.bsommerfeld.sysml.sql.schema.ddl;

import java.util.List;
import java.util.Set;

/**
 * Columns of one generated table, plus the attribute names whose values are
 * lowered into relation rows rather than stored in a column.
 */
public record TableLayout(String name, List<RelationalColumn> columns, Set<String> referenceProperties) {

    public TableLayout {
        columns = List.copyOf(columns);
        referenceProperties = Set.copyOf(referenceProperties);
    }

    public RelationalColumn column(String columnName) {
        for (RelationalColumn column : columns) {
            if (column.name().equals(columnName)) {
                return column;
            }
        }
        return null;
    }

    public List<String> columnNames() {
        return columns.stream().map(RelationalColumn::name).toList();
    }
}

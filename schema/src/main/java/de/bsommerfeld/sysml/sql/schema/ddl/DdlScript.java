package de.bsommerfeld.sysml.sql.schema.ddl;

import java.util.List;

/**
 * The generated schema: one statement per table or index, in execution order.
 */
public record DdlScript(List<String> statements, TableLayout elements, TableLayout relations) {

    static final String HEADER = "-- Generated by sysml-v2-sql json-schema-to-sql-schema. Do not edit by hand.\n";

    public DdlScript {
        statements = List.copyOf(statements);
    }

    /** The complete script. Every statement ends with {@code ;} and a line break. */
    public String toSql() {
        return HEADER + String.join("\n", statements.stream().map(s -> s + "\n").toList());
    }
}

/**
 * JSON schema to relational schema translation.
 *
 * <p>
 * {@link de.bsommerfeld.sysml.sql.schema.SchemaResolver} flattens the
 * definitions of a SysML v2 {@code schemas.json} into
 * {@link de.bsommerfeld.sysml.sql.schema.SchemaDefinition}s;
 * {@link de.bsommerfeld.sysml.sql.schema.ddl.DdlEmitter} folds those into the
 * {@code elements} and {@code relations} tables.
 */
package de.bsommerfeld.sysml.sql.schema;

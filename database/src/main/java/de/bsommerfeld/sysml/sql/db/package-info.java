/**
 * Persistence layer: the {@link de.bsommerfeld.sysml.sql.db.DatabaseService}
 * gateway and its SQLite implementation.
 *
 * <h2>Schema</h2>
 *
 * <pre>
 * elements                                relations
 * ┌──────────────────────────────┐        ┌───────────────────────────┐
 * │ "@id"   TEXT PK              │◄───────┤ origin_id  TEXT FK        │
 * │ "@type" TEXT NOT NULL        │◄───────┤ target_id  TEXT FK        │
 * │ one nullable column per      │        │ "@id"      TEXT PK        │
 * │ non-reference attribute      │        │ "@type"    TEXT           │
 * │ (TEXT / INTEGER / REAL / ANY)│        │ name       TEXT NOT NULL  │
 * └──────────────────────────────┘        └───────────────────────────┘
 * </pre>
 *
 * <p>
 * Both tables are {@code STRICT}. Foreign keys are {@code DEFERRABLE
 * INITIALLY DEFERRED}: inside the import transaction elements may be
 * replaced before their relations are rewritten, the check happens at
 * commit.
 *
 * <h2>SQL resources</h2>
 * <ul>
 * <li>{@code schema.sql}: bundled DDL, applied by {@code init-db}</li>
 * <li>{@code sql/*.sql}: pragmas and introspection, loaded through
 * {@link de.bsommerfeld.sysml.sql.db.SqlLoader}</li>
 * </ul>
 */
package de.bsommerfeld.sysml.sql.db;

package de.bsommerfeld.sysml.sql.db;

import java.sql.SQLException;
import java.util.Collection;
import java.util.List;

/**
 * The only way the rest of the application touches the database: schema
 * scripts, column introspection, keyed upserts and deletes, and explicit
 * transactions. Implementations serialize all calls, there is a single
 * writer per database.
 *
 * <p>
 * Identifiers passed in (table and column names) are quoted by the
 * implementation; values are always bound as parameters.
 */
public interface DatabaseService extends AutoCloseable {

    /** Executes one DDL statement. */
    void executeDdl(String statement) throws SQLException;

    /**
     * Executes a multi-statement script atomically. When no transaction is
     * open, the script runs in its own one.
     *
     * @return number of statements executed
     */
    int executeScript(String script) throws SQLException;

    /** Columns of {@code table} in declaration order; empty if the table does not exist. */
    List<TableColumn> tableColumns(String table) throws SQLException;

    /**
     * Inserts a row, replacing any existing row with the same primary key.
     * {@code values} are bound positionally to {@code columns}; {@code null}
     * stores SQL NULL.
     */
    void upsert(String table, List<String> columns, List<Object> values) throws SQLException;

    /**
     * Deletes every row whose {@code column} equals one of {@code values}.
     *
     * @return number of rows deleted
     */
    int deleteWhereIn(String table, String column, Collection<String> values) throws SQLException;

    long countRows(String table) throws SQLException;

    /** Type tag of the stored element with this id, or {@code null} if there is none. */
    String elementType(String elementId) throws SQLException;

    void beginTransaction() throws SQLException;

    void commit() throws SQLException;

    void rollback() throws SQLException;

    /** Turns on foreign key enforcement. Must be called outside a transaction. */
    void enableForeignKeys() throws SQLException;

    /** Relaxes durability for a large import. Paired with {@link #finishBulkInsert()}. */
    void prepareBulkInsert() throws SQLException;

    void finishBulkInsert() throws SQLException;

    /** Refreshes query planner statistics and optionally compacts the file. */
    void optimize(boolean vacuum) throws SQLException;

    @Override
    void close() throws SQLException;
}

package de.bsommerfeld.sysml.sql.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import static de.bsommerfeld.sysml.sql.core.util.SqlIdentifiers.quote;

/**
 * SQLite-backed {@link DatabaseService}.
 *
 * <p>
 * Fixed SQL (pragmas, introspection) lives in {@code .sql} files loaded via
 * {@link SqlLoader}; statements over the generated tables are assembled from
 * quoted identifiers and bound parameters.
 *
 * <h3>Connection strategy</h3>
 * One {@link Connection} is opened lazily and kept until {@link #close()}.
 * A transaction spans many calls, so it has to be the same connection, and
 * an in-memory database only lives as long as its connection. Prepared
 * upsert statements are cached per SQL text for the same reason.
 *
 * <h3>Single writer</h3>
 * Every public method is {@code synchronized}.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #beginTransaction()} switches auto-commit off until
 * {@link #commit()} or {@link #rollback()}. Outside of it, scripts run in a
 * transaction of their own and single statements auto-commit.
 *
 * @see SqlLoader
 */
@Singleton
public class SqlDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);

    /** Values per {@code IN (...)} list, well below SQLite's variable limit. */
    static final int IN_LIST_CHUNK = 500;

    private final String dbUrl;
    private final Map<String, PreparedStatement> statements = new HashMap<>();
    private Connection connection;
    private boolean inTransaction;

    @Inject
    public SqlDatabaseService(@Named("database.url") String dbUrl) {
        this.dbUrl = dbUrl;
    }

    public static SqlDatabaseService forFile(Path file) {
        return new SqlDatabaseService("jdbc:sqlite:" + file.toAbsolutePath());
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    private Connection connection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            LOG.info("Opening database at {}", dbUrl);
            connection = getConnection();
        }
        return connection;
    }

    // =====================================================================
    // Schema
    // =====================================================================

    @Override
    public synchronized void executeDdl(String statement) throws SQLException {
        try (Statement stmt = connection().createStatement()) {
            stmt.execute(statement);
        }
    }

    @Override
    public synchronized int executeScript(String script) throws SQLException {
        List<String> parts = SqlLoader.split(script);
        boolean ownTransaction = !inTransaction;
        if (ownTransaction) {
            beginTransaction();
        }
        try (Statement stmt = connection().createStatement()) {
            for (String sql : parts) {
                stmt.execute(sql);
            }
        } catch (SQLException e) {
            if (ownTransaction) {
                rollback();
            }
            throw e;
        }
        if (ownTransaction) {
            commit();
        }
        LOG.debug("Executed {} statements", parts.size());
        return parts.size();
    }

    @Override
    public synchronized List<TableColumn> tableColumns(String table) throws SQLException {
        List<TableColumn> columns = new ArrayList<>();
        try (PreparedStatement ps = connection().prepareStatement(SqlLoader.load("select-table-columns"))) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    columns.add(new TableColumn(rs.getString(1), rs.getString(2), rs.getInt(3) != 0, rs.getInt(4) != 0));
                }
            }
        }
        return columns;
    }

    // =====================================================================
    // Rows
    // =====================================================================

    @Override
    public synchronized void upsert(String table, List<String> columns, List<Object> values) throws SQLException {
        if (columns.size() != values.size()) {
            throw new IllegalArgumentException(columns.size() + " columns but " + values.size() + " values");
        }
        PreparedStatement ps = prepared(upsertSql(table, columns));
        for (int i = 0; i < values.size(); i++) {
            ps.setObject(i + 1, values.get(i));
        }
        ps.executeUpdate();
    }

    static String upsertSql(String table, List<String> columns) {
        StringJoiner names = new StringJoiner(", ", "(", ")");
        StringJoiner params = new StringJoiner(", ", "(", ")");
        for (String column : columns) {
            names.add(quote(column));
            params.add("?");
        }
        return "INSERT OR REPLACE INTO " + quote(table) + " " + names + " VALUES " + params;
    }

    @Override
    public synchronized int deleteWhereIn(String table, String column, Collection<String> values) throws SQLException {
        List<String> all = new ArrayList<>(values);
        int deleted = 0;
        for (int from = 0; from < all.size(); from += IN_LIST_CHUNK) {
            List<String> chunk = all.subList(from, Math.min(from + IN_LIST_CHUNK, all.size()));
            StringJoiner params = new StringJoiner(", ", "(", ")");
            chunk.forEach(v -> params.add("?"));
            String sql = "DELETE FROM " + quote(table) + " WHERE " + quote(column) + " IN " + params;
            try (PreparedStatement ps = connection().prepareStatement(sql)) {
                for (int i = 0; i < chunk.size(); i++) {
                    ps.setString(i + 1, chunk.get(i));
                }
                deleted += ps.executeUpdate();
            }
        }
        return deleted;
    }

    @Override
    public synchronized long countRows(String table) throws SQLException {
        try (Statement stmt = connection().createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + quote(table))) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    @Override
    public synchronized String elementType(String elementId) throws SQLException {
        PreparedStatement ps = prepared(SqlLoader.load("select-element-type"));
        ps.setString(1, elementId);
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    private PreparedStatement prepared(String sql) throws SQLException {
        PreparedStatement ps = statements.get(sql);
        if (ps == null || ps.isClosed()) {
            ps = connection().prepareStatement(sql);
            statements.put(sql, ps);
        }
        return ps;
    }

    private void closeCachedStatements() throws SQLException {
        for (PreparedStatement ps : statements.values()) {
            ps.close();
        }
        statements.clear();
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    @Override
    public synchronized void beginTransaction() throws SQLException {
        if (inTransaction) {
            throw new IllegalStateException("A transaction is already open");
        }
        connection().setAutoCommit(false);
        inTransaction = true;
    }

    /**
     * Commits the open transaction. A failed commit (typically a deferred
     * foreign key violation) leaves SQLite's transaction open, so it is
     * rolled back before the exception propagates.
     */
    @Override
    public synchronized void commit() throws SQLException {
        requireTransaction();
        try {
            connection.commit();
        } catch (SQLException e) {
            connection.rollback();
            endTransaction();
            throw e;
        }
        endTransaction();
    }

    /** Rolls back the open transaction; a no-op when none is open. */
    @Override
    public synchronized void rollback() throws SQLException {
        if (!inTransaction) {
            LOG.debug("Rollback requested without an open transaction");
            return;
        }
        try {
            connection.rollback();
        } finally {
            endTransaction();
        }
    }

    private void requireTransaction() {
        if (!inTransaction) {
            throw new IllegalStateException("No transaction is open");
        }
    }

    private void endTransaction() throws SQLException {
        inTransaction = false;
        connection.setAutoCommit(true);
    }

    // =====================================================================
    // Tuning
    // =====================================================================

    @Override
    public synchronized void enableForeignKeys() throws SQLException {
        if (inTransaction) {
            throw new IllegalStateException("Foreign keys cannot be switched inside a transaction");
        }
        executeDdl(SqlLoader.load("enable-foreign-keys"));
    }

    @Override
    public synchronized void prepareBulkInsert() throws SQLException {
        for (String pragma : SqlLoader.loadStatements("bulk-insert-begin")) {
            executeDdl(pragma);
        }
    }

    @Override
    public synchronized void finishBulkInsert() throws SQLException {
        executeDdl(SqlLoader.load("bulk-insert-end"));
    }

    @Override
    public synchronized void optimize(boolean vacuum) throws SQLException {
        if (inTransaction) {
            throw new IllegalStateException("Cannot optimize inside a transaction");
        }
        LOG.info("Analyzing database{}", vacuum ? " and vacuuming" : "");
        executeDdl(SqlLoader.load("analyze"));
        if (vacuum) {
            closeCachedStatements();
            executeDdl(SqlLoader.load("vacuum"));
        }
    }

    @Override
    public synchronized void close() throws SQLException {
        closeCachedStatements();
        if (connection != null && !connection.isClosed()) {
            if (inTransaction) {
                LOG.warn("Closing database with an open transaction, rolling back");
                connection.rollback();
                inTransaction = false;
            }
            connection.close();
        }
    }
}

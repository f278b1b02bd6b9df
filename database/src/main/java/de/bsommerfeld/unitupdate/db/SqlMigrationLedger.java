package de.bsommerfeld.unitupdate.db;

import com.google.common.base.Preconditions;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.unitupdate.core.domain.MigrationLedgerEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@link MigrationLedger} stored in a table of the same SQLite database the
 * migrations operate on. The table name is configurable and validated
 * against {@link #TABLE_NAME} before it is spliced into any statement.
 */
@Singleton
public class SqlMigrationLedger implements MigrationLedger {

    public static final String TABLE_NAME_BINDING = "migration-table";

    private static final Logger LOG = LoggerFactory.getLogger(SqlMigrationLedger.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final SqliteDatabase database;
    private final String table;

    @Inject
    public SqlMigrationLedger(SqliteDatabase database, @Named(TABLE_NAME_BINDING) String table) {
        Preconditions.checkArgument(table != null && TABLE_NAME.matcher(table).matches(),
                "Invalid migration table name: %s", table);
        this.database = database;
        this.table = table;
    }

    @Override
    public String getTable() {
        return table;
    }

    @Override
    public boolean repositoryExists() {
        return database.tableExists(table);
    }

    @Override
    public void createRepository() {
        execute("create-ledger");
        LOG.info("Created migration table '{}'", table);
    }

    @Override
    public void deleteRepository() {
        execute("drop-ledger");
        LOG.info("Dropped migration table '{}'", table);
    }

    @Override
    public List<MigrationLedgerEntry> getRan(String unitPath) {
        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql("select-ledger-for-path"))) {
            ps.setString(1, unitPath);
            return readEntries(ps);
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read migration ledger for " + unitPath, e);
        }
    }

    @Override
    public int nextBatchNumber() {
        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql("select-max-batch"));
                ResultSet rs = ps.executeQuery()) {
            return (rs.next() ? rs.getInt(1) : 0) + 1;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read last batch number", e);
        }
    }

    @Override
    public List<MigrationLedgerEntry> getLastBatch(Collection<String> unitPaths) {
        if (unitPaths.isEmpty())
            return Collections.emptyList();

        String placeholders = String.join(", ", Collections.nCopies(unitPaths.size(), "?"));
        String query = sql("select-last-batch").replace("{paths}", placeholders);

        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(query)) {
            int index = 1;
            // The path list appears twice: outer filter and batch subquery.
            for (int pass = 0; pass < 2; pass++) {
                for (String path : unitPaths) {
                    ps.setString(index++, path);
                }
            }
            return readEntries(ps);
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read last migration batch", e);
        }
    }

    @Override
    public void log(Connection conn, MigrationLedgerEntry entry) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql("insert-ledger-entry"))) {
            ps.setString(1, entry.unitPath());
            ps.setString(2, entry.migrationName());
            ps.setInt(3, entry.batchNumber());
            ps.executeUpdate();
        }
    }

    @Override
    public void delete(Connection conn, MigrationLedgerEntry entry) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql("delete-ledger-entry"))) {
            ps.setString(1, entry.unitPath());
            ps.setString(2, entry.migrationName());
            ps.executeUpdate();
        }
    }

    private String sql(String name) {
        return SqlLoader.loadForTable(name, table);
    }

    private void execute(String statement) {
        try (Connection conn = database.getConnection();
                Statement stmt = conn.createStatement()) {
            stmt.execute(sql(statement));
        } catch (SQLException e) {
            throw new DatabaseException("Failed to run " + statement + " on " + table, e);
        }
    }

    private List<MigrationLedgerEntry> readEntries(PreparedStatement ps) throws SQLException {
        List<MigrationLedgerEntry> entries = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                entries.add(new MigrationLedgerEntry(
                        rs.getString("unit_path"),
                        rs.getString("migration"),
                        rs.getInt("batch")));
            }
        }
        return entries;
    }
}

package de.bsommerfeld.unitupdate.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection source for the SQLite database holding parameters, installed
 * unit versions and the migration ledger.
 *
 * <p>
 * The bookkeeping schema is applied from {@code schema.sql} on construction.
 * Every DDL statement uses {@code IF NOT EXISTS}, so it is safe to re-run.
 * The migration ledger is not part of that schema: its presence is the
 * signal for a first-time install and it is created explicitly by the
 * update coordinator.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level, so pooling provides no
 * benefit.
 */
public class SqliteDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDatabase.class);

    private final String dbUrl;

    public SqliteDatabase(String dbUrl) {
        this.dbUrl = dbUrl;
        initialize();
    }

    /** Opens (and creates if necessary) the database file at {@code file}. */
    public static SqliteDatabase forFile(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new DatabaseException("Failed to create database directory " + parent, e);
        }
        return new SqliteDatabase("jdbc:sqlite:" + file.toAbsolutePath());
    }

    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    public String getUrl() {
        return dbUrl;
    }

    public boolean tableExists(String table) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-table-exists"))) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to look up table " + table, e);
        }
    }

    private void initialize() {
        LOG.info("Initializing database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new DatabaseException("Database initialization failed", e);
        }
    }

    /**
     * Applies the DDL from {@code schema.sql}, one statement at a time, in a
     * single transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql");
                Statement stmt = conn.createStatement()) {

            if (schemaStream == null) {
                throw new SQLException("schema.sql not found in classpath");
            }

            String schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            conn.setAutoCommit(false);
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty())
                    continue;
                stmt.execute(sql.trim());
            }
            conn.commit();
            LOG.debug("Database schema applied.");
        } catch (IOException | SQLException e) {
            conn.rollback();
            throw new SQLException("Schema application failed", e);
        }
    }
}

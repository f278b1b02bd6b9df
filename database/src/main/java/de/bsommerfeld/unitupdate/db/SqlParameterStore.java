package de.bsommerfeld.unitupdate.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.unitupdate.core.param.ParameterStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ParameterStore} backed by the {@code system_parameters} table.
 */
@Singleton
public class SqlParameterStore implements ParameterStore {

    private final SqliteDatabase database;

    @Inject
    public SqlParameterStore(SqliteDatabase database) {
        this.database = database;
    }

    @Override
    public Optional<String> get(String key) {
        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-parameter"))) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read parameter " + key, e);
        }
    }

    @Override
    public void set(String key, String value) {
        if (value == null) {
            remove(key);
            return;
        }
        setAll(Map.of(key, value));
    }

    @Override
    public void setAll(Map<String, String> values) {
        if (values.isEmpty())
            return;

        try (Connection conn = database.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement upsert = conn.prepareStatement(SqlLoader.load("upsert-parameter"));
                    PreparedStatement delete = conn.prepareStatement(SqlLoader.load("delete-parameter"))) {
                for (Map.Entry<String, String> entry : values.entrySet()) {
                    if (entry.getValue() == null) {
                        delete.setString(1, entry.getKey());
                        delete.addBatch();
                    } else {
                        upsert.setString(1, entry.getKey());
                        upsert.setString(2, entry.getValue());
                        upsert.addBatch();
                    }
                }
                upsert.executeBatch();
                delete.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to write parameters " + values.keySet(), e);
        }
    }

    @Override
    public void remove(String key) {
        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-parameter"))) {
            ps.setString(1, key);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to remove parameter " + key, e);
        }
    }
}

package de.bsommerfeld.unitupdate.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.unitupdate.core.domain.InstalledUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link UnitVersionRepository} backed by the {@code unit_versions} table.
 * Timestamps are stored as epoch seconds.
 */
@Singleton
public class SqlUnitVersionRepository implements UnitVersionRepository {

    private static final Logger LOG = LoggerFactory.getLogger(SqlUnitVersionRepository.class);

    private final SqliteDatabase database;
    private final Clock clock;

    @Inject
    public SqlUnitVersionRepository(SqliteDatabase database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public List<InstalledUnit> findAll() {
        List<InstalledUnit> units = new ArrayList<>();
        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-unit-versions"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                units.add(mapUnit(rs));
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load unit versions", e);
        }
        return units;
    }

    @Override
    public Optional<InstalledUnit> find(String code) {
        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-unit-version"))) {
            ps.setString(1, code);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapUnit(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load unit version of " + code, e);
        }
    }

    @Override
    public void recordVersion(String code, String version, String name, String icon) {
        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-unit-version"))) {
            ps.setString(1, code);
            ps.setString(2, version);
            ps.setString(3, name);
            ps.setString(4, icon);
            ps.setLong(5, clock.instant().getEpochSecond());
            ps.executeUpdate();
            LOG.debug("[DB] {} is now at version {}", code, version);
        } catch (SQLException e) {
            throw new DatabaseException("Failed to record version of " + code, e);
        }
    }

    @Override
    public void setFrozen(String code, boolean frozen) {
        updateFlag("update-unit-frozen", code, frozen);
    }

    @Override
    public void setUpdatable(String code, boolean updatable) {
        updateFlag("update-unit-updatable", code, updatable);
    }

    @Override
    public boolean delete(String code) {
        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-unit-version"))) {
            ps.setString(1, code);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to delete version record of " + code, e);
        }
    }

    @Override
    public Optional<Instant> oldestInstall() {
        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-oldest-install"));
                ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                long seconds = rs.getLong(1);
                if (!rs.wasNull())
                    return Optional.of(Instant.ofEpochSecond(seconds));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to query oldest install", e);
        }
    }

    private void updateFlag(String statement, String code, boolean value) {
        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement))) {
            ps.setInt(1, value ? 1 : 0);
            ps.setString(2, code);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to update flags of " + code, e);
        }
    }

    private InstalledUnit mapUnit(ResultSet rs) throws SQLException {
        return new InstalledUnit(
                rs.getString("code"),
                rs.getString("version"),
                rs.getString("name"),
                rs.getString("icon"),
                rs.getInt("is_frozen") != 0,
                rs.getInt("is_updatable") != 0,
                Instant.ofEpochSecond(rs.getLong("created_at")));
    }
}

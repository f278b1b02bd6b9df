package de.bsommerfeld.unitupdate.db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * A reversible schema change owned by one unit.
 *
 * <p>
 * Migrations of a unit are applied in ascending {@link #name()} order, so
 * names should sort chronologically (e.g. {@code 2024_03_01_000000_create_posts}).
 * Each migration runs inside a transaction that the engine commits together
 * with the ledger entry recording it; implementations must not commit or
 * close the connection themselves.
 */
public interface Migration {

    /** Identifier, unique within the owning unit. */
    String name();

    /**
     * Unit version this migration belongs to, or {@code null} if the unit
     * does not version its migrations.
     */
    default String version() {
        return null;
    }

    /**
     * Applies the change.
     *
     * @return informational messages to report after the run; may be empty
     */
    List<String> up(Connection connection) throws SQLException;

    void down(Connection connection) throws SQLException;
}

package de.bsommerfeld.unitupdate.db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Optional capability of a {@link Migratable}: populates initial data after
 * the unit's migrations have been applied.
 */
public interface Seedable {

    /** Origin under which seeder messages are reported. */
    String seederName();

    /**
     * Seeds the data. Runs in its own transaction.
     *
     * @return informational messages to report after the run; may be empty
     */
    List<String> seed(Connection connection) throws SQLException;
}

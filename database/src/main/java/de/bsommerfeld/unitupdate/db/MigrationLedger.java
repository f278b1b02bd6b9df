package de.bsommerfeld.unitupdate.db;

import de.bsommerfeld.unitupdate.core.domain.MigrationLedgerEntry;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;

/**
 * Persistent record of applied migrations.
 *
 * <p>
 * Writes take the caller's {@link Connection} so the ledger row commits or
 * rolls back together with the schema change it records.
 */
public interface MigrationLedger {

    String getTable();

    boolean repositoryExists();

    void createRepository();

    void deleteRepository();

    /** Entries recorded for {@code unitPath}, in application order. */
    List<MigrationLedgerEntry> getRan(String unitPath);

    int nextBatchNumber();

    /**
     * Entries of the highest batch found among {@code unitPaths}, most
     * recently applied first. Empty if none of the paths has entries.
     */
    List<MigrationLedgerEntry> getLastBatch(Collection<String> unitPaths);

    void log(Connection conn, MigrationLedgerEntry entry) throws SQLException;

    void delete(Connection conn, MigrationLedgerEntry entry) throws SQLException;
}

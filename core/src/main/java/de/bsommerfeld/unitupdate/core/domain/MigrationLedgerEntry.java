package de.bsommerfeld.unitupdate.core.domain;

/**
 * One applied migration.
 *
 * @param unitPath      migration path of the owning unit
 * @param migrationName migration identifier, unique within the unit path
 * @param batchNumber   apply invocation the migration belongs to
 */
public record MigrationLedgerEntry(String unitPath, String migrationName, int batchNumber) {
}

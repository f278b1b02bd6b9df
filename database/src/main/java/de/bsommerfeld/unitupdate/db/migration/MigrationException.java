package de.bsommerfeld.unitupdate.db.migration;

import de.bsommerfeld.unitupdate.core.error.UpdateException;

/**
 * A migration or seeder failed. The transaction it ran in was rolled back,
 * earlier migrations of the same batch stay applied.
 */
public class MigrationException extends UpdateException {

    private final String unitCode;

    public MigrationException(String unitCode, String message, Throwable cause) {
        super(message, cause);
        this.unitCode = unitCode;
    }

    public String getUnitCode() {
        return unitCode;
    }
}

package de.bsommerfeld.unitupdate.core.error;

/**
 * Rollback target version has never been applied for the unit.
 */
public class VersionNotFoundException extends UpdateException {

    public VersionNotFoundException(String code, String version) {
        super("Version " + version + " of " + code + " was not found in the migration ledger");
    }
}

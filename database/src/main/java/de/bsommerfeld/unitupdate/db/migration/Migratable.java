package de.bsommerfeld.unitupdate.db.migration;

import de.bsommerfeld.unitupdate.core.domain.UnitType;

import java.util.List;

/**
 * A unit (module or plugin) that owns migrations.
 */
public interface Migratable {

    /** Identifier, e.g. {@code System} or {@code Acme.Blog}. */
    String code();

    UnitType type();

    /** Key under which the unit's migrations are tracked in the ledger. */
    String migrationPath();

    List<Migration> migrations();

    default String name() {
        return code();
    }

    default String icon() {
        return null;
    }
}

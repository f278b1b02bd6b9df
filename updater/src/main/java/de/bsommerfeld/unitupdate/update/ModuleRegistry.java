package de.bsommerfeld.unitupdate.update;

import de.bsommerfeld.unitupdate.db.migration.Migratable;

import java.util.Optional;

/**
 * Base modules of the host application, looked up by the names listed in
 * the {@code modules} configuration. Bound by the host.
 */
public interface ModuleRegistry {

    Optional<Migratable> findModule(String name);
}

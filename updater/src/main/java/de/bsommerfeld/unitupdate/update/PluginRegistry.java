package de.bsommerfeld.unitupdate.update;

import de.bsommerfeld.unitupdate.db.migration.Migratable;

import java.util.List;
import java.util.Optional;

/**
 * Plugins known to the host application. Bound by the host.
 */
public interface PluginRegistry {

    /** Registered plugins in registration order. */
    List<Migratable> getPlugins();

    Optional<Migratable> findByIdentifier(String code);
}

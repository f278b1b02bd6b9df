package de.bsommerfeld.unitupdate.db;

import de.bsommerfeld.unitupdate.core.domain.InstalledUnit;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Locally recorded versions of installed plugins.
 */
public interface UnitVersionRepository {

    /** All records, oldest install first. */
    List<InstalledUnit> findAll();

    Optional<InstalledUnit> find(String code);

    /**
     * Creates the record or moves it to {@code version}. {@code name} and
     * {@code icon} only overwrite stored values when non-null. Flags of an
     * existing record are preserved.
     */
    void recordVersion(String code, String version, String name, String icon);

    void setFrozen(String code, boolean frozen);

    void setUpdatable(String code, boolean updatable);

    /** @return whether a record was removed */
    boolean delete(String code);

    /** Creation time of the oldest record, used as "installed since". */
    Optional<Instant> oldestInstall();
}

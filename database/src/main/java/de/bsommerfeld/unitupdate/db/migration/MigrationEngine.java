package de.bsommerfeld.unitupdate.db.migration;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.unitupdate.core.domain.MigrationLedgerEntry;
import de.bsommerfeld.unitupdate.core.domain.UnitType;
import de.bsommerfeld.unitupdate.core.error.VersionNotFoundException;
import de.bsommerfeld.unitupdate.core.notes.NoteWriter;
import de.bsommerfeld.unitupdate.core.notes.NoticeCollector;
import de.bsommerfeld.unitupdate.db.DatabaseException;
import de.bsommerfeld.unitupdate.db.MigrationLedger;
import de.bsommerfeld.unitupdate.db.SqliteDatabase;
import de.bsommerfeld.unitupdate.db.UnitVersionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies and reverts unit migrations and keeps the ledger in step.
 *
 * <h3>Batches</h3>
 * Every {@link #apply(Migratable)} call that runs at least one migration
 * opens a new batch numbered one above the highest batch in the ledger.
 * {@link #rollbackLastBatch(Collection)} reverts exactly the highest batch
 * found among the given units, so repeated calls unwind history in reverse
 * order of application.
 *
 * <h3>Transactions</h3>
 * Each migration runs in its own transaction together with the insert or
 * delete of its ledger entry. A failing migration leaves the earlier ones of
 * the same batch applied and recorded.
 *
 * <h3>Versions</h3>
 * For plugins the engine keeps the recorded unit version in step with the
 * ledger: after applying or reverting, the version of the last applied
 * versioned migration is written, and the record is removed once nothing of
 * the plugin remains applied.
 */
@Singleton
public class MigrationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationEngine.class);

    private static final Comparator<Migration> BY_NAME = Comparator.comparing(Migration::name);

    private final SqliteDatabase database;
    private final MigrationLedger ledger;
    private final UnitVersionRepository versions;
    private final NoticeCollector notices;

    private NoteWriter notesOutput;

    @Inject
    public MigrationEngine(SqliteDatabase database, MigrationLedger ledger,
            UnitVersionRepository versions, NoticeCollector notices) {
        this.database = database;
        this.ledger = ledger;
        this.versions = versions;
        this.notices = notices;
    }

    /** Progress lines ("Migrated: ...") are written here; {@code null} silences them. */
    public void setNotesOutput(NoteWriter notesOutput) {
        this.notesOutput = notesOutput;
    }

    // =====================================================================
    // Apply
    // =====================================================================

    /**
     * Runs every migration of {@code unit} that is not yet in the ledger, in
     * ascending name order, as one new batch.
     *
     * @return names of the migrations applied by this call
     */
    public List<String> apply(Migratable unit) throws MigrationException {
        ensureRepository();

        Set<String> ran = ranNames(unit);
        List<Migration> pending = sorted(unit).stream()
                .filter(m -> !ran.contains(m.name()))
                .toList();

        if (pending.isEmpty()) {
            LOG.debug("Nothing to migrate for {}", unit.code());
            return List.of();
        }

        int batch = ledger.nextBatchNumber();
        LOG.info("Migrating {} ({} pending, batch {})", unit.code(), pending.size(), batch);

        List<String> applied = new ArrayList<>();
        try {
            for (Migration migration : pending) {
                runUp(unit, migration, batch);
                applied.add(migration.name());
                note("Migrated: " + migration.name());
            }
        } finally {
            if (!applied.isEmpty())
                syncVersion(unit);
        }
        return applied;
    }

    /**
     * Runs the unit's seeder if it has one.
     *
     * @return whether a seeder ran
     */
    public boolean seed(Migratable unit) throws MigrationException {
        if (!(unit instanceof Seedable seedable))
            return false;

        try (Connection conn = database.getConnection()) {
            conn.setAutoCommit(false);
            try {
                List<String> messages = seedable.seed(conn);
                conn.commit();
                notices.addAll(seedable.seederName(), messages);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            throw new MigrationException(unit.code(), "Seeding " + unit.code() + " failed", e);
        }
        LOG.debug("Seeded {}", unit.code());
        return true;
    }

    // =====================================================================
    // Rollback
    // =====================================================================

    /**
     * Reverts the most recent batch recorded for any of {@code units}.
     *
     * @return number of ledger entries removed; 0 once nothing is left
     */
    public int rollbackLastBatch(Collection<? extends Migratable> units) throws MigrationException {
        if (!ledger.repositoryExists())
            return 0;

        Map<String, Migratable> byPath = new LinkedHashMap<>();
        for (Migratable unit : units) {
            byPath.put(unit.migrationPath(), unit);
        }

        List<MigrationLedgerEntry> batch = ledger.getLastBatch(byPath.keySet());
        if (batch.isEmpty())
            return 0;

        Set<Migratable> touched = new LinkedHashSet<>();
        try {
            for (MigrationLedgerEntry entry : batch) {
                Migratable unit = byPath.get(entry.unitPath());
                touched.add(unit);
                runDown(unit, findMigration(unit, entry.migrationName()), entry);
                note("Rolled back: " + entry.migrationName());
            }
        } finally {
            for (Migratable unit : touched) {
                syncVersion(unit);
            }
        }
        return batch.size();
    }

    /**
     * Reverts batches until none of {@code units} has ledger entries left.
     * Entries without a matching migration definition are dropped from the
     * ledger, so the loop always terminates.
     *
     * @return total number of ledger entries removed
     */
    public int rollback(Collection<? extends Migratable> units) throws MigrationException {
        int total = 0;
        int reverted;
        while ((reverted = rollbackLastBatch(units)) > 0) {
            total += reverted;
        }
        return total;
    }

    /** Reverts every migration of a single unit. */
    public int rollback(Migratable unit) throws MigrationException {
        return rollback(List.of(unit));
    }

    /**
     * Reverts the migrations applied after the last migration belonging to
     * {@code targetVersion}, newest first.
     *
     * @return names of the reverted migrations
     * @throws VersionNotFoundException if no applied migration carries that
     *                                  version
     */
    public List<String> rollbackToVersion(Migratable unit, String targetVersion)
            throws MigrationException, VersionNotFoundException {
        Map<String, MigrationLedgerEntry> ran = new LinkedHashMap<>();
        if (ledger.repositoryExists()) {
            for (MigrationLedgerEntry entry : ledger.getRan(unit.migrationPath())) {
                ran.put(entry.migrationName(), entry);
            }
        }

        List<Migration> definitions = sorted(unit);
        int cutoff = -1;
        for (int i = 0; i < definitions.size(); i++) {
            Migration migration = definitions.get(i);
            if (targetVersion.equals(migration.version()) && ran.containsKey(migration.name()))
                cutoff = i;
        }
        if (cutoff < 0)
            throw new VersionNotFoundException(unit.code(), targetVersion);

        List<String> reverted = new ArrayList<>();
        try {
            for (int i = definitions.size() - 1; i > cutoff; i--) {
                Migration migration = definitions.get(i);
                MigrationLedgerEntry entry = ran.get(migration.name());
                if (entry == null)
                    continue;
                runDown(unit, migration, entry);
                reverted.add(migration.name());
                note("Rolled back: " + migration.name());
            }
        } finally {
            if (!reverted.isEmpty())
                syncVersion(unit);
        }
        return reverted;
    }

    // =====================================================================
    // Queries
    // =====================================================================

    /** Version of the last applied versioned migration of {@code unit}. */
    public Optional<String> currentVersion(Migratable unit) {
        if (!ledger.repositoryExists())
            return Optional.empty();

        Set<String> ran = ranNames(unit);
        String current = null;
        for (Migration migration : sorted(unit)) {
            if (migration.version() != null && ran.contains(migration.name()))
                current = migration.version();
        }
        return Optional.ofNullable(current);
    }

    public boolean hasPendingMigrations(Migratable unit) {
        Set<String> ran = ledger.repositoryExists() ? ranNames(unit) : Set.of();
        return unit.migrations().stream().anyMatch(m -> !ran.contains(m.name()));
    }

    // =====================================================================
    // Internals
    // =====================================================================

    private void runUp(Migratable unit, Migration migration, int batch) throws MigrationException {
        try (Connection conn = database.getConnection()) {
            conn.setAutoCommit(false);
            try {
                List<String> messages = migration.up(conn);
                ledger.log(conn, new MigrationLedgerEntry(unit.migrationPath(), migration.name(), batch));
                conn.commit();
                notices.addAll(origin(unit, migration.name()), messages);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            throw new MigrationException(unit.code(),
                    "Migration " + migration.name() + " of " + unit.code() + " failed", e);
        }
    }

    private void runDown(Migratable unit, Migration migration, MigrationLedgerEntry entry)
            throws MigrationException {
        try (Connection conn = database.getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (migration != null) {
                    migration.down(conn);
                } else {
                    LOG.warn("No definition for applied migration {} of {}, removing ledger entry only",
                            entry.migrationName(), unit.code());
                }
                ledger.delete(conn, entry);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            throw new MigrationException(unit.code(),
                    "Rollback of " + entry.migrationName() + " of " + unit.code() + " failed", e);
        }
    }

    /** Writes the plugin's current version, or deletes its record if nothing is applied. */
    private void syncVersion(Migratable unit) throws MigrationException {
        if (unit.type() != UnitType.PLUGIN)
            return;

        try {
            if (ranNames(unit).isEmpty()) {
                versions.delete(unit.code());
                return;
            }
            Optional<String> current = currentVersion(unit);
            if (current.isPresent()) {
                versions.recordVersion(unit.code(), current.get(), unit.name(), unit.icon());
            }
        } catch (DatabaseException e) {
            throw new MigrationException(unit.code(), "Failed to record version of " + unit.code(), e);
        }
    }

    private void ensureRepository() throws MigrationException {
        try {
            if (!ledger.repositoryExists())
                ledger.createRepository();
        } catch (DatabaseException e) {
            throw new MigrationException(null, "Failed to create migration table", e);
        }
    }

    private Set<String> ranNames(Migratable unit) {
        Set<String> names = new HashSet<>();
        for (MigrationLedgerEntry entry : ledger.getRan(unit.migrationPath())) {
            names.add(entry.migrationName());
        }
        return names;
    }

    private static List<Migration> sorted(Migratable unit) {
        List<Migration> migrations = new ArrayList<>(unit.migrations());
        migrations.sort(BY_NAME);
        return migrations;
    }

    private static Migration findMigration(Migratable unit, String name) {
        for (Migration migration : unit.migrations()) {
            if (migration.name().equals(name))
                return migration;
        }
        return null;
    }

    private static String origin(Migratable unit, String migrationName) {
        return unit.code() + "/" + migrationName;
    }

    private void note(String message) {
        if (notesOutput != null)
            notesOutput.writeln(message);
    }
}

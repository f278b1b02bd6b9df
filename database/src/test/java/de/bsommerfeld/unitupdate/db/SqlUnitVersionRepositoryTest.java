package de.bsommerfeld.unitupdate.db;

import de.bsommerfeld.unitupdate.core.domain.InstalledUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SqlUnitVersionRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteDatabase db;
    private SqlUnitVersionRepository repository;

    @BeforeEach
    void setUp() {
        db = SqliteDatabase.forFile(tempDir.resolve("updates.db"));
        repository = new SqlUnitVersionRepository(db, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // -- Records --

    @Test
    void recordVersion_shouldCreateRecordWithDefaults() {
        repository.recordVersion("Acme.Blog", "1.0.0", "Blog", "icon-pencil");

        InstalledUnit unit = repository.find("Acme.Blog").orElseThrow();
        assertEquals("1.0.0", unit.version());
        assertEquals("Blog", unit.name());
        assertEquals("icon-pencil", unit.icon());
        assertFalse(unit.frozen());
        assertTrue(unit.updatable());
        assertEquals(NOW, unit.installedAt());
    }

    @Test
    void recordVersion_shouldKeepFlagsAndNameOnUpdate() {
        repository.recordVersion("Acme.Blog", "1.0.0", "Blog", null);
        repository.setFrozen("Acme.Blog", true);

        repository.recordVersion("Acme.Blog", "1.1.0", null, null);

        InstalledUnit unit = repository.find("Acme.Blog").orElseThrow();
        assertEquals("1.1.0", unit.version());
        assertEquals("Blog", unit.name());
        assertTrue(unit.frozen());
        assertFalse(unit.acceptsUpdates());
    }

    @Test
    void setUpdatable_shouldLockUnit() {
        repository.recordVersion("Acme.Shop", "2.0.0", "Shop", null);
        repository.setUpdatable("Acme.Shop", false);

        assertFalse(repository.find("Acme.Shop").orElseThrow().acceptsUpdates());
    }

    @Test
    void delete_shouldReportWhetherRecordExisted() {
        repository.recordVersion("Acme.Blog", "1.0.0", "Blog", null);

        assertTrue(repository.delete("Acme.Blog"));
        assertFalse(repository.delete("Acme.Blog"));
        assertEquals(Optional.empty(), repository.find("Acme.Blog"));
    }

    // -- Queries --

    @Test
    void findAll_shouldOrderByInstallTime() {
        new SqlUnitVersionRepository(db, Clock.fixed(NOW.plusSeconds(60), ZoneOffset.UTC))
                .recordVersion("Acme.Late", "1.0.0", "Late", null);
        repository.recordVersion("Acme.Early", "1.0.0", "Early", null);

        List<InstalledUnit> all = repository.findAll();
        assertEquals(List.of("Acme.Early", "Acme.Late"), all.stream().map(InstalledUnit::code).toList());
    }

    @Test
    void oldestInstall_shouldBeEmptyWithoutRecords() {
        assertTrue(repository.oldestInstall().isEmpty());
    }

    @Test
    void oldestInstall_shouldReturnEarliestCreation() {
        repository.recordVersion("Acme.Early", "1.0.0", "Early", null);
        new SqlUnitVersionRepository(db, Clock.fixed(NOW.plusSeconds(3600), ZoneOffset.UTC))
                .recordVersion("Acme.Late", "1.0.0", "Late", null);

        assertEquals(Optional.of(NOW), repository.oldestInstall());
    }
}

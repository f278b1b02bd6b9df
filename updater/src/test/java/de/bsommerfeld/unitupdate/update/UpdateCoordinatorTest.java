package de.bsommerfeld.unitupdate.update;

import de.bsommerfeld.unitupdate.core.cache.CacheStore;
import de.bsommerfeld.unitupdate.core.config.UpdaterConfig;
import de.bsommerfeld.unitupdate.core.domain.InstalledUnit;
import de.bsommerfeld.unitupdate.core.domain.UnitType;
import de.bsommerfeld.unitupdate.core.error.ExtractionFailedException;
import de.bsommerfeld.unitupdate.core.error.UnitNotFoundException;
import de.bsommerfeld.unitupdate.core.error.UpdateException;
import de.bsommerfeld.unitupdate.core.notes.NoticeCollector;
import de.bsommerfeld.unitupdate.core.param.ParameterKeys;
import de.bsommerfeld.unitupdate.db.MigrationLedger;
import de.bsommerfeld.unitupdate.db.UnitVersionRepository;
import de.bsommerfeld.unitupdate.db.migration.Migratable;
import de.bsommerfeld.unitupdate.db.migration.Migration;
import de.bsommerfeld.unitupdate.db.migration.MigrationEngine;
import de.bsommerfeld.unitupdate.db.migration.MigrationException;
import de.bsommerfeld.unitupdate.gateway.GatewayClient;
import de.bsommerfeld.unitupdate.product.ProductDetailCache;
import de.bsommerfeld.unitupdate.support.MapParameterStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UpdateCoordinatorTest {

    private static final TestUnit SYSTEM = new TestUnit("System", UnitType.MODULE);
    private static final TestUnit BACKEND = new TestUnit("Backend", UnitType.MODULE);
    private static final TestUnit BLOG = new TestUnit("Acme.Blog", UnitType.PLUGIN);
    private static final TestUnit SHOP = new TestUnit("Acme.Shop", UnitType.PLUGIN);

    @TempDir
    Path tempDir;

    @Mock
    GatewayClient gateway;
    @Mock
    UpdateNegotiator negotiator;
    @Mock
    ProductDetailCache products;
    @Mock
    MigrationEngine engine;
    @Mock
    MigrationLedger ledger;
    @Mock
    UnitVersionRepository versions;
    @Mock
    CacheStore cache;
    @Mock
    ThemeRegistry themes;

    private UpdaterConfig config;
    private MapParameterStore parameters;
    private NoticeCollector notices;
    private List<Migratable> registeredPlugins;
    private List<String> notes;
    private UpdateCoordinator coordinator;

    @BeforeEach
    void setUp() {
        config = new UpdaterConfig();
        config.setModules(List.of("System", "Backend"));
        config.getInstallation().setBaseDirectory(tempDir.toString());

        parameters = new MapParameterStore();
        notices = new NoticeCollector();
        registeredPlugins = new ArrayList<>(List.of(BLOG, SHOP));
        notes = new ArrayList<>();

        PluginRegistry pluginRegistry = new PluginRegistry() {
            @Override
            public List<Migratable> getPlugins() {
                return registeredPlugins;
            }

            @Override
            public Optional<Migratable> findByIdentifier(String code) {
                return registeredPlugins.stream().filter(p -> p.code().equals(code)).findFirst();
            }
        };
        ModuleRegistry moduleRegistry = name -> List.<Migratable>of(SYSTEM, BACKEND).stream()
                .filter(m -> m.code().equals(name))
                .findFirst();

        coordinator = new UpdateCoordinator(config, gateway, negotiator, products, engine, ledger, versions,
                parameters, cache, notices, pluginRegistry, moduleRegistry, themes, new ArchiveExtractor());
        coordinator.setNotesOutput(notes::add);
    }

    // -- runFullUpdate --

    @Test
    void runFullUpdate_shouldMigrateModulesThenPluginsAndSeedOnFirstRun() throws Exception {
        when(ledger.repositoryExists()).thenReturn(false);
        when(engine.seed(SYSTEM)).thenReturn(true);
        when(engine.seed(BACKEND)).thenReturn(false);

        coordinator.runFullUpdate();

        InOrder order = inOrder(ledger, engine, negotiator, cache);
        order.verify(ledger).createRepository();
        order.verify(engine).apply(SYSTEM);
        order.verify(engine).apply(BACKEND);
        order.verify(engine).apply(BLOG);
        order.verify(engine).apply(SHOP);
        order.verify(negotiator).resetCount();
        order.verify(cache).flush();
        order.verify(engine).seed(SYSTEM);
        order.verify(engine).seed(BACKEND);

        assertEquals(List.of("Migration table created", "System", "Backend", "Acme.Blog", "Acme.Shop",
                "Seeded System"), notes);
    }

    @Test
    void runFullUpdate_shouldNotSeedWhenLedgerExisted() throws Exception {
        when(ledger.repositoryExists()).thenReturn(true);

        coordinator.runFullUpdate();

        verify(ledger, never()).createRepository();
        verify(engine, never()).seed(any(Migratable.class));
        assertEquals(List.of("System", "Backend", "Acme.Blog", "Acme.Shop"), notes);
    }

    @Test
    void runFullUpdate_shouldPrintCollectedNoticesLast() throws Exception {
        when(ledger.repositoryExists()).thenReturn(true);
        notices.add("Acme.Blog/2024_01_01_seed_posts", "Created 3 demo posts");

        coordinator.runFullUpdate();

        assertEquals("Acme.Blog/2024_01_01_seed_posts reported:", notes.get(notes.size() - 2));
        assertEquals(" - Created 3 demo posts", notes.get(notes.size() - 1));
        assertTrue(notices.isEmpty());
    }

    @Test
    void runFullUpdate_shouldReportAndSkipUnknownModule() throws Exception {
        config.setModules(List.of("System", "Cms"));
        when(ledger.repositoryExists()).thenReturn(true);

        coordinator.runFullUpdate();

        assertTrue(notes.contains("Unable to find: Cms"));
        verify(engine).apply(SYSTEM);
        verify(engine, never()).apply(BACKEND);
    }

    @Test
    void runFullUpdate_shouldAbortOnFailingMigration() throws Exception {
        when(ledger.repositoryExists()).thenReturn(true);
        when(engine.apply(any(Migratable.class))).thenAnswer(invocation -> {
            Migratable unit = invocation.getArgument(0);
            if (unit.equals(BLOG))
                throw new MigrationException("Acme.Blog", "boom", null);
            return List.of();
        });

        assertThrows(MigrationException.class, () -> coordinator.runFullUpdate());

        verify(engine).apply(SYSTEM);
        verify(engine).apply(BACKEND);
        verify(engine, never()).apply(SHOP);
        verifyNoInteractions(negotiator, cache);
    }

    // -- uninstallAll --

    @Test
    void uninstallAll_shouldRevertPluginsInReverseThenModulesThenDropLedger() throws Exception {
        when(engine.rollback(any(Migratable.class))).thenReturn(1);

        coordinator.uninstallAll();

        InOrder order = inOrder(engine, ledger);
        order.verify(engine).rollback(SHOP);
        order.verify(engine).rollback(BLOG);
        order.verify(engine).rollback(List.of(SYSTEM, BACKEND));
        order.verify(ledger).deleteRepository();
        assertTrue(notes.contains("Rolled back: Acme.Shop"));
    }

    // -- plugins --

    @Test
    void updatePlugin_shouldApplyRegisteredPlugin() throws Exception {
        coordinator.updatePlugin("Acme.Blog");

        verify(engine).apply(BLOG);
        assertEquals(List.of("Acme.Blog"), notes);
    }

    @Test
    void updatePlugin_shouldRejectUnknownPlugin() throws Exception {
        UnitNotFoundException ex = assertThrows(UnitNotFoundException.class,
                () -> coordinator.updatePlugin("Ghost.Plugin"));

        assertEquals("Ghost.Plugin", ex.getCode());
        verify(engine, never()).apply(any(Migratable.class));
    }

    @Test
    void rollbackPlugin_shouldPurgeRecordOfUnregisteredPlugin() throws Exception {
        when(versions.delete("Old.Plugin")).thenReturn(true);

        coordinator.rollbackPlugin("Old.Plugin", null);

        assertEquals(List.of("Purged from database: Old.Plugin"), notes);
        verify(engine, never()).rollback(any(Migratable.class));
    }

    @Test
    void rollbackPlugin_shouldFailForUnknownPlugin() throws Exception {
        when(versions.delete("Ghost.Plugin")).thenReturn(false);

        assertThrows(UnitNotFoundException.class, () -> coordinator.rollbackPlugin("Ghost.Plugin", null));
    }

    @Test
    void rollbackPlugin_shouldStopAtRequestedVersion() throws Exception {
        when(engine.rollbackToVersion(BLOG, "1.0.1")).thenReturn(List.of("2024_02_add_tags", "2024_03_add_slugs"));
        when(versions.find("Acme.Blog")).thenReturn(Optional.of(
                new InstalledUnit("Acme.Blog", "1.0.1", "Blog", null, false, true, Instant.EPOCH)));

        coordinator.rollbackPlugin("Acme.Blog", "1.0.1");

        assertEquals(List.of("Rolled back: Acme.Blog", "Current Version: 1.0.1"), notes);
        verify(engine, never()).rollback(any(Migratable.class));
    }

    @Test
    void rollbackPlugin_shouldReportNothingToRevert() throws Exception {
        when(engine.rollback(BLOG)).thenReturn(0);

        coordinator.rollbackPlugin("Acme.Blog", null);

        assertEquals(List.of("Nothing to roll back: Acme.Blog"), notes);
    }

    // -- downloadAndExtract --

    @Test
    void downloadAndExtract_shouldUnpackPluginAndDeleteArchive() throws Exception {
        Path archive = zip("plugin.arc", "Plugin.java");
        when(gateway.requestFile(eq("plugin/get"), eq("Acme.Blogh1"), eq("h1"), anyMap())).thenReturn(archive);

        Path destination = coordinator.downloadAndExtract(ArtifactKind.PLUGIN, "Acme.Blog", "h1");

        assertEquals(tempDir.resolve("plugins/acme/blog"), destination);
        assertTrue(Files.exists(destination.resolve("Plugin.java")));
        assertFalse(Files.exists(archive));
        verifyNoInteractions(themes);
    }

    @Test
    void downloadAndExtract_shouldUnpackThemeAndMarkInstalled() throws Exception {
        Path archive = zip("theme.arc", "theme.yaml");
        when(gateway.requestFile(eq("theme/get"), eq("Acme.Starterh2"), eq("h2"), anyMap())).thenReturn(archive);

        Path destination = coordinator.downloadAndExtract(ArtifactKind.THEME, "Acme.Starter", "h2");

        assertEquals(tempDir.resolve("themes/acme-starter"), destination);
        assertTrue(Files.exists(destination.resolve("theme.yaml")));
        verify(themes).setInstalled("Acme.Starter");
    }

    @Test
    void downloadAndExtract_shouldRejectEscapingIdentifierBeforeDownload() {
        assertThrows(ExtractionFailedException.class,
                () -> coordinator.downloadAndExtract(ArtifactKind.PLUGIN, ".Evil", "h1"));

        verifyNoInteractions(gateway, themes);
        assertFalse(Files.exists(tempDir.resolve("evil")));
    }

    @Test
    void downloadAndExtract_shouldRefuseCoreWhileDisabled() {
        UpdateException ex = assertThrows(UpdateException.class,
                () -> coordinator.downloadAndExtract(ArtifactKind.CORE, "core", "h"));

        assertEquals("Core updates are disabled", ex.getMessage());
        verifyNoInteractions(gateway);
    }

    @Test
    void downloadAndExtract_shouldUnpackCoreOverBaseDirectory() throws Exception {
        config.getGateway().setDisableCoreUpdates(false);
        Path archive = zip("core.arc", "index.php");
        when(gateway.requestFile("core/get", "core", "h", Map.of("type", "update"))).thenReturn(archive);

        Path destination = coordinator.downloadAndExtract(ArtifactKind.CORE, "core", "h");

        assertEquals(tempDir, destination);
        assertTrue(Files.exists(tempDir.resolve("index.php")));
    }

    // -- core build --

    @Test
    void setBuild_shouldStoreBuildAndFlagAndKeepHashWhenAbsent() {
        parameters.set(ParameterKeys.CORE_HASH, "oldhash");

        coordinator.setBuild("480", null, true);

        assertEquals("480", parameters.get(ParameterKeys.CORE_BUILD).orElseThrow());
        assertTrue(parameters.getBoolean(ParameterKeys.CORE_MODIFIED, false));
        assertEquals("oldhash", parameters.get(ParameterKeys.CORE_HASH).orElseThrow());

        coordinator.setBuild("481", "newhash", false);

        assertEquals("newhash", parameters.get(ParameterKeys.CORE_HASH).orElseThrow());
        assertFalse(parameters.getBoolean(ParameterKeys.CORE_MODIFIED, true));
    }

    @Test
    void getHash_shouldReportNegotiatorHash() {
        when(negotiator.coreHash()).thenReturn("abc");

        assertEquals("abc", coordinator.getHash());
    }

    // -- lookups --

    @Test
    void requestPluginDetails_shouldPostNameToDetailEndpoint() throws Exception {
        coordinator.requestPluginDetails("Acme.Blog");
        coordinator.requestThemeDetails("Acme.Starter");
        coordinator.requestProjectDetails("proj-1");

        verify(gateway).requestData("plugin/detail", Map.of("name", "Acme.Blog"));
        verify(gateway).requestData("theme/detail", Map.of("name", "Acme.Starter"));
        verify(gateway).requestData("project/detail", Map.of("id", "proj-1"));
    }

    @Test
    void setSecurity_shouldForwardToGateway() {
        coordinator.setSecurity("key", "secret");

        verify(gateway).setSecurity("key", "secret");
        verify(engine).setNotesOutput(any());
        verifyNoMoreInteractions(engine);
    }

    // -- Helpers --

    private record TestUnit(String code, UnitType type) implements Migratable {

        @Override
        public String migrationPath() {
            return code.toLowerCase().replace('.', '/') + "/updates";
        }

        @Override
        public List<Migration> migrations() {
            return List.of();
        }
    }

    private Path zip(String name, String entry) throws IOException {
        Path archive = tempDir.resolve(name);
        try (ZipOutputStream out = new ZipOutputStream(Files.newOutputStream(archive))) {
            out.putNextEntry(new ZipEntry(entry));
            out.write("content".getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
        }
        return archive;
    }
}

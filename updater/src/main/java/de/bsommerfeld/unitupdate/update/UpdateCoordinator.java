package de.bsommerfeld.unitupdate.update;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.Lists;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.unitupdate.core.cache.CacheStore;
import de.bsommerfeld.unitupdate.core.config.UpdaterConfig;
import de.bsommerfeld.unitupdate.core.domain.ProductType;
import de.bsommerfeld.unitupdate.core.error.UnitNotFoundException;
import de.bsommerfeld.unitupdate.core.error.UpdateException;
import de.bsommerfeld.unitupdate.core.notes.NoteWriter;
import de.bsommerfeld.unitupdate.core.notes.NoticeCollector;
import de.bsommerfeld.unitupdate.core.param.ParameterKeys;
import de.bsommerfeld.unitupdate.core.param.ParameterStore;
import de.bsommerfeld.unitupdate.db.MigrationLedger;
import de.bsommerfeld.unitupdate.db.UnitVersionRepository;
import de.bsommerfeld.unitupdate.db.migration.Migratable;
import de.bsommerfeld.unitupdate.db.migration.MigrationEngine;
import de.bsommerfeld.unitupdate.gateway.GatewayClient;
import de.bsommerfeld.unitupdate.gateway.GatewayException;
import de.bsommerfeld.unitupdate.product.ProductDetailCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for update runs: migrates modules and plugins, uninstalls,
 * downloads and unpacks artifacts, and exposes the gateway lookups the
 * administration needs.
 *
 * <p>
 * Progress lines are written to the sink set with
 * {@link #setNotesOutput(NoteWriter)}. Messages returned by migrations and
 * seeders are collected during a run and printed once at its end.
 *
 * <p>
 * Runs are not synchronized. The host is expected to trigger at most one run
 * at a time.
 */
@Singleton
public class UpdateCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateCoordinator.class);

    private final UpdaterConfig config;
    private final GatewayClient gateway;
    private final UpdateNegotiator negotiator;
    private final ProductDetailCache products;
    private final MigrationEngine engine;
    private final MigrationLedger ledger;
    private final UnitVersionRepository versions;
    private final ParameterStore parameters;
    private final CacheStore cache;
    private final NoticeCollector notices;
    private final PluginRegistry plugins;
    private final ModuleRegistry modules;
    private final ThemeRegistry themes;
    private final ArchiveExtractor extractor;

    private NoteWriter notesOutput;

    @Inject
    public UpdateCoordinator(UpdaterConfig config, GatewayClient gateway, UpdateNegotiator negotiator,
            ProductDetailCache products, MigrationEngine engine, MigrationLedger ledger,
            UnitVersionRepository versions, ParameterStore parameters, CacheStore cache,
            NoticeCollector notices, PluginRegistry plugins, ModuleRegistry modules,
            ThemeRegistry themes, ArchiveExtractor extractor) {
        this.config = config;
        this.gateway = gateway;
        this.negotiator = negotiator;
        this.products = products;
        this.engine = engine;
        this.ledger = ledger;
        this.versions = versions;
        this.parameters = parameters;
        this.cache = cache;
        this.notices = notices;
        this.plugins = plugins;
        this.modules = modules;
        this.themes = themes;
        this.extractor = extractor;
    }

    public void setNotesOutput(NoteWriter notesOutput) {
        this.notesOutput = notesOutput;
        engine.setNotesOutput(notesOutput);
    }

    public void setSecurity(String key, String secret) {
        gateway.setSecurity(key, secret);
    }

    // =====================================================================
    // Full runs
    // =====================================================================

    /**
     * Brings the database up to date: creates the migration table on first
     * run, migrates every configured module and every registered plugin,
     * resets the update count, flushes the cache and, on first run, seeds the
     * modules. Collected notices are printed last.
     *
     * <p>
     * A failing migration aborts the run. Migrations completed before it
     * stay applied.
     */
    public void runFullUpdate() throws UpdateException {
        boolean firstUp = !ledger.repositoryExists();
        if (firstUp) {
            ledger.createRepository();
            note("Migration table created");
        }

        List<Migratable> baseModules = configuredModules();
        for (Migratable module : baseModules) {
            note(module.code());
            engine.apply(module);
        }

        for (Migratable plugin : plugins.getPlugins()) {
            note(plugin.code());
            engine.apply(plugin);
        }

        negotiator.resetCount();
        cache.flush();

        if (firstUp) {
            for (Migratable module : baseModules) {
                if (engine.seed(module))
                    note("Seeded " + module.code());
            }
        }

        notices.printTo(notesOutput);
        LOG.info("Update run finished (first run: {})", firstUp);
    }

    /**
     * Reverts everything: plugins in reverse registration order, then all
     * module migrations, then drops the migration table.
     */
    public void uninstallAll() throws UpdateException {
        for (Migratable plugin : Lists.reverse(plugins.getPlugins())) {
            rollbackPlugin(plugin.code(), null);
        }

        int reverted = engine.rollback(configuredModules());
        LOG.info("Rolled back {} module migrations", reverted);

        ledger.deleteRepository();
    }

    // =====================================================================
    // Plugins
    // =====================================================================

    /**
     * Applies the pending migrations of one registered plugin.
     *
     * @throws UnitNotFoundException if no plugin with that code is registered
     */
    public void updatePlugin(String code) throws UpdateException {
        Migratable plugin = plugins.findByIdentifier(code)
                .orElseThrow(() -> new UnitNotFoundException(code));

        note(code);
        engine.apply(plugin);
    }

    /**
     * Reverts a plugin entirely, or down to {@code stopOnVersion} when given.
     * A plugin that is recorded but no longer registered cannot be reverted;
     * its record is purged instead.
     *
     * @throws UnitNotFoundException if the plugin is neither registered nor
     *                               recorded
     * @throws de.bsommerfeld.unitupdate.core.error.VersionNotFoundException
     *                               if {@code stopOnVersion} was never applied
     */
    public void rollbackPlugin(String code, String stopOnVersion) throws UpdateException {
        Optional<Migratable> registered = plugins.findByIdentifier(code);
        if (registered.isEmpty()) {
            if (versions.delete(code)) {
                note("Purged from database: " + code);
                return;
            }
            throw new UnitNotFoundException(code);
        }

        Migratable plugin = registered.get();
        int reverted = stopOnVersion == null
                ? engine.rollback(plugin)
                : engine.rollbackToVersion(plugin, stopOnVersion).size();

        if (reverted == 0) {
            note("Nothing to roll back: " + code);
            return;
        }

        note("Rolled back: " + code);
        versions.find(code).ifPresent(unit -> note("Current Version: " + unit.version()));
    }

    // =====================================================================
    // Artifacts
    // =====================================================================

    /**
     * Downloads an artifact and unpacks it to its destination. The archive is
     * deleted after a successful extraction. Installed themes are flagged in
     * the theme registry.
     *
     * @throws UpdateException if core updates are disabled and
     *                         {@code kind} is {@link ArtifactKind#CORE}
     */
    public Path downloadAndExtract(ArtifactKind kind, String identifier, String hash) throws UpdateException {
        if (kind == ArtifactKind.CORE && config.getGateway().isDisableCoreUpdates()) {
            throw new UpdateException("Core updates are disabled");
        }

        Path destination = kind.destination(config.getInstallation(), identifier);
        Path archive = gateway.requestFile(kind.endpoint(), kind.fileCode(identifier, hash), hash,
                kind.requestParams(identifier));

        extractor.extract(archive, destination);

        if (kind == ArtifactKind.THEME)
            themes.setInstalled(identifier);

        try {
            Files.deleteIfExists(archive);
        } catch (IOException e) {
            LOG.warn("Unable to delete archive {}", archive, e);
        }
        return destination;
    }

    // =====================================================================
    // Core build
    // =====================================================================

    /** Records the installed core build. {@code hash} is kept unless given. */
    public void setBuild(String build, String hash, boolean modified) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(ParameterKeys.CORE_BUILD, build);
        values.put(ParameterKeys.CORE_MODIFIED, modified ? "1" : "0");
        if (hash != null && !hash.isBlank())
            values.put(ParameterKeys.CORE_HASH, hash);
        parameters.setAll(values);
    }

    public String getHash() {
        return negotiator.coreHash();
    }

    // =====================================================================
    // Gateway lookups
    // =====================================================================

    public JsonNode requestProjectDetails(String projectId) throws GatewayException {
        return gateway.requestData("project/detail", Map.of("id", projectId));
    }

    public JsonNode requestPluginDetails(String name) throws GatewayException {
        return gateway.requestData("plugin/detail", Map.of("name", name));
    }

    public JsonNode requestPluginContent(String name) throws GatewayException {
        return gateway.requestData("plugin/content", Map.of("name", name));
    }

    public JsonNode requestThemeDetails(String name) throws GatewayException {
        return gateway.requestData("theme/detail", Map.of("name", name));
    }

    public JsonNode requestChangelog() throws GatewayException {
        return gateway.requestChangelog();
    }

    public List<JsonNode> requestProductDetails(ProductType type, Collection<String> codes) throws GatewayException {
        return products.lookup(type, codes);
    }

    public List<JsonNode> requestPopularProducts(ProductType type) throws GatewayException {
        return products.popular(type);
    }

    // =====================================================================
    // Internals
    // =====================================================================

    /** Configured modules in configuration order; unknown names are reported and skipped. */
    private List<Migratable> configuredModules() {
        List<Migratable> resolved = new ArrayList<>();
        for (String name : config.getModules()) {
            Optional<Migratable> module = modules.findModule(name);
            if (module.isPresent()) {
                resolved.add(module.get());
            } else {
                LOG.warn("Configured module {} is not registered", name);
                note("Unable to find: " + name);
            }
        }
        return resolved;
    }

    private void note(String message) {
        if (notesOutput != null)
            notesOutput.writeln(message);
    }
}

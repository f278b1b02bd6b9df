package de.bsommerfeld.unitupdate.inject;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Names;
import de.bsommerfeld.unitupdate.core.cache.CacheStore;
import de.bsommerfeld.unitupdate.core.cache.InMemoryCacheStore;
import de.bsommerfeld.unitupdate.core.config.ConfigLoader;
import de.bsommerfeld.unitupdate.core.config.DatabaseConfig;
import de.bsommerfeld.unitupdate.core.config.GatewayConfig;
import de.bsommerfeld.unitupdate.core.config.InstallationConfig;
import de.bsommerfeld.unitupdate.core.config.UpdaterConfig;
import de.bsommerfeld.unitupdate.core.param.ParameterStore;
import de.bsommerfeld.unitupdate.core.util.StorageUtils;
import de.bsommerfeld.unitupdate.db.MigrationLedger;
import de.bsommerfeld.unitupdate.db.SqlMigrationLedger;
import de.bsommerfeld.unitupdate.db.SqlParameterStore;
import de.bsommerfeld.unitupdate.db.SqlUnitVersionRepository;
import de.bsommerfeld.unitupdate.db.SqliteDatabase;
import de.bsommerfeld.unitupdate.db.UnitVersionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Guice module wiring the updater.
 *
 * <p>
 * The host application installs this module next to its own, which must
 * bind {@link de.bsommerfeld.unitupdate.update.PluginRegistry},
 * {@link de.bsommerfeld.unitupdate.update.ModuleRegistry} and
 * {@link de.bsommerfeld.unitupdate.update.ThemeRegistry}.
 */
public class UpdaterModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(UpdaterModule.class);

    private final UpdaterConfig config;

    /** Loads {@code config.json} from the app data directory, writing defaults on first start. */
    public UpdaterModule() {
        this(loadDefaultConfig());
    }

    public UpdaterModule(UpdaterConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(UpdaterConfig.class).toInstance(config);
        bind(GatewayConfig.class).toInstance(config.getGateway());
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(InstallationConfig.class).toInstance(config.getInstallation());

        bindConstant().annotatedWith(Names.named(SqlMigrationLedger.TABLE_NAME_BINDING))
                .to(config.getDatabase().getMigrationTable());

        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(CacheStore.class).to(InMemoryCacheStore.class);
        bind(ParameterStore.class).to(SqlParameterStore.class);
        bind(UnitVersionRepository.class).to(SqlUnitVersionRepository.class);
        bind(MigrationLedger.class).to(SqlMigrationLedger.class);
    }

    @Provides
    @Singleton
    SqliteDatabase provideDatabase(DatabaseConfig database) {
        String file = database.getFile();
        Path path = file == null || file.isBlank()
                ? StorageUtils.getDefaultDatabaseFile(StorageUtils.APP_NAME)
                : Path.of(file);
        return SqliteDatabase.forFile(path);
    }

    @Provides
    @Singleton
    HttpClient provideHttpClient(GatewayConfig gateway) {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofSeconds(gateway.getTimeoutSeconds()))
                .build();
    }

    @Provides
    @Singleton
    ObjectMapper provideObjectMapper() {
        return new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static UpdaterConfig loadDefaultConfig() {
        Path configPath = StorageUtils.getConfigFile(StorageUtils.APP_NAME);
        LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
        try {
            return ConfigLoader.load(configPath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load updater configuration", e);
        }
    }
}

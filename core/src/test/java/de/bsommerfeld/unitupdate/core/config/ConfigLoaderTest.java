package de.bsommerfeld.unitupdate.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldWriteDefaultsWhenFileMissing() throws IOException {
        Path file = tempDir.resolve("nested/config.json");

        UpdaterConfig config = ConfigLoader.load(file);

        assertTrue(Files.exists(file));
        assertTrue(config.getGateway().isDisableCoreUpdates());
        assertTrue(Files.readString(file).contains("\"update-server\""));
    }

    @Test
    void load_shouldReadKebabCaseKeys() throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, """
                {
                  "gateway": {
                    "update-server": "https://updates.example.com/api",
                    "disable-core-updates": false,
                    "edge-updates": true
                  },
                  "database": { "migration-table": "schema_log" },
                  "modules": ["System", "Backend"]
                }
                """);

        UpdaterConfig config = ConfigLoader.load(file);

        assertEquals("https://updates.example.com/api", config.getGateway().getUpdateServer());
        assertFalse(config.getGateway().isDisableCoreUpdates());
        assertTrue(config.getGateway().isEdgeUpdates());
        assertEquals("schema_log", config.getDatabase().getMigrationTable());
        assertEquals(List.of("System", "Backend"), config.getModules());
    }

    @Test
    void load_shouldKeepDefaultsForMissingKeysAndIgnoreUnknownOnes() throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, """
                { "gateway": { "client-name": "Test Client", "legacy-option": 1 } }
                """);

        UpdaterConfig config = ConfigLoader.load(file);

        assertEquals("Test Client", config.getGateway().getClientName());
        assertTrue(config.getGateway().isDisableCoreUpdates());
        assertEquals("migrations", config.getDatabase().getMigrationTable());
    }

    @Test
    void load_shouldFailOnMalformedJson() throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{ not json");

        assertThrows(IOException.class, () -> ConfigLoader.load(file));
    }

    @Test
    void save_shouldRoundTripChangedValues() throws IOException {
        Path file = tempDir.resolve("config.json");
        UpdaterConfig config = new UpdaterConfig();
        config.getGateway().setUpdateAuth("admin:secret");

        ConfigLoader.save(config, file);

        assertEquals("admin:secret", ConfigLoader.load(file).getGateway().getUpdateAuth());
    }
}

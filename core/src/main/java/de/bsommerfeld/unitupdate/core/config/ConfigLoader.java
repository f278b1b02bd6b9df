package de.bsommerfeld.unitupdate.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link UpdaterConfig} from a JSON file.
 *
 * <p>
 * A missing file is not an error: the defaults are written to the given
 * path so the user has a complete, editable file after the first start.
 * Keys absent from an existing file keep their default values.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ConfigLoader() {
    }

    /**
     * Loads the configuration at {@code path}, creating it with defaults if it
     * does not exist yet.
     *
     * @throws IOException if the file exists but cannot be parsed, or the
     *                     defaults cannot be written
     */
    public static UpdaterConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            UpdaterConfig defaults = new UpdaterConfig();
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            MAPPER.writeValue(path.toFile(), defaults);
            LOG.info("No configuration found, wrote defaults to {}", path.toAbsolutePath());
            return defaults;
        }
        LOG.debug("Reading configuration from {}", path.toAbsolutePath());
        return MAPPER.readValue(path.toFile(), UpdaterConfig.class);
    }

    /** Writes the configuration back, overwriting the file. */
    public static void save(UpdaterConfig config, Path path) throws IOException {
        MAPPER.writeValue(path.toFile(), config);
    }
}

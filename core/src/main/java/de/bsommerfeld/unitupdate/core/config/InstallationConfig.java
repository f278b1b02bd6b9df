package de.bsommerfeld.unitupdate.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.nio.file.Path;

/**
 * Filesystem layout of the application being updated. Relative directories
 * are resolved against {@code base-directory}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InstallationConfig {

    @JsonProperty("base-directory")
    @JsonPropertyDescription("Root of the installation; core archives are extracted here")
    private String baseDirectory = ".";

    @JsonProperty("plugins-directory")
    @JsonPropertyDescription("Plugin root, relative to base-directory")
    private String pluginsDirectory = "plugins";

    @JsonProperty("themes-directory")
    @JsonPropertyDescription("Theme root, relative to base-directory")
    private String themesDirectory = "themes";

    @JsonProperty("temp-directory")
    @JsonPropertyDescription("Download area for archives, relative to base-directory")
    private String tempDirectory = "storage/temp";

    @JsonProperty("application-url")
    @JsonPropertyDescription("Public URL of the installation, reported to the gateway")
    private String applicationUrl = "http://localhost/";

    public String getBaseDirectory() {
        return baseDirectory;
    }

    public void setBaseDirectory(String baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    public String getPluginsDirectory() {
        return pluginsDirectory;
    }

    public void setPluginsDirectory(String pluginsDirectory) {
        this.pluginsDirectory = pluginsDirectory;
    }

    public String getThemesDirectory() {
        return themesDirectory;
    }

    public void setThemesDirectory(String themesDirectory) {
        this.themesDirectory = themesDirectory;
    }

    public String getTempDirectory() {
        return tempDirectory;
    }

    public void setTempDirectory(String tempDirectory) {
        this.tempDirectory = tempDirectory;
    }

    public String getApplicationUrl() {
        return applicationUrl;
    }

    public void setApplicationUrl(String applicationUrl) {
        this.applicationUrl = applicationUrl;
    }

    public Path basePath() {
        return Path.of(baseDirectory).toAbsolutePath().normalize();
    }

    public Path pluginsPath() {
        return basePath().resolve(pluginsDirectory);
    }

    public Path themesPath() {
        return basePath().resolve(themesDirectory);
    }

    public Path tempPath() {
        return basePath().resolve(tempDirectory);
    }
}

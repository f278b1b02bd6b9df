package de.bsommerfeld.unitupdate.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the updater configuration file. Each section maps to one JSON object
 * in {@code config.json}; unknown keys are ignored so older files keep loading
 * after new options are added.
 *
 * @see ConfigLoader
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpdaterConfig {

    @JsonProperty("gateway")
    @JsonPropertyDescription("Remote update gateway settings")
    private GatewayConfig gateway = new GatewayConfig();

    @JsonProperty("database")
    @JsonPropertyDescription("Local persistence settings")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("installation")
    @JsonPropertyDescription("Filesystem layout of the installation")
    private InstallationConfig installation = new InstallationConfig();

    @JsonProperty("modules")
    @JsonPropertyDescription("Base modules in migration order, e.g. [\"System\", \"Backend\", \"Cms\"]")
    private List<String> modules = new ArrayList<>();

    public GatewayConfig getGateway() {
        return gateway;
    }

    public DatabaseConfig getDatabase() {
        return database;
    }

    public InstallationConfig getInstallation() {
        return installation;
    }

    public List<String> getModules() {
        return modules;
    }

    public void setModules(List<String> modules) {
        this.modules = modules;
    }
}

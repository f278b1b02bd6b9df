package de.bsommerfeld.unitupdate.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Settings for the remote update gateway: where it lives, how requests are
 * authenticated, and which public key vouches for its responses.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GatewayConfig {

    public static final String DEFAULT_UPDATE_SERVER = "https://gateway.octobercms.com/api";

    @JsonProperty("update-server")
    @JsonPropertyDescription("Base URL of the update gateway")
    private String updateServer = DEFAULT_UPDATE_SERVER;

    @JsonProperty("disable-core-updates")
    @JsonPropertyDescription("If true, core updates are neither offered nor downloaded (default: true)")
    private boolean disableCoreUpdates = true;

    @JsonProperty("update-auth")
    @JsonPropertyDescription("Basic auth credentials for the gateway as 'user:password' (default: none)")
    private String updateAuth;

    @JsonProperty("edge-updates")
    @JsonPropertyDescription("Request edge (pre-release) builds from the gateway (default: false)")
    private boolean edgeUpdates = false;

    @JsonProperty("public-key")
    @JsonPropertyDescription("PEM public key overriding the built-in gateway signing key")
    private String publicKey;

    @JsonProperty("client-name")
    @JsonPropertyDescription("Client identity sent with every request")
    private String clientName = "October CMS";

    @JsonProperty("verify-downloads")
    @JsonPropertyDescription("Compare the MD5 of downloaded archives against the expected hash (default: false)")
    private boolean verifyDownloads = false;

    @JsonProperty("changelog-url")
    @JsonPropertyDescription("Public JSON changelog endpoint")
    private String changelogUrl = "https://octobercms.com/changelog?json";

    @JsonProperty("timeout-seconds")
    @JsonPropertyDescription("Connect timeout for gateway requests in seconds (default: 30)")
    private int timeoutSeconds = 30;

    public String getUpdateServer() {
        return updateServer;
    }

    public void setUpdateServer(String updateServer) {
        this.updateServer = updateServer;
    }

    public boolean isDisableCoreUpdates() {
        return disableCoreUpdates;
    }

    public void setDisableCoreUpdates(boolean disableCoreUpdates) {
        this.disableCoreUpdates = disableCoreUpdates;
    }

    public String getUpdateAuth() {
        return updateAuth;
    }

    public void setUpdateAuth(String updateAuth) {
        this.updateAuth = updateAuth;
    }

    public boolean isEdgeUpdates() {
        return edgeUpdates;
    }

    public void setEdgeUpdates(boolean edgeUpdates) {
        this.edgeUpdates = edgeUpdates;
    }

    public String getPublicKey() {
        return publicKey;
    }

    public void setPublicKey(String publicKey) {
        this.publicKey = publicKey;
    }

    public String getClientName() {
        return clientName;
    }

    public void setClientName(String clientName) {
        this.clientName = clientName;
    }

    public boolean isVerifyDownloads() {
        return verifyDownloads;
    }

    public void setVerifyDownloads(boolean verifyDownloads) {
        this.verifyDownloads = verifyDownloads;
    }

    public String getChangelogUrl() {
        return changelogUrl;
    }

    public void setChangelogUrl(String changelogUrl) {
        this.changelogUrl = changelogUrl;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}

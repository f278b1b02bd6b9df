package de.bsommerfeld.unitupdate.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.BaseEncoding;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.unitupdate.core.config.GatewayConfig;
import de.bsommerfeld.unitupdate.core.config.InstallationConfig;
import de.bsommerfeld.unitupdate.core.config.UpdaterConfig;
import de.bsommerfeld.unitupdate.core.param.ParameterKeys;
import de.bsommerfeld.unitupdate.core.param.ParameterStore;
import de.bsommerfeld.unitupdate.core.util.HashUtil;
import de.bsommerfeld.unitupdate.db.UnitVersionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the update gateway.
 *
 * <p>
 * Every request is a form-encoded POST to {@code {update-server}/{endpoint}}
 * carrying the common attributes ({@code protocol_version}, {@code client},
 * {@code server}, and optionally {@code project} and {@code edge}). Once
 * {@link #setSecurity(String, String)} has supplied an API key pair, requests
 * additionally carry a {@code nonce} and are signed; see
 * {@link SignatureCodec}.
 *
 * <h3>Responses</h3>
 * {@link #requestData(String, Map)} only ever returns a payload whose
 * {@code Rest-Sign} header verified against the gateway public key.
 * {@link #requestFile(String, String, String, Map)} streams the body to a
 * content-addressed file in the temp directory and follows at most one
 * redirect, unsigned, to the artifact's storage location.
 *
 * <h3>Redirect handling</h3>
 * The injected {@link HttpClient} must not follow redirects itself: a signed
 * POST must never be replayed against a foreign host.
 */
@Singleton
public class GatewayClient {

    private static final Logger LOG = LoggerFactory.getLogger(GatewayClient.class);

    public static final String PROTOCOL_VERSION = "1.3";
    static final String HEADER_KEY = "Rest-Key";
    static final String HEADER_SIGN = "Rest-Sign";

    private static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";
    private static final DateTimeFormatter SINCE_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    private final HttpClient http;
    private final GatewayConfig gateway;
    private final InstallationConfig installation;
    private final ParameterStore parameters;
    private final UnitVersionRepository versions;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final PublicKey publicKey;

    private String key;
    private String secret;

    @Inject
    public GatewayClient(HttpClient http, UpdaterConfig config, ParameterStore parameters,
            UnitVersionRepository versions, Clock clock, ObjectMapper mapper) {
        this.http = http;
        this.gateway = config.getGateway();
        this.installation = config.getInstallation();
        this.parameters = parameters;
        this.versions = versions;
        this.clock = clock;
        this.mapper = mapper;

        String pem = gateway.getPublicKey();
        this.publicKey = SignatureCodec.parsePublicKey(
                pem == null || pem.isBlank() ? SignatureCodec.DEFAULT_PUBLIC_KEY : pem);
    }

    /** Sets the API key pair used to sign subsequent requests. */
    public void setSecurity(String key, String secret) {
        this.key = key;
        this.secret = secret;
    }

    // =====================================================================
    // Data requests
    // =====================================================================

    /**
     * Posts to {@code endpoint} and returns the verified JSON payload.
     *
     * @throws GatewayNotFoundException  on 404
     * @throws BadResponseException      on any other non-200 status
     * @throws InvalidResponseException  if the body is empty, not JSON, or
     *                                   {@code false}
     * @throws BadSignatureException     if the signature is missing or wrong
     */
    public JsonNode requestData(String endpoint, Map<String, ?> extraParams) throws GatewayException {
        String url = createServerUrl(endpoint);
        HttpResponse<String> response = send(buildPost(url, extraParams),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

        checkStatus(response.statusCode(), url, response.body());
        JsonNode data = parsePayload(response.body());

        String signature = response.headers().firstValue(HEADER_SIGN).orElse("");
        if (!SignatureCodec.verify(data, signature, publicKey)) {
            LOG.warn("Rejected unsigned or tampered response from {}", url);
            throw new BadSignatureException();
        }
        return data;
    }

    public JsonNode requestData(String endpoint) throws GatewayException {
        return requestData(endpoint, Map.of());
    }

    /**
     * Fetches the public changelog. The changelog is served outside the
     * signed gateway API, so no signature is checked.
     */
    public JsonNode requestChangelog() throws GatewayException {
        String url = gateway.getChangelogUrl();
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout())
                .GET()
                .build();
        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

        checkStatus(response.statusCode(), url, response.body());
        return parsePayload(response.body());
    }

    // =====================================================================
    // File requests
    // =====================================================================

    /**
     * Posts to {@code endpoint} and streams the response body to
     * {@link #filePath(String)}. A 301/302 answer with a {@code Location}
     * header is followed exactly once with a plain GET.
     *
     * @param expectedHash MD5 of the artifact; checked only when
     *                     {@code verify-downloads} is enabled
     * @return the written file
     * @throws BadResponseException if the final status is not 200; the
     *                              message is the downloaded error body
     */
    public Path requestFile(String endpoint, String fileCode, String expectedHash, Map<String, ?> extraParams)
            throws GatewayException {
        String url = createServerUrl(endpoint);
        Path target = filePath(fileCode);
        try {
            Files.createDirectories(target.getParent());
        } catch (IOException e) {
            throw new GatewayException("Unable to create download directory " + target.getParent(), e);
        }

        HttpResponse<Path> response = send(buildPost(url, extraParams), toFile(target));

        int status = response.statusCode();
        if (status == 301 || status == 302) {
            Optional<String> location = response.headers().firstValue("Location");
            if (location.isPresent()) {
                URI redirectUri = resolveRedirect(url, location.get(), status);
                LOG.debug("Following download redirect to {}", redirectUri);
                HttpRequest redirect = HttpRequest.newBuilder(redirectUri)
                        .timeout(timeout())
                        .GET()
                        .build();
                response = send(redirect, toFile(target));
                status = response.statusCode();
            }
        }

        if (status != 200) {
            throw new BadResponseException(status, readQuietly(target));
        }

        if (gateway.isVerifyDownloads() && expectedHash != null && !expectedHash.isBlank()) {
            String actual = md5(target);
            if (!actual.equalsIgnoreCase(expectedHash)) {
                throw new InvalidResponseException("Hash mismatch for " + fileCode + ": expected "
                        + expectedHash + ", got " + actual);
            }
        }

        LOG.info("Downloaded {} to {}", fileCode, target);
        return target;
    }

    /** Content-addressed download location for {@code fileCode}. */
    public Path filePath(String fileCode) {
        String name = HashUtil.md5(fileCode) + ".arc";
        return installation.tempPath().resolve(name);
    }

    // =====================================================================
    // Request building
    // =====================================================================

    String createServerUrl(String endpoint) {
        String base = gateway.getUpdateServer();
        if (!base.endsWith("/"))
            base += "/";
        return base + endpoint;
    }

    /** Assembles the full parameter map sent (and signed) with every request. */
    Map<String, Object> buildParams(Map<String, ?> extraParams) {
        Map<String, Object> params = new LinkedHashMap<>(extraParams);
        params.put("protocol_version", PROTOCOL_VERSION);
        params.put("client", gateway.getClientName());
        params.put("server", encodeServerInfo());

        parameters.get(ParameterKeys.PROJECT_ID)
                .filter(id -> !id.isBlank())
                .ifPresent(id -> params.put("project", id));

        if (gateway.isEdgeUpdates())
            params.put("edge", 1);

        if (hasSecurity())
            params.put("nonce", createNonce());

        return params;
    }

    private HttpRequest buildPost(String url, Map<String, ?> extraParams) {
        Map<String, Object> params = buildParams(extraParams);

        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout())
                .header("Content-Type", FORM_CONTENT_TYPE)
                .POST(HttpRequest.BodyPublishers.ofString(QueryStringEncoder.encode(params)));

        if (hasSecurity()) {
            builder.header(HEADER_KEY, key);
            builder.header(HEADER_SIGN, SignatureCodec.sign(params, secret));
        }

        String credentials = gateway.getUpdateAuth();
        if (credentials != null && !credentials.isBlank()) {
            String token = BaseEncoding.base64().encode(credentials.getBytes(StandardCharsets.UTF_8));
            builder.header("Authorization", "Basic " + token);
        }

        return builder.build();
    }

    private String encodeServerInfo() {
        Map<String, Object> server = new LinkedHashMap<>();
        server.put("java", System.getProperty("java.version"));
        server.put("url", installation.getApplicationUrl());
        server.put("ip", localAddress());
        server.put("since", versions.oldestInstall().map(SINCE_FORMAT::format).orElse(null));
        try {
            return BaseEncoding.base64().encode(mapper.writeValueAsBytes(server));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode server attributes", e);
        }
    }

    /** Epoch seconds followed by the six-digit microsecond fraction. */
    String createNonce() {
        Instant now = clock.instant();
        return now.getEpochSecond() + String.format("%06d", now.getNano() / 1000);
    }

    private boolean hasSecurity() {
        return key != null && !key.isEmpty() && secret != null && !secret.isEmpty();
    }

    private Duration timeout() {
        return Duration.ofSeconds(gateway.getTimeoutSeconds());
    }

    // =====================================================================
    // Response handling
    // =====================================================================

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler)
            throws GatewayException {
        try {
            return http.send(request, handler);
        } catch (IOException e) {
            throw new GatewayException("Unable to reach " + request.uri() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Request interrupted: " + request.uri(), e);
        }
    }

    /** Resolves a possibly relative {@code Location} against the request URL. */
    static URI resolveRedirect(String requestUrl, String location, int status) throws BadResponseException {
        URI resolved;
        try {
            resolved = URI.create(requestUrl).resolve(location.trim());
        } catch (IllegalArgumentException e) {
            throw new BadResponseException(status, "Invalid redirect location: " + location);
        }

        String scheme = resolved.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme))
            throw new BadResponseException(status, "Invalid redirect location: " + location);
        return resolved;
    }

    private static void checkStatus(int status, String url, String body) throws GatewayException {
        if (status == 404)
            throw new GatewayNotFoundException(url);
        if (status != 200)
            throw new BadResponseException(status, body);
    }

    private JsonNode parsePayload(String body) throws InvalidResponseException {
        if (body == null || body.isBlank())
            throw new InvalidResponseException();

        JsonNode data;
        try {
            data = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidResponseException("Malformed JSON", e);
        }

        if (data == null || data.isMissingNode() || data.isNull()
                || (data.isBoolean() && !data.booleanValue())
                || (data.isTextual() && data.textValue().isEmpty())) {
            throw new InvalidResponseException();
        }
        return data;
    }

    private static HttpResponse.BodyHandler<Path> toFile(Path target) {
        return HttpResponse.BodyHandlers.ofFile(target,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    private static String readQuietly(Path file) {
        try {
            return Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            LOG.warn("Unable to read error body from {}", file, e);
            return "";
        }
    }

    private static String md5(Path file) throws GatewayException {
        try {
            return HashUtil.md5(file);
        } catch (IOException e) {
            throw new GatewayException("Unable to hash " + file, e);
        }
    }

    private static String localAddress() {
        try {
            return InetAddress.getLocalHost().getHostAddress();
        } catch (UnknownHostException e) {
            LOG.debug("Local address unavailable, reporting loopback", e);
            return InetAddress.getLoopbackAddress().getHostAddress();
        }
    }
}

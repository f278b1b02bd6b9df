package de.bsommerfeld.unitupdate.update;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.BaseEncoding;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.unitupdate.core.config.UpdaterConfig;
import de.bsommerfeld.unitupdate.core.domain.InstalledUnit;
import de.bsommerfeld.unitupdate.core.domain.RetryState;
import de.bsommerfeld.unitupdate.core.domain.UpdateNegotiationResult;
import de.bsommerfeld.unitupdate.core.domain.UpdateOffer;
import de.bsommerfeld.unitupdate.core.param.ParameterKeys;
import de.bsommerfeld.unitupdate.core.param.ParameterStore;
import de.bsommerfeld.unitupdate.core.util.HashUtil;
import de.bsommerfeld.unitupdate.db.UnitVersionRepository;
import de.bsommerfeld.unitupdate.gateway.GatewayClient;
import de.bsommerfeld.unitupdate.gateway.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the gateway which installed units have updates and applies the local
 * exclusion rules to the answer.
 *
 * <h3>Throttling</h3>
 * {@link #check(boolean)} negotiates at most once per {@link #RETRY_WINDOW}.
 * Once a positive count is known, it is returned without contacting the
 * gateway until a full update run calls {@link #resetCount()}.
 *
 * <h3>Exclusions</h3>
 * <ul>
 * <li>plugins whose local record is frozen or not updatable</li>
 * <li>themes already installed</li>
 * <li>the core, while core updates are disabled</li>
 * </ul>
 * Excluded offers are dropped from the result and never counted.
 */
@Singleton
public class UpdateNegotiator {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateNegotiator.class);

    static final Duration RETRY_WINDOW = Duration.ofHours(24);

    /** Fingerprint reported while no core hash has been recorded. */
    public static final String DEFAULT_CORE_HASH = HashUtil.md5("NULL");

    private final UpdaterConfig config;
    private final GatewayClient gateway;
    private final ParameterStore parameters;
    private final UnitVersionRepository versions;
    private final ThemeRegistry themes;
    private final Clock clock;
    private final ObjectMapper mapper;

    @Inject
    public UpdateNegotiator(UpdaterConfig config, GatewayClient gateway, ParameterStore parameters,
            UnitVersionRepository versions, ThemeRegistry themes, Clock clock, ObjectMapper mapper) {
        this.config = config;
        this.gateway = gateway;
        this.parameters = parameters;
        this.versions = versions;
        this.themes = themes;
        this.clock = clock;
        this.mapper = mapper;
    }

    /**
     * Returns the number of pending updates, negotiating only when no
     * positive count is known and the retry window has passed (or
     * {@code force} is set). A failed negotiation counts as zero updates.
     */
    public int check(boolean force) {
        int oldCount = parameters.getInt(ParameterKeys.UPDATE_COUNT, 0);
        if (oldCount > 0)
            return oldCount;

        if (!force && retryState().isWaiting(clock.instant()))
            return oldCount;

        int newCount;
        try {
            newCount = negotiate(false).updateCount();
        } catch (GatewayException | RuntimeException e) {
            LOG.warn("Update check failed: {}", e.getMessage());
            LOG.debug("Update check failure", e);
            newCount = 0;
        }

        persistCount(newCount);
        return newCount;
    }

    /**
     * Requests {@code core/update} for the current installation and returns
     * the offers that survive the local exclusions. The resulting count is
     * persisted and the retry window restarted.
     *
     * @param force ask the gateway to report offers regardless of versions
     */
    public UpdateNegotiationResult negotiate(boolean force) throws GatewayException {
        Map<String, InstalledUnit> installed = new LinkedHashMap<>();
        Map<String, String> pluginVersions = new LinkedHashMap<>();
        for (InstalledUnit unit : versions.findAll()) {
            installed.put(unit.code(), unit);
            pluginVersions.put(unit.code(), unit.version());
        }
        List<String> installedThemes = new ArrayList<>(themes.installedCodes());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("core", coreHash());
        params.put("plugins", base64Json(pluginVersions));
        params.put("themes", base64Json(installedThemes));
        params.put("build", parameters.get(ParameterKeys.CORE_BUILD).orElse(null));
        params.put("force", force);

        JsonNode response = gateway.requestData("core/update", params);
        int serverCount = Math.max(0, response.path("update").asInt(0));

        UpdateOffer coreOffer = null;
        JsonNode core = response.get("core");
        if (isPresent(core)) {
            coreOffer = offer("core", core)
                    .withOldBuild(parameters.get(ParameterKeys.CORE_BUILD).orElse(null));
        }

        Map<String, UpdateOffer> pluginOffers = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = response.path("plugins").fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> field = it.next();
            String code = field.getKey();
            InstalledUnit local = installed.get(code);

            if (local != null && !local.acceptsUpdates()) {
                LOG.debug("Skipping update for {} (frozen or locked)", code);
                serverCount = Math.max(0, serverCount - 1);
                continue;
            }

            UpdateOffer offer = offer(code, field.getValue());
            pluginOffers.put(code, local == null
                    ? offer
                    : offer.withLocalDetails(local.name(), local.version(), local.icon()));
        }

        Map<String, UpdateOffer> themeOffers = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = response.path("themes").fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> field = it.next();
            if (!themes.isInstalled(field.getKey()))
                themeOffers.put(field.getKey(), offer(field.getKey(), field.getValue()));
        }

        if (coreOffer != null && config.getGateway().isDisableCoreUpdates()) {
            LOG.debug("Core update {} suppressed, core updates are disabled", coreOffer.targetVersion());
            serverCount = Math.max(0, serverCount - 1);
            coreOffer = null;
        }

        UpdateNegotiationResult result = new UpdateNegotiationResult(coreOffer, pluginOffers, themeOffers);

        int offered = pluginOffers.size() + (coreOffer != null ? 1 : 0);
        if (serverCount != offered) {
            LOG.warn("Gateway reported {} plugin/core updates but offered {}; counting offers", serverCount, offered);
        }

        persistCount(result.updateCount());
        LOG.info("Negotiated {} pending updates", result.updateCount());
        return result;
    }

    /** Re-arms negotiation after a full update run. */
    public void resetCount() {
        parameters.set(ParameterKeys.UPDATE_COUNT, "0");
    }

    public RetryState retryState() {
        int count = parameters.getInt(ParameterKeys.UPDATE_COUNT, 0);
        long retry = parameters.getLong(ParameterKeys.UPDATE_RETRY, 0);
        return new RetryState(count, retry > 0 ? Instant.ofEpochSecond(retry) : null);
    }

    /** Installation fingerprint sent as {@code core}. */
    public String coreHash() {
        return parameters.get(ParameterKeys.CORE_HASH, DEFAULT_CORE_HASH);
    }

    private void persistCount(int count) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(ParameterKeys.UPDATE_COUNT, Integer.toString(count));
        values.put(ParameterKeys.UPDATE_RETRY, Long.toString(clock.instant().plus(RETRY_WINDOW).getEpochSecond()));
        parameters.setAll(values);
    }

    private String base64Json(Object value) {
        try {
            return BaseEncoding.base64().encode(mapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode negotiation parameter", e);
        }
    }

    /** Server offers carry {@code version} (plugins, themes) or {@code build} (core). */
    private static UpdateOffer offer(String code, JsonNode node) {
        String target = node.path("version").asText(null);
        if (target == null)
            target = node.path("build").asText(null);
        return UpdateOffer.of(code, target, node.path("hash").asText(null));
    }

    private static boolean isPresent(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode())
            return false;
        if (node.isBoolean())
            return node.booleanValue();
        return !node.isContainerNode() || node.size() > 0;
    }
}

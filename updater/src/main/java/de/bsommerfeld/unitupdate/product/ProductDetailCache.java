package de.bsommerfeld.unitupdate.product;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.unitupdate.core.cache.CacheStore;
import de.bsommerfeld.unitupdate.core.domain.ProductType;
import de.bsommerfeld.unitupdate.gateway.GatewayClient;
import de.bsommerfeld.unitupdate.gateway.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Marketplace details for plugins and themes, cached in two tiers.
 *
 * <h3>Detail map</h3>
 * All known details of both product types are stored as one JSON document
 * under {@link #DETAILS_KEY} for two days. Codes the gateway did not know are
 * remembered as JSON {@code null}, so they are not requested again until the
 * entry expires. The whole map is read by {@link #load()} and written back by
 * {@link #save()}.
 *
 * <h3>Popular lists</h3>
 * The popular list of each type lives under its own key for 60 minutes.
 * Fetching it also feeds every listed product into the detail map.
 *
 * <p>
 * There is no locking across processes. Two concurrent writers each store
 * their own view of the map and the last one wins.
 */
@Singleton
public class ProductDetailCache {

    private static final Logger LOG = LoggerFactory.getLogger(ProductDetailCache.class);

    public static final String DETAILS_KEY = "system-updates-product-details";
    public static final String POPULAR_KEY_PREFIX = "system-updates-popular-";

    static final Duration DETAILS_TTL = Duration.ofDays(2);
    static final Duration POPULAR_TTL = Duration.ofMinutes(60);

    private final GatewayClient gateway;
    private final CacheStore cache;
    private final ObjectMapper mapper;

    private Map<ProductType, Map<String, JsonNode>> details;

    @Inject
    public ProductDetailCache(GatewayClient gateway, CacheStore cache, ObjectMapper mapper) {
        this.gateway = gateway;
        this.cache = cache;
        this.mapper = mapper;
    }

    /**
     * Returns the details of every requested code the gateway knows. Codes
     * not cached yet are resolved with a single {@code {type}/details}
     * request; the rest are answered from the cache.
     */
    public List<JsonNode> lookup(ProductType type, Collection<String> codes) throws GatewayException {
        load();
        Map<String, JsonNode> known = details.get(type);

        Set<String> requested = new LinkedHashSet<>(codes);
        List<String> newCodes = requested.stream()
                .filter(code -> !known.containsKey(code))
                .toList();

        if (!newCodes.isEmpty()) {
            JsonNode data = gateway.requestData(type.wireName() + "/details", Map.of("names", newCodes));
            Set<String> returned = new LinkedHashSet<>();
            for (JsonNode product : data) {
                String code = product.path("code").asText(null);
                if (code == null)
                    continue;
                known.put(code, product);
                returned.add(code);
            }
            for (String code : newCodes) {
                if (!returned.contains(code))
                    known.put(code, NullNode.getInstance());
            }
            save();
            LOG.debug("Resolved {} new {} codes ({} unknown)", newCodes.size(), type.wireName(),
                    newCodes.size() - returned.size());
        }

        List<JsonNode> result = new ArrayList<>();
        for (String code : requested) {
            JsonNode detail = known.get(code);
            if (detail != null && !detail.isNull())
                result.add(detail);
        }
        return result;
    }

    /** Returns the marketplace's popular products of {@code type}. */
    public List<JsonNode> popular(ProductType type) throws GatewayException {
        String key = POPULAR_KEY_PREFIX + type.wireName();

        Optional<String> cached = cache.get(key);
        if (cached.isPresent()) {
            try {
                return toList(mapper.readTree(cached.get()));
            } catch (JsonProcessingException e) {
                LOG.warn("Discarding unreadable popular {} cache entry", type.wireName());
            }
        }

        JsonNode data = gateway.requestData(type.wireName() + "/popular");
        cache.put(key, data.toString(), POPULAR_TTL);

        if (details == null)
            load();
        Map<String, JsonNode> known = details.get(type);
        for (JsonNode product : data) {
            String code = product.path("code").asText(null);
            if (code != null)
                known.put(code, product);
        }
        save();

        return toList(data);
    }

    /** Replaces the in-memory map with the stored one, or an empty map. */
    public void load() {
        details = emptyDetails();
        Optional<String> stored = cache.get(DETAILS_KEY);
        if (stored.isEmpty())
            return;

        try {
            JsonNode root = mapper.readTree(stored.get());
            for (ProductType type : ProductType.values()) {
                JsonNode section = root.path(type.wireName());
                Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    details.get(type).put(field.getKey(), field.getValue());
                }
            }
        } catch (JsonProcessingException e) {
            LOG.warn("Discarding unreadable product detail cache", e);
            details = emptyDetails();
        }
    }

    /** Writes the whole in-memory map back to the store. */
    public void save() {
        if (details == null)
            load();

        ObjectNode root = mapper.createObjectNode();
        for (ProductType type : ProductType.values()) {
            ObjectNode section = root.putObject(type.wireName());
            details.get(type).forEach(section::set);
        }
        cache.put(DETAILS_KEY, root.toString(), DETAILS_TTL);
    }

    /** Drops the in-memory map and the stored copy. */
    public void invalidate() {
        details = null;
        cache.forget(DETAILS_KEY);
    }

    private static Map<ProductType, Map<String, JsonNode>> emptyDetails() {
        Map<ProductType, Map<String, JsonNode>> map = new EnumMap<>(ProductType.class);
        for (ProductType type : ProductType.values()) {
            map.put(type, new LinkedHashMap<>());
        }
        return map;
    }

    private static List<JsonNode> toList(JsonNode array) {
        List<JsonNode> list = new ArrayList<>();
        array.forEach(list::add);
        return list;
    }
}

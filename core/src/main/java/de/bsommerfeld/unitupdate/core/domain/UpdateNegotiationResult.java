package de.bsommerfeld.unitupdate.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one negotiation round with the gateway, after all local exclusion
 * rules have been applied. The count always equals the number of offers held.
 *
 * @param coreOffer    core update on offer, if any survived the exclusions
 * @param pluginOffers plugin offers keyed by plugin code, in server order
 * @param themeOffers  theme offers keyed by theme code, in server order
 */
public record UpdateNegotiationResult(
        UpdateOffer coreOffer,
        Map<String, UpdateOffer> pluginOffers,
        Map<String, UpdateOffer> themeOffers) {

    public UpdateNegotiationResult {
        pluginOffers = Collections.unmodifiableMap(new LinkedHashMap<>(pluginOffers));
        themeOffers = Collections.unmodifiableMap(new LinkedHashMap<>(themeOffers));
    }

    public static UpdateNegotiationResult empty() {
        return new UpdateNegotiationResult(null, Map.of(), Map.of());
    }

    public Optional<UpdateOffer> core() {
        return Optional.ofNullable(coreOffer);
    }

    public int updateCount() {
        return pluginOffers.size() + themeOffers.size() + (coreOffer != null ? 1 : 0);
    }

    public boolean hasUpdates() {
        return updateCount() > 0;
    }
}

package de.bsommerfeld.unitupdate.core.domain;

/**
 * A candidate update reported by the gateway for one unit. Only
 * {@code code}, {@code targetVersion} and {@code targetHash} come from the
 * server; the remaining fields are filled in from local state.
 *
 * @param code          unit code, {@code core} for the application itself
 * @param targetVersion version (plugins, themes) or build number (core) on offer
 * @param targetHash    hash of the artifact to download
 * @param oldVersion    locally installed version, {@code null} if unknown
 * @param oldBuild      locally installed core build, {@code null} for non-core
 * @param name          display name
 * @param icon          icon reference, may be {@code null}
 */
public record UpdateOffer(
        String code,
        String targetVersion,
        String targetHash,
        String oldVersion,
        String oldBuild,
        String name,
        String icon) {

    public static UpdateOffer of(String code, String targetVersion, String targetHash) {
        return new UpdateOffer(code, targetVersion, targetHash, null, null, code, null);
    }

    public UpdateOffer withOldBuild(String build) {
        return new UpdateOffer(code, targetVersion, targetHash, oldVersion, build, name, icon);
    }

    public UpdateOffer withLocalDetails(String localName, String localVersion, String localIcon) {
        return new UpdateOffer(code, targetVersion, targetHash, localVersion, oldBuild,
                localName != null ? localName : code, localIcon);
    }
}

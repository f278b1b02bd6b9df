package de.bsommerfeld.unitupdate.core.domain;

import java.time.Instant;

/**
 * Locally recorded state of an installed plugin.
 *
 * @param code        unique identifier, e.g. {@code Acme.Blog}
 * @param version     currently applied version, opaque ordered string
 * @param name        display name
 * @param icon        icon reference, may be {@code null}
 * @param frozen      updates are suppressed by the administrator
 * @param updatable   updates are permitted at all
 * @param installedAt time the record was first created
 */
public record InstalledUnit(
        String code,
        String version,
        String name,
        String icon,
        boolean frozen,
        boolean updatable,
        Instant installedAt) {

    /** Updates are only offered for units that are neither frozen nor locked. */
    public boolean acceptsUpdates() {
        return !frozen && updatable;
    }
}

package de.bsommerfeld.unitupdate.core.param;

/**
 * Keys of the parameters the updater reads and writes.
 */
public final class ParameterKeys {

    /** Build number of the installed core. */
    public static final String CORE_BUILD = "system::core.build";

    /** Content hash of the installed core. */
    public static final String CORE_HASH = "system::core.hash";

    /** Whether the core files differ from the recorded build. */
    public static final String CORE_MODIFIED = "system::core.modified";

    /** Number of updates found by the last negotiation. */
    public static final String UPDATE_COUNT = "system::update.count";

    /** Epoch seconds before which no unforced negotiation runs. */
    public static final String UPDATE_RETRY = "system::update.retry";

    /** Marketplace project the installation is attached to. */
    public static final String PROJECT_ID = "system::project.id";

    private ParameterKeys() {
    }
}

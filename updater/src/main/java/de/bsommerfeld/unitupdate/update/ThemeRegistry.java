package de.bsommerfeld.unitupdate.update;

import java.util.Set;

/**
 * Installed-flag bookkeeping for themes. Bound by the host.
 */
public interface ThemeRegistry {

    Set<String> installedCodes();

    boolean isInstalled(String code);

    void setInstalled(String code);
}

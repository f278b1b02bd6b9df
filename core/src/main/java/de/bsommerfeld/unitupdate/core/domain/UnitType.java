package de.bsommerfeld.unitupdate.core.domain;

/**
 * Kinds of installable units. Modules ship with the application and have no
 * version record of their own; plugins and themes are installed separately.
 */
public enum UnitType {
    CORE,
    MODULE,
    PLUGIN,
    THEME
}

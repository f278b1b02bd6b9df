package de.bsommerfeld.unitupdate.core.domain;

/**
 * Marketplace product categories the gateway can describe. The wire name is
 * used as the endpoint prefix ({@code plugin/details}, {@code theme/popular}).
 */
public enum ProductType {

    PLUGIN("plugin"),
    THEME("theme");

    private final String wireName;

    ProductType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

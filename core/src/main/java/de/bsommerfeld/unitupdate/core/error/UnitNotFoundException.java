package de.bsommerfeld.unitupdate.core.error;

/**
 * A plugin or module was referenced that neither the registry nor the local
 * records know about.
 */
public class UnitNotFoundException extends UpdateException {

    private final String code;

    public UnitNotFoundException(String code) {
        super("Unable to find: " + code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

package de.bsommerfeld.unitupdate.gateway;

import de.bsommerfeld.unitupdate.core.error.UpdateException;

/**
 * Communication with the update gateway failed.
 */
public class GatewayException extends UpdateException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}

package de.bsommerfeld.unitupdate.gateway;

/**
 * A 200 response whose content cannot be trusted or understood.
 */
public class InvalidResponseException extends GatewayException {

    static final String INVALID_RESPONSE = "Invalid response from the server";

    public InvalidResponseException() {
        super(INVALID_RESPONSE);
    }

    public InvalidResponseException(String detail) {
        super(INVALID_RESPONSE + " (" + detail + ")");
    }

    public InvalidResponseException(String detail, Throwable cause) {
        super(INVALID_RESPONSE + " (" + detail + ")", cause);
    }
}

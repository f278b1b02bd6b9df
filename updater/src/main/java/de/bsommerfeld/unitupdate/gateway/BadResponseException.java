package de.bsommerfeld.unitupdate.gateway;

/**
 * The gateway answered with a status other than 200. The message is the
 * response body, which the gateway uses to explain the failure.
 */
public class BadResponseException extends GatewayException {

    static final String EMPTY_RESPONSE = "Empty response from the server";

    private final int status;

    public BadResponseException(int status, String body) {
        super(body == null || body.isEmpty() ? EMPTY_RESPONSE : body);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}

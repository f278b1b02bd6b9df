package de.bsommerfeld.unitupdate.gateway;

/**
 * The gateway answered 404 for the requested endpoint.
 */
public class GatewayNotFoundException extends GatewayException {

    public GatewayNotFoundException(String url) {
        super("The server could not find the requested resource: " + url);
    }
}

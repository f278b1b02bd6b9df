package de.bsommerfeld.unitupdate.gateway;

/**
 * The response signature is missing or does not verify against the gateway
 * public key. The payload must not be used.
 */
public class BadSignatureException extends InvalidResponseException {

    public BadSignatureException() {
        super("Bad signature");
    }
}

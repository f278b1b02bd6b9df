package de.bsommerfeld.unitupdate.gateway;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Map;

/**
 * Signs outbound gateway requests and verifies inbound gateway responses.
 *
 * <h3>Outbound</h3>
 * The request parameters are canonicalized with {@link QueryStringEncoder}
 * and authenticated with HMAC-SHA512, keyed by the base64-decoded API
 * secret. The base64 MAC travels in the {@code Rest-Sign} header.
 *
 * <h3>Inbound</h3>
 * The gateway signs the base64 of the compact JSON encoding of its payload
 * with RSA/SHA-1. The payload is re-encoded here with the gateway's escaping
 * rules (slashes and non-ASCII characters escaped) before verification.
 * A response that does not verify must be discarded.
 */
public final class SignatureCodec {

    private static final Logger LOG = LoggerFactory.getLogger(SignatureCodec.class);

    static final String SIGNATURE_ALGORITHM = "SHA1withRSA";

    /** Signing key of the public gateway. */
    public static final String DEFAULT_PUBLIC_KEY = """
            -----BEGIN PUBLIC KEY-----
            MIIBIjANBgkqhkiG9w0BAQEFAAOCAQ8AMIIBCgKCAQEAt+KwvTXqC8Mz9vV4KIvX
            3y+aZusrlg26jdbNVUuhXNFbt1VisjJydHW2+WGsiEHSy2s61ZAV2dICR6f3huSw
            jY/MH9j23Oo/u61CBpvIS3Q8uC+TLtJl4/F9eqlnzocfMoKe8NmcBbUR3TKQoIok
            xbSMl6jiE2k5TJdzhHUxjZRIeeLDLMKYX6xt37LdhuM8zO6sXQmCGg4J6LmHTJph
            96H11gBvcFSFJSmIiDykJOELZl/aVcY1g3YgpL0mw5Bw1VTmKaRdz1eBi9DmKrKX
            UijG4gD8eLRV/FS/sZCFNR/evbQXvTBxO0TOIVi85PlQEcMl4SBj0CoTyNbcAGtz
            4wIDAQAB
            -----END PUBLIC KEY-----
            """;

    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper(
            new JsonFactoryBuilder().characterEscapes(new GatewayEscapes()).build());

    private SignatureCodec() {
    }

    /**
     * Computes the request signature for {@code payload}.
     *
     * @param secret base64-encoded API secret
     * @throws IllegalArgumentException if {@code secret} is not valid base64
     */
    public static String sign(Map<String, ?> payload, String secret) {
        byte[] key = BaseEncoding.base64().decode(secret.trim());
        byte[] mac = Hashing.hmacSha512(key)
                .hashString(QueryStringEncoder.encode(payload), StandardCharsets.UTF_8)
                .asBytes();
        return BaseEncoding.base64().encode(mac);
    }

    /**
     * Checks the gateway signature of a decoded response payload. Returns
     * {@code false} for blank or malformed signatures and unusable keys;
     * never throws.
     */
    public static boolean verify(JsonNode payload, String signature, PublicKey publicKey) {
        if (payload == null || signature == null || signature.isBlank() || publicKey == null)
            return false;

        try {
            byte[] decoded = BaseEncoding.base64().decode(signature.trim());
            Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(canonicalForm(payload));
            return verifier.verify(decoded);
        } catch (IllegalArgumentException | GeneralSecurityException | JsonProcessingException e) {
            LOG.debug("Signature rejected: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Parses a PEM encoded ({@code BEGIN PUBLIC KEY}) RSA public key.
     *
     * @throws IllegalArgumentException if the PEM is malformed
     */
    public static PublicKey parsePublicKey(String pem) {
        String body = pem
                .replace("-----BEGIN PUBLIC KEY-----", "")
                .replace("-----END PUBLIC KEY-----", "")
                .replaceAll("\\s", "");
        try {
            byte[] der = BaseEncoding.base64().decode(body);
            return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new IllegalArgumentException("Malformed public key", e);
        }
    }

    /** Bytes the gateway signs for {@code payload}. */
    static byte[] canonicalForm(JsonNode payload) throws JsonProcessingException {
        byte[] json = CANONICAL_JSON.writeValueAsBytes(payload);
        return BaseEncoding.base64().encode(json).getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Escapes {@code /}, control characters and every non-ASCII character as
     * lowercase unicode escapes, matching the gateway's JSON encoder.
     */
    private static final class GatewayEscapes extends CharacterEscapes {

        private static final SerializableString SLASH = new SerializedString("\\/");

        private final int[] escapes;

        GatewayEscapes() {
            escapes = CharacterEscapes.standardAsciiEscapesForJSON();
            escapes['/'] = CharacterEscapes.ESCAPE_CUSTOM;
            for (int c = 0; c < 0x20; c++) {
                if (escapes[c] == CharacterEscapes.ESCAPE_STANDARD)
                    escapes[c] = CharacterEscapes.ESCAPE_CUSTOM;
            }
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return escapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            if (ch == '/')
                return SLASH;
            if (ch < 0x20 || ch > 0x7F)
                return new SerializedString(String.format("\\u%04x", ch));
            return null;
        }
    }
}

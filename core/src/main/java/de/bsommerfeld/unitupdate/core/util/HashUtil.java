package de.bsommerfeld.unitupdate.core.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * MD5 fingerprints as used by the update gateway: download names, archive
 * checksums and the installation hash. Streams files so large archives are
 * never held in memory.
 */
public final class HashUtil {

    private static final String ALGORITHM = "MD5";
    private static final int BUFFER_SIZE = 8192;

    private HashUtil() {}

    /**
     * Hex-encoded MD5 of the given file.
     *
     * @throws IOException if the file cannot be read
     */
    public static String md5(Path file) throws IOException {
        MessageDigest digest = newDigest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /** Hex-encoded MD5 of the UTF-8 bytes of {@code text}. */
    public static String md5(String text) {
        MessageDigest digest = newDigest();
        digest.update(text.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JVM ships MD5
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }
}

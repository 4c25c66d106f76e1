package de.htwsaar.ministream.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Sha256Util {

    private Sha256Util() {}

    public static String sha256Hex(byte[] data) {
        return HexFormat.of().formatHex(digest("SHA-256", data));
    }

    public static String sha256Hex(String text) {
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    /** SHA-1 wird nur für Info-Hashes von Torrent-Metadaten gebraucht. */
    public static String sha1Hex(byte[] data) {
        return HexFormat.of().formatHex(digest("SHA-1", data));
    }

    private static byte[] digest(String algorithm, byte[] data) {
        try {
            return MessageDigest.getInstance(algorithm).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to compute " + algorithm, e);
        }
    }
}

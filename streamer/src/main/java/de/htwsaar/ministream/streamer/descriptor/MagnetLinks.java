package de.htwsaar.ministream.streamer.descriptor;

import de.htwsaar.ministream.streamer.domain.ContentDescriptor;
import de.htwsaar.ministream.streamer.domain.SessionKey;
import de.htwsaar.ministream.streamer.service.ErrorKind;
import de.htwsaar.ministream.streamer.service.StreamerException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parsen und Erzeugen von Magnet-Links ({@code magnet:?xt=urn:btih:…}).
 */
public final class MagnetLinks {

    private static final String SCHEME = "magnet:?";
    private static final String BTIH = "urn:btih:";
    private static final Pattern HEX_40 = Pattern.compile("[0-9a-fA-F]{40}");
    private static final Pattern BASE32_32 = Pattern.compile("[A-Za-z2-7]{32}");
    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[<>:\"/\\\\|?*\\[\\]()]");
    private static final String BASE32_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";

    private MagnetLinks() {}

    /**
     * Zerlegt einen Magnet-Link in Session-Schlüssel und Anzeigenamen.
     *
     * @param raw Magnet-Link
     * @return Descriptor mit normalisiertem Schlüssel
     * @throws StreamerException {@link ErrorKind#INVALID_INPUT} bei fehlendem oder ungültigem Link
     */
    public static ContentDescriptor parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw invalid("Missing content locator");
        }
        String trimmed = raw.trim();
        if (!trimmed.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
            throw invalid("Invalid magnet link: expected '" + SCHEME + "…'");
        }

        String hash = null;
        String name = "";
        for (String part : trimmed.substring(SCHEME.length()).split("&")) {
            int eq = part.indexOf('=');
            if (eq <= 0) continue;
            String param = part.substring(0, eq).toLowerCase(Locale.ROOT);
            String value = decode(part.substring(eq + 1));
            if ((param.equals("xt") || param.startsWith("xt.")) && hash == null
                    && value.regionMatches(true, 0, BTIH, 0, BTIH.length())) {
                hash = value.substring(BTIH.length());
            } else if (param.equals("dn") && name.isEmpty()) {
                name = sanitizeName(value);
            }
        }
        if (hash == null) {
            throw invalid("Invalid magnet link: no 'urn:btih' exact topic");
        }
        return new ContentDescriptor(new SessionKey(normalizeInfoHash(hash)), name, trimmed);
    }

    /**
     * Baut einen Magnet-Link aus Infohash, Name und Trackern.
     *
     * @param infoHashHex hex-codierter Infohash
     * @param name        Anzeigename oder {@code null}
     * @param trackers    Tracker-URLs, Reihenfolge bleibt erhalten
     * @return Magnet-Link
     */
    public static String build(String infoHashHex, String name, List<String> trackers) {
        StringBuilder sb = new StringBuilder(SCHEME).append("xt=").append(BTIH)
                .append(infoHashHex.toLowerCase(Locale.ROOT));
        if (name != null && !name.isBlank()) {
            sb.append("&dn=").append(URLEncoder.encode(name, StandardCharsets.UTF_8));
        }
        for (String tracker : trackers) {
            sb.append("&tr=").append(URLEncoder.encode(tracker, StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    /**
     * Ersetzt Zeichen, die in Dateinamen problematisch sind, durch {@code _}.
     */
    public static String sanitizeName(String name) {
        if (name == null) return "";
        return UNSAFE_NAME_CHARS.matcher(name).replaceAll("_");
    }

    static String normalizeInfoHash(String hash) {
        if (HEX_40.matcher(hash).matches()) {
            return hash.toLowerCase(Locale.ROOT);
        }
        if (BASE32_32.matcher(hash).matches()) {
            return HexFormat.of().formatHex(decodeBase32(hash.toUpperCase(Locale.ROOT)));
        }
        throw invalid("Invalid info hash: '" + hash + "'");
    }

    private static byte[] decodeBase32(String s) {
        byte[] out = new byte[s.length() * 5 / 8];
        int buffer = 0;
        int bits = 0;
        int index = 0;
        for (char c : s.toCharArray()) {
            buffer = (buffer << 5) | BASE32_ALPHABET.indexOf(c);
            bits += 5;
            if (bits >= 8) {
                out[index++] = (byte) (buffer >> (bits - 8));
                bits -= 8;
            }
        }
        return out;
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw invalid("Invalid magnet link: malformed escape sequence");
        }
    }

    private static StreamerException invalid(String message) {
        return new StreamerException(ErrorKind.INVALID_INPUT, message);
    }
}

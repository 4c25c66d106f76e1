package de.htwsaar.ministream.streamer.descriptor;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimaler Bencode-Parser für Torrent-Metadateien.
 *
 * <p>Abbildung: Integer → {@link Long}, Byte-String → {@code byte[]}, Liste → {@link List},
 * Dictionary → {@link Map} mit UTF-8-Schlüsseln. Für das Wurzel-Dictionary werden zusätzlich
 * die Roh-Bytes jedes Werts gemerkt, da der Infohash über die exakten Bytes gebildet wird.</p>
 */
final class BencodeReader {

    private static final int MAX_DEPTH = 64;

    private final byte[] data;
    private final Map<String, int[]> rootSpans = new HashMap<>();
    private int pos;

    BencodeReader(byte[] data) {
        this.data = data;
    }

    /**
     * Liest genau einen Wert; nachfolgende Bytes sind ein Fehler.
     *
     * @throws IllegalArgumentException bei ungültigem Bencode
     */
    Object readDocument() {
        pos = 0;
        rootSpans.clear();
        Object value = readValue(0);
        if (pos != data.length) {
            throw error("trailing data after document");
        }
        return value;
    }

    /**
     * @param key Schlüssel im Wurzel-Dictionary
     * @return exakte Bytes des Werts oder {@code null}
     */
    byte[] rawRootValue(String key) {
        int[] span = rootSpans.get(key);
        return span == null ? null : Arrays.copyOfRange(data, span[0], span[1]);
    }

    private Object readValue(int depth) {
        if (depth > MAX_DEPTH) throw error("nesting too deep");
        if (pos >= data.length) throw error("unexpected end of data");
        byte b = data[pos];
        return switch (b) {
            case 'i' -> readInteger();
            case 'l' -> readList(depth);
            case 'd' -> readDictionary(depth);
            default -> {
                if (b < '0' || b > '9') throw error("unexpected byte '" + (char) b + "'");
                yield readBytes();
            }
        };
    }

    private Long readInteger() {
        pos++; // 'i'
        int end = indexOf('e');
        String digits = new String(data, pos, end - pos, StandardCharsets.US_ASCII);
        pos = end + 1;
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw error("invalid integer '" + digits + "'");
        }
    }

    private byte[] readBytes() {
        int colon = indexOf(':');
        int length;
        try {
            length = Integer.parseInt(new String(data, pos, colon - pos, StandardCharsets.US_ASCII));
        } catch (NumberFormatException ex) {
            throw error("invalid string length");
        }
        int start = colon + 1;
        if (length < 0 || start + length > data.length) throw error("string exceeds data");
        pos = start + length;
        return Arrays.copyOfRange(data, start, pos);
    }

    private List<Object> readList(int depth) {
        pos++; // 'l'
        List<Object> list = new ArrayList<>();
        while (peek() != 'e') {
            list.add(readValue(depth + 1));
        }
        pos++;
        return list;
    }

    private Map<String, Object> readDictionary(int depth) {
        pos++; // 'd'
        Map<String, Object> dict = new LinkedHashMap<>();
        while (peek() != 'e') {
            if (data[pos] < '0' || data[pos] > '9') throw error("dictionary key must be a string");
            String key = new String(readBytes(), StandardCharsets.UTF_8);
            int start = pos;
            dict.put(key, readValue(depth + 1));
            if (depth == 0) {
                rootSpans.put(key, new int[] {start, pos});
            }
        }
        pos++;
        return dict;
    }

    private byte peek() {
        if (pos >= data.length) throw error("unexpected end of data");
        return data[pos];
    }

    private int indexOf(char c) {
        for (int i = pos; i < data.length; i++) {
            if (data[i] == c) return i;
        }
        throw error("missing '" + c + "'");
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException("Invalid bencode at offset " + pos + ": " + message);
    }
}

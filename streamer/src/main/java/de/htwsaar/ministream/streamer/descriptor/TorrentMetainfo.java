package de.htwsaar.ministream.streamer.descriptor;

import de.htwsaar.ministream.common.util.Sha256Util;
import de.htwsaar.ministream.streamer.service.ErrorKind;
import de.htwsaar.ministream.streamer.service.StreamerException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Die für einen Magnet-Link relevanten Teile einer Torrent-Metadatei.
 *
 * @param infoHash SHA-1 über das bencodierte {@code info}-Dictionary, hex
 * @param name     Name aus {@code info.name}, ggf. leer
 * @param trackers Tracker aus {@code announce} und {@code announce-list}, ohne Duplikate
 */
public record TorrentMetainfo(String infoHash, String name, List<String> trackers) {

    public TorrentMetainfo {
        trackers = List.copyOf(trackers);
    }

    /**
     * @param torrent Inhalt einer {@code .torrent}-Datei
     * @return ausgelesene Metainfo
     * @throws StreamerException {@link ErrorKind#INVALID_INPUT} bei ungültigem Inhalt
     */
    public static TorrentMetainfo parse(byte[] torrent) {
        if (torrent == null || torrent.length == 0) {
            throw invalid("Torrent file is empty");
        }
        BencodeReader reader = new BencodeReader(torrent);
        Object root;
        try {
            root = reader.readDocument();
        } catch (IllegalArgumentException ex) {
            throw new StreamerException(ErrorKind.INVALID_INPUT, "Failed to parse torrent file: " + ex.getMessage(), ex);
        }
        if (!(root instanceof Map<?, ?> rootDict)) {
            throw invalid("Failed to parse torrent file: root is not a dictionary");
        }
        if (!(rootDict.get("info") instanceof Map<?, ?> info)) {
            throw invalid("Failed to parse torrent file: missing 'info' dictionary");
        }

        String infoHash = Sha256Util.sha1Hex(reader.rawRootValue("info"));
        String name = text(info.containsKey("name.utf-8") ? info.get("name.utf-8") : info.get("name"));

        Set<String> trackers = new LinkedHashSet<>();
        String announce = text(rootDict.get("announce"));
        if (!announce.isBlank()) trackers.add(announce);
        if (rootDict.get("announce-list") instanceof List<?> tiers) {
            for (Object tier : tiers) {
                if (!(tier instanceof List<?> urls)) continue;
                for (Object url : urls) {
                    String t = text(url);
                    if (!t.isBlank()) trackers.add(t);
                }
            }
        }
        return new TorrentMetainfo(infoHash, name, List.copyOf(trackers));
    }

    public String toMagnetLink() {
        return MagnetLinks.build(infoHash, name, trackers);
    }

    private static String text(Object value) {
        return value instanceof byte[] bytes ? new String(bytes, StandardCharsets.UTF_8) : "";
    }

    private static StreamerException invalid(String message) {
        return new StreamerException(ErrorKind.INVALID_INPUT, message);
    }
}

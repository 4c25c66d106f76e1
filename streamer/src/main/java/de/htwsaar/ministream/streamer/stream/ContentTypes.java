package de.htwsaar.ministream.streamer.stream;

import java.util.Locale;
import java.util.Map;

/**
 * Content-Type anhand der Dateiendung; bewusst kleine, feste Tabelle.
 */
public final class ContentTypes {

    public static final String FALLBACK = "application/octet-stream";

    private static final Map<String, String> BY_EXTENSION = Map.of(
            "mp4", "video/mp4",
            "mkv", "video/x-matroska",
            "webm", "video/webm",
            "avi", "video/x-msvideo",
            "mp3", "audio/mpeg",
            "srt", "application/x-subrip",
            "vtt", "text/vtt",
            "ass", "text/x-ssa");

    private ContentTypes() {}

    public static String forPath(String path) {
        if (path == null) return FALLBACK;
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot == path.length() - 1) return FALLBACK;
        return BY_EXTENSION.getOrDefault(path.substring(dot + 1).toLowerCase(Locale.ROOT), FALLBACK);
    }
}

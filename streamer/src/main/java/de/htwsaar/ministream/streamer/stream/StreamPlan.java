package de.htwsaar.ministream.streamer.stream;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ergebnis der Planung eines Stream-Requests: Status, Header und zu liefernder Bereich.
 *
 * @param fileIndex gewählte Datei
 * @param status    HTTP-Status (200, 206 oder 416)
 * @param start     erstes zu lieferndes Byte
 * @param length    Anzahl zu liefernder Bytes (0 bei 416)
 * @param headers   zu setzende Response-Header in stabiler Reihenfolge
 */
public record StreamPlan(int fileIndex, int status, long start, long length, Map<String, String> headers) {

    public StreamPlan {
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public boolean hasBody() {
        return status != 416 && length > 0;
    }
}

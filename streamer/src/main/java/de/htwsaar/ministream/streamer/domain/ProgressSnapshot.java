package de.htwsaar.ministream.streamer.domain;

import java.util.List;

/**
 * Momentaufnahme des Transferfortschritts einer Session.
 *
 * @param bytesCompleted      bereits verfügbare Bytes über alle Dateien
 * @param totalBytes          Gesamtgröße
 * @param peerCount           aktuell verbundene Gegenstellen
 * @param fileBytesCompleted  verfügbare Bytes je Datei, gleiche Reihenfolge wie die Dateiliste
 */
public record ProgressSnapshot(long bytesCompleted, long totalBytes, int peerCount, List<Long> fileBytesCompleted) {

    public ProgressSnapshot {
        fileBytesCompleted = List.copyOf(fileBytesCompleted);
    }

    public double percentCompleted() {
        return percent(bytesCompleted, totalBytes);
    }

    public long fileBytesCompleted(int index) {
        return index >= 0 && index < fileBytesCompleted.size() ? fileBytesCompleted.get(index) : 0L;
    }

    public static double percent(long completed, long total) {
        return total > 0 ? (double) completed / total * 100 : 0.0;
    }
}

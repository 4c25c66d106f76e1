package de.htwsaar.ministream.streamer.subtitle;

/**
 * Aus der Logdatei abgeleiteter Zustand einer Extraktion.
 *
 * @param state    Zustand laut Log
 * @param progress letzte Fortschrittszeile oder {@code null}
 * @param lastLine letzte nicht-leere Logzeile
 */
public record ExtractionStatus(ExtractionState state, ExtractionProgress progress, String lastLine) {}

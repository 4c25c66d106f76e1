package de.htwsaar.ministream.streamer.dto;

/**
 * Antwort von {@code GET /api/subtitles/extract}.
 *
 * @param logFile      Name der Logdatei zum Pollen
 * @param subtitleFile Name der Ausgabedatei
 */
public record ExtractionStartResponse(String logFile, String subtitleFile) {}

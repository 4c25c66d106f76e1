package de.htwsaar.ministream.streamer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Antwort von {@code GET /api/subtitles/extract/status}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractionStatusResponse(String state, ProgressDto progress, String lastLine) {

    /** Zuletzt gemeldete Fortschrittszeile des Extraktionswerkzeugs. */
    public record ProgressDto(String size, String time, String bitrate, String speed) {}
}

package de.htwsaar.ministream.streamer.dto;

/** Antwort von {@code GET /api/subtitles/convert}. */
public record VttKeyResponse(String vttKey) {}

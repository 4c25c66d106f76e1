package de.htwsaar.ministream.streamer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Eintrag der Dateiliste einer Session.
 *
 * @param path      Pfad innerhalb des Inhalts
 * @param size      Größe in Bytes
 * @param sizeHuman Größe lesbar (z. B. "1.50 KB")
 * @param subtitle  {@code true} für konvertierbare Untertitel ({@code .srt})
 */
public record FileInfoDto(String path, long size, String sizeHuman, @JsonProperty("isSubtitle") boolean subtitle) {}

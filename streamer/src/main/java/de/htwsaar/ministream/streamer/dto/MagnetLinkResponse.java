package de.htwsaar.ministream.streamer.dto;

/** Ergebnis einer Torrent-Umwandlung. */
public record MagnetLinkResponse(String magnetLink) {}

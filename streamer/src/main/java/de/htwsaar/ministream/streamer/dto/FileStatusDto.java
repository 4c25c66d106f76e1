package de.htwsaar.ministream.streamer.dto;

/** Fortschritt einer einzelnen Datei. */
public record FileStatusDto(String path, long size, long bytesCompleted, double percentageCompleted) {}

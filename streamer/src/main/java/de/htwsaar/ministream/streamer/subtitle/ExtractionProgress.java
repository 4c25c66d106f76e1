package de.htwsaar.ministream.streamer.subtitle;

/**
 * Fortschrittszeile des Extraktionswerkzeugs ({@code size= … time= … bitrate= … speed= …}).
 */
public record ExtractionProgress(String size, String time, String bitrate, String speed) {}

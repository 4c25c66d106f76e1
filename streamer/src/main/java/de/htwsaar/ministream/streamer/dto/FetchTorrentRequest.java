package de.htwsaar.ministream.streamer.dto;

/** Request-Body von {@code POST /api/descriptors/fetch}. */
public record FetchTorrentRequest(String url) {}

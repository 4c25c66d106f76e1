package de.htwsaar.ministream.streamer.dto;

import java.util.List;

/** Antwort von {@code GET /api/metadata}. */
public record MetadataResponse(
        String infoHash, String name, long totalSize, String totalSizeHuman, int fileCount, List<FileInfoDto> files) {}

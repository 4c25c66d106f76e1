package de.htwsaar.ministream.streamer.dto;

import java.util.List;

/** Antwort von {@code GET /api/files}. */
public record FilesResponse(String infoHash, String name, List<FileInfoDto> files) {}

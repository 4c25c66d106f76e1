package de.htwsaar.ministream.streamer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Antwort von {@code GET /api/status}. Die {@code streamingFile*}-Felder fehlen,
 * wenn kein Dateiindex angefragt wurde.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResponse(
        String infoHash,
        String name,
        long totalBytes,
        long bytesCompleted,
        double percentageCompleted,
        double downloadSpeedBps,
        String downloadSpeedHuman,
        int connectedPeers,
        List<FileStatusDto> files,
        Long streamingFileSize,
        String streamingFileSizeHuman) {}

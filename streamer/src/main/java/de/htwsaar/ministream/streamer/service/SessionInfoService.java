package de.htwsaar.ministream.streamer.service;

import de.htwsaar.ministream.common.util.ByteSizeFormat;
import de.htwsaar.ministream.streamer.cache.CacheEntry;
import de.htwsaar.ministream.streamer.cache.Session;
import de.htwsaar.ministream.streamer.domain.ContentDescriptor;
import de.htwsaar.ministream.streamer.domain.FileDescriptor;
import de.htwsaar.ministream.streamer.domain.ProgressSnapshot;
import de.htwsaar.ministream.streamer.dto.FileInfoDto;
import de.htwsaar.ministream.streamer.dto.FileStatusDto;
import de.htwsaar.ministream.streamer.dto.FilesResponse;
import de.htwsaar.ministream.streamer.dto.MetadataResponse;
import de.htwsaar.ministream.streamer.dto.StatusResponse;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import org.springframework.stereotype.Service;

/**
 * Dateilisten, Zusammenfassung und Fortschritt von Sessions.
 */
@Service
public class SessionInfoService {

    private final SessionService sessionService;
    private final Clock clock;

    public SessionInfoService(SessionService sessionService, Clock clock) {
        this.sessionService = Objects.requireNonNull(sessionService, "sessionService must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public FilesResponse listFiles(String rawLocator) {
        Session session = sessionService.resolve(rawLocator);
        return new FilesResponse(session.key().hex(), session.displayName(), fileInfos(session));
    }

    public MetadataResponse describe(String rawLocator) {
        Session session = sessionService.resolve(rawLocator);
        return new MetadataResponse(
                session.key().hex(),
                session.displayName(),
                session.totalSize(),
                ByteSizeFormat.humanReadable(session.totalSize()),
                session.files().size(),
                fileInfos(session));
    }

    /**
     * Fortschritt einer bereits aktiven Session. Löst nichts auf.
     *
     * @param rawLocator Magnet-Link
     * @param fileIndex  Index der gestreamten Datei, leer ohne Angabe; {@code -1} wählt die größte Datei
     * @return Status inkl. Transferrate
     * @throws StreamerException {@link ErrorKind#NOT_FOUND}, wenn die Session nicht im Cache ist
     */
    public StatusResponse status(String rawLocator, OptionalInt fileIndex) {
        ContentDescriptor descriptor = sessionService.parse(rawLocator);
        CacheEntry entry = sessionService.cachedEntry(descriptor.key())
                .orElseThrow(() -> new StreamerException(ErrorKind.NOT_FOUND, "Session not found or not active"));

        Session session = entry.session();
        ProgressSnapshot progress = session.progress();
        double speed = entry.sampleSpeed(progress.bytesCompleted(), clock.millis());

        List<FileStatusDto> files = new ArrayList<>();
        for (int i = 0; i < session.files().size(); i++) {
            FileDescriptor f = session.file(i);
            long completed = progress.fileBytesCompleted(i);
            files.add(new FileStatusDto(f.path(), f.size(), completed, ProgressSnapshot.percent(completed, f.size())));
        }

        Long streamingSize = null;
        String streamingSizeHuman = null;
        if (fileIndex.isPresent()) {
            int selected = session.selectFileIndex(fileIndex.getAsInt());
            if (selected >= 0) {
                streamingSize = session.file(selected).size();
                streamingSizeHuman = ByteSizeFormat.humanReadable(streamingSize);
            }
        }

        return new StatusResponse(
                session.key().hex(),
                session.displayName(),
                session.totalSize(),
                progress.bytesCompleted(),
                ProgressSnapshot.percent(progress.bytesCompleted(), session.totalSize()),
                speed,
                ByteSizeFormat.humanReadableSpeed(speed),
                progress.peerCount(),
                files,
                streamingSize,
                streamingSizeHuman);
    }

    static boolean isSubtitle(String path) {
        return path.toLowerCase(Locale.ROOT).endsWith(".srt");
    }

    private static List<FileInfoDto> fileInfos(Session session) {
        return session.files().stream()
                .map(f -> new FileInfoDto(f.path(), f.size(), ByteSizeFormat.humanReadable(f.size()), isSubtitle(f.path())))
                .toList();
    }
}

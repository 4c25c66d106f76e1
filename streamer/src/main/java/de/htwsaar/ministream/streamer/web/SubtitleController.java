package de.htwsaar.ministream.streamer.web;

import de.htwsaar.ministream.streamer.cache.Session;
import de.htwsaar.ministream.streamer.domain.ContentDescriptor;
import de.htwsaar.ministream.streamer.dto.ExtractionStatusResponse;
import de.htwsaar.ministream.streamer.dto.VttKeyResponse;
import de.htwsaar.ministream.streamer.service.ErrorKind;
import de.htwsaar.ministream.streamer.service.SessionService;
import de.htwsaar.ministream.streamer.service.StreamerException;
import de.htwsaar.ministream.streamer.stream.ContentTypes;
import de.htwsaar.ministream.streamer.subtitle.ExtractionProgress;
import de.htwsaar.ministream.streamer.subtitle.ExtractionService;
import de.htwsaar.ministream.streamer.subtitle.ExtractionStatus;
import de.htwsaar.ministream.streamer.subtitle.SubtitleConversionService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP-Adapter der Untertitel-Pipeline: Konvertierung, Extraktion, Polling und Dateiabruf.
 */
@RestController
@RequestMapping("/api/subtitles")
public class SubtitleController {

    private static final MediaType TEXT_VTT = MediaType.parseMediaType("text/vtt;charset=utf-8");

    private final SessionService sessionService;
    private final SubtitleConversionService conversionService;
    private final ExtractionService extractionService;

    public SubtitleController(
            SessionService sessionService,
            SubtitleConversionService conversionService,
            ExtractionService extractionService) {
        this.sessionService = sessionService;
        this.conversionService = conversionService;
        this.extractionService = extractionService;
    }

    /**
     * Wandelt eine SRT-Datei der Session in WebVTT um.
     *
     * @param url      Magnet-Link
     * @param filePath exakter Pfad der SRT-Datei
     * @return {@code {"vttKey": …}}
     */
    @GetMapping("/convert")
    public ResponseEntity<?> convert(
            @RequestParam(value = "url", required = false) String url,
            @RequestParam(value = "filePath", required = false) String filePath) {
        try {
            Session session = sessionService.resolve(RequestParams.requireText(url, "url"));
            String key = conversionService.convert(session, RequestParams.requireText(filePath, "filePath"));
            return ResponseEntity.ok(new VttKeyResponse(key));
        } catch (StreamerException ex) {
            return ErrorResponses.of(ex);
        }
    }

    @GetMapping("/vtt")
    public ResponseEntity<?> vtt(@RequestParam(value = "key", required = false) String key) {
        try {
            byte[] body = conversionService.fetch(RequestParams.requireText(key, "key"));
            return ResponseEntity.ok().contentType(TEXT_VTT).body(body);
        } catch (StreamerException ex) {
            return ErrorResponses.of(ex);
        }
    }

    /**
     * Startet die Extraktion der ersten Untertitelspur; kehrt sofort zurück.
     *
     * @param url   Magnet-Link
     * @param index Index der Videodatei
     * @return {@code {"logFile": …, "subtitleFile": …}}
     */
    @GetMapping("/extract")
    public ResponseEntity<?> extract(
            @RequestParam(value = "url", required = false) String url,
            @RequestParam(value = "index", required = false) String index) {
        try {
            int fileIndex = RequestParams.requireIndex(index);
            ContentDescriptor descriptor = sessionService.parse(RequestParams.requireText(url, "url"));
            Session session = sessionService.resolve(descriptor);
            return ResponseEntity.ok(extractionService.start(session, descriptor, fileIndex));
        } catch (StreamerException ex) {
            return ErrorResponses.of(ex);
        }
    }

    @GetMapping("/extract/status")
    public ResponseEntity<?> extractionStatus(@RequestParam(value = "logFile", required = false) String logFile) {
        try {
            ExtractionStatus status = extractionService.poll(RequestParams.requireText(logFile, "logFile"));
            ExtractionProgress p = status.progress();
            return ResponseEntity.ok(new ExtractionStatusResponse(
                    status.state().name().toLowerCase(Locale.ROOT),
                    p == null ? null : new ExtractionStatusResponse.ProgressDto(p.size(), p.time(), p.bitrate(), p.speed()),
                    status.lastLine()));
        } catch (StreamerException ex) {
            return ErrorResponses.of(ex);
        }
    }

    /**
     * Liefert eine Datei aus dem Artefakt-Verzeichnis (Log oder extrahierte Spur).
     *
     * @param file Dateiname innerhalb des Verzeichnisses
     * @return Dateiinhalt
     */
    @GetMapping("/files")
    public ResponseEntity<?> file(@RequestParam(value = "file", required = false) String file) {
        try {
            Path path = extractionService.artifactFile(RequestParams.requireText(file, "file"));
            byte[] body = readArtifact(path);
            String name = path.getFileName().toString();
            MediaType type = name.endsWith(".log")
                    ? MediaType.TEXT_PLAIN
                    : MediaType.parseMediaType(ContentTypes.forPath(name));
            return ResponseEntity.ok().contentType(type).body(body);
        } catch (StreamerException ex) {
            return ErrorResponses.of(ex);
        }
    }

    private static byte[] readArtifact(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new StreamerException(ErrorKind.NOT_FOUND, "File not found", ex);
        }
    }
}

package de.htwsaar.ministream.streamer.subtitle;

import de.htwsaar.ministream.common.logging.TraceIdFilter;
import de.htwsaar.ministream.streamer.cache.Session;
import de.htwsaar.ministream.streamer.domain.ContentDescriptor;
import de.htwsaar.ministream.streamer.domain.SessionKey;
import de.htwsaar.ministream.streamer.dto.ExtractionStartResponse;
import de.htwsaar.ministream.streamer.service.ErrorKind;
import de.htwsaar.ministream.streamer.service.StreamerException;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Asynchrone Extraktion eingebetteter Untertitel über ein externes Werkzeug (ffmpeg).
 *
 * <p>Der Start kehrt sofort zurück; ein Monitor-Task wartet auf den Prozess, schreibt die
 * Abschlussmarke ins Log und setzt den Jobzustand. Clients pollen das Log über {@link #poll}.</p>
 */
@Service
public class ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(ExtractionService.class);

    private final ArtifactRegistry artifacts;
    private final ExtractionJobRegistry jobs;
    private final SubtitleToolLocator toolLocator;
    private final ProcessLauncher launcher;
    private final Executor monitorExecutor;
    private final String selfBaseUrl;

    /**
     * Erstellt den Service mit Constructor Injection.
     *
     * @param artifacts       Artefakt-Verzeichnis
     * @param jobs            Job-Buchführung
     * @param toolLocator     findet das Werkzeug
     * @param launcher        startet den Prozess
     * @param monitorExecutor führt die Monitor-Tasks aus
     * @param selfBaseUrl     Basis-URL dieses Servers, über die das Werkzeug den Stream liest
     */
    public ExtractionService(
            ArtifactRegistry artifacts,
            ExtractionJobRegistry jobs,
            SubtitleToolLocator toolLocator,
            ProcessLauncher launcher,
            @Qualifier("extractionMonitorExecutor") Executor monitorExecutor,
            @Value("${subtitles.extraction.self-base-url:http://localhost:${server.port:3000}}") String selfBaseUrl) {

        this.artifacts = Objects.requireNonNull(artifacts, "artifacts must not be null");
        this.jobs = Objects.requireNonNull(jobs, "jobs must not be null");
        this.toolLocator = Objects.requireNonNull(toolLocator, "toolLocator must not be null");
        this.launcher = Objects.requireNonNull(launcher, "launcher must not be null");
        this.monitorExecutor = Objects.requireNonNull(monitorExecutor, "monitorExecutor must not be null");
        this.selfBaseUrl = stripTrailingSlash(Objects.requireNonNull(selfBaseUrl, "selfBaseUrl must not be null"));
    }

    /**
     * Startet die Extraktion der ersten Untertitelspur einer Datei oder liefert einen bestehenden Job.
     *
     * @param session    aufgelöste Session
     * @param descriptor Locator der Session, für die Stream-URL
     * @param fileIndex  Index der Videodatei
     * @return Namen von Log- und Ausgabedatei
     * @throws StreamerException {@link ErrorKind#NOT_FOUND} bei ungültigem Index,
     *                           {@link ErrorKind#TOOL_UNAVAILABLE} wenn das Werkzeug fehlt
     */
    public ExtractionStartResponse start(Session session, ContentDescriptor descriptor, int fileIndex) {
        if (!session.hasFile(fileIndex)) {
            throw new StreamerException(ErrorKind.NOT_FOUND, "File index out of range");
        }
        Path tool = toolLocator.locate();

        SessionKey key = session.key();
        Path output = artifacts.directory().resolve(key.artifactPrefix() + fileIndex + ".ass");
        Path logPath = artifacts.directory().resolve(key.artifactPrefix() + fileIndex + ".log");
        ExtractionStartResponse handle =
                new ExtractionStartResponse(logPath.getFileName().toString(), output.getFileName().toString());

        ExtractionJob running = jobs.find(key, fileIndex).filter(ExtractionJob::isRunning).orElse(null);
        if (running != null) {
            log.info("Extraction for {} index {} already running", key, fileIndex);
            return handle;
        }
        if (alreadyExtracted(output, logPath)) {
            log.info("Subtitle for {} index {} already extracted", key, fileIndex);
            return handle;
        }

        ExtractionJob candidate = new ExtractionJob(key, fileIndex, output, logPath);
        if (jobs.registerIfIdle(candidate) != candidate) {
            return handle;
        }
        launch(candidate, tool, streamUrl(descriptor, fileIndex));
        return handle;
    }

    /**
     * Liest den Zustand einer Extraktion aus ihrer Logdatei. Blockiert nie auf den Prozess.
     *
     * @param logFile Name der Logdatei
     * @throws StreamerException {@link ErrorKind#NOT_FOUND} für unbekannte Logs
     */
    public ExtractionStatus poll(String logFile) {
        Path logPath = artifacts.resolveName(logFile);
        if (!Files.isRegularFile(logPath)) {
            throw new StreamerException(ErrorKind.NOT_FOUND, "Log file not found");
        }
        try {
            return ExtractionLogParser.parse(new String(Files.readAllBytes(logPath), StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new StreamerException(ErrorKind.INTERNAL, "Failed to read log file: " + ex.getMessage(), ex);
        }
    }

    /**
     * Liefert eine beliebige Datei aus dem Artefakt-Verzeichnis (Logs, Ausgaben).
     *
     * @throws StreamerException {@link ErrorKind#INVALID_INPUT} für Pfade außerhalb,
     *                           {@link ErrorKind#NOT_FOUND} für fehlende Dateien
     */
    public Path artifactFile(String fileName) {
        Path path = artifacts.resolveName(fileName);
        if (!Files.isRegularFile(path)) {
            throw new StreamerException(ErrorKind.NOT_FOUND, "File not found");
        }
        return path;
    }

    private void launch(ExtractionJob job, Path tool, String inputUrl) {
        List<String> command = List.of(
                tool.toString(), "-y", "-i", inputUrl, "-map", "0:s:0", "-c", "copy", job.outputPath().toString());
        Process process;
        try {
            Files.deleteIfExists(job.logPath());
            process = launcher.launch(command, job.logPath());
        } catch (IOException ex) {
            jobs.remove(job);
            throw new StreamerException(
                    ErrorKind.TOOL_UNAVAILABLE, "Failed to start " + toolLocator.tool() + ": " + ex.getMessage(), ex);
        }
        job.attach(process);
        log.info("Started subtitle extraction for {} index {} (pid {})", job.sessionKey(), job.fileIndex(), pid(process));

        String traceId = MDC.get(TraceIdFilter.TRACE_ID_KEY);
        try {
            monitorExecutor.execute(() -> monitor(job, process, traceId));
        } catch (RejectedExecutionException ex) {
            complete(job, ExtractionState.FAILED, ExtractionLogParser.FAILURE_MARKER + ": service is shutting down");
            job.cancel();
        }
    }

    private void monitor(ExtractionJob job, Process process, String traceId) {
        if (traceId != null) MDC.put(TraceIdFilter.TRACE_ID_KEY, traceId);
        try {
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                complete(job, ExtractionState.FAILED, ExtractionLogParser.FAILURE_MARKER + ": exit code " + exitCode);
            } else if (!hasContent(job.outputPath())) {
                complete(job, ExtractionState.FAILED,
                        ExtractionLogParser.FAILURE_MARKER + ": output file is missing or empty");
            } else {
                complete(job, ExtractionState.SUCCEEDED, ExtractionLogParser.SUCCESS_MARKER);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            job.cancel();
            complete(job, ExtractionState.FAILED, ExtractionLogParser.FAILURE_MARKER + ": interrupted");
        } finally {
            MDC.remove(TraceIdFilter.TRACE_ID_KEY);
        }
    }

    private void complete(ExtractionJob job, ExtractionState outcome, String marker) {
        if (!job.isCancelled()) {
            // Session bereits verdrängt: Log nicht wieder anlegen
            appendToLog(job.logPath(), "\n\n" + marker + "\n");
        }
        job.finish(outcome);
        if (outcome == ExtractionState.SUCCEEDED) {
            log.info("Subtitle extraction for {} index {} succeeded", job.sessionKey(), job.fileIndex());
        } else {
            log.warn("Subtitle extraction for {} index {} failed: {}", job.sessionKey(), job.fileIndex(), marker);
        }
    }

    private static boolean alreadyExtracted(Path output, Path logPath) {
        if (!hasContent(output) || !Files.isRegularFile(logPath)) return false;
        try {
            return Files.readString(logPath, StandardCharsets.ISO_8859_1).contains(ExtractionLogParser.SUCCESS_MARKER);
        } catch (IOException ex) {
            log.debug("Could not read {}: {}", logPath, ex.getMessage());
            return false;
        }
    }

    private static boolean hasContent(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException ex) {
            return false;
        }
    }

    private static void appendToLog(Path logPath, String text) {
        try {
            Files.writeString(logPath, text, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException ex) {
            log.warn("Could not write to extraction log {}: {}", logPath, ex.getMessage());
        }
    }

    private String streamUrl(ContentDescriptor descriptor, int fileIndex) {
        return selfBaseUrl + "/api/stream?url=" + URLEncoder.encode(descriptor.raw(), StandardCharsets.UTF_8)
                + "&index=" + fileIndex;
    }

    private static String pid(Process process) {
        try {
            return Long.toString(process.pid());
        } catch (UnsupportedOperationException ex) {
            return "n/a";
        }
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}

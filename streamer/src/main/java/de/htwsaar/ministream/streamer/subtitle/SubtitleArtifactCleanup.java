package de.htwsaar.ministream.streamer.subtitle;

import de.htwsaar.ministream.streamer.cache.SessionArtifactCleanup;
import de.htwsaar.ministream.streamer.domain.SessionKey;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Räumt beim Verdrängen einer Session ihre Untertitel-Artefakte auf:
 * laufende Extraktionen, registrierte Artefakte und alle Dateien {@code <key>_*}.
 */
@Component
public class SubtitleArtifactCleanup implements SessionArtifactCleanup {

    private static final Logger log = LoggerFactory.getLogger(SubtitleArtifactCleanup.class);

    private final ArtifactRegistry artifacts;
    private final ExtractionJobRegistry jobs;

    public SubtitleArtifactCleanup(ArtifactRegistry artifacts, ExtractionJobRegistry jobs) {
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts must not be null");
        this.jobs = Objects.requireNonNull(jobs, "jobs must not be null");
    }

    @Override
    public void cleanup(SessionKey key) {
        for (ExtractionJob job : jobs.removeSession(key)) {
            if (job.isRunning()) {
                log.info("Stopping extraction {} of evicted session {}", job.logFile(), key);
            }
            job.cancel();
        }

        String prefix = key.artifactPrefix();
        Set<Path> toDelete = new LinkedHashSet<>(artifacts.removeByPrefix(prefix));
        try (DirectoryStream<Path> files = Files.newDirectoryStream(artifacts.directory(), prefix + "*")) {
            for (Path file : files) {
                toDelete.add(file);
            }
        } catch (IOException ex) {
            log.warn("Could not list artifacts of {}: {}", key, ex.getMessage());
        }

        for (Path file : toDelete) {
            try {
                if (Files.deleteIfExists(file)) {
                    log.info("Deleted artifact {}", file.getFileName());
                }
            } catch (IOException ex) {
                log.warn("Failed to delete artifact {}: {}", file, ex.getMessage());
            }
        }
    }
}

package de.htwsaar.ministream.streamer.subtitle;

import de.htwsaar.ministream.streamer.domain.SessionKey;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Laufende oder beendete Untertitel-Extraktion für {@code (sessionKey, fileIndex)}.
 *
 * <p>Der Zustand wird nur vom zugehörigen Monitor geändert; Poller lesen ihn nur.</p>
 */
public final class ExtractionJob {

    private final SessionKey sessionKey;
    private final int fileIndex;
    private final Path outputPath;
    private final Path logPath;

    private volatile ExtractionState state = ExtractionState.RUNNING;
    private volatile Process process;
    private volatile boolean cancelled;

    ExtractionJob(SessionKey sessionKey, int fileIndex, Path outputPath, Path logPath) {
        this.sessionKey = Objects.requireNonNull(sessionKey, "sessionKey must not be null");
        this.fileIndex = fileIndex;
        this.outputPath = Objects.requireNonNull(outputPath, "outputPath must not be null");
        this.logPath = Objects.requireNonNull(logPath, "logPath must not be null");
    }

    public SessionKey sessionKey() {
        return sessionKey;
    }

    public int fileIndex() {
        return fileIndex;
    }

    public Path outputPath() {
        return outputPath;
    }

    public Path logPath() {
        return logPath;
    }

    public String logFile() {
        return logPath.getFileName().toString();
    }

    public String subtitleFile() {
        return outputPath.getFileName().toString();
    }

    public ExtractionState state() {
        return state;
    }

    public boolean isRunning() {
        return state == ExtractionState.RUNNING;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    void attach(Process process) {
        this.process = process;
    }

    void finish(ExtractionState outcome) {
        if (outcome == ExtractionState.RUNNING) {
            throw new IllegalArgumentException("outcome must be terminal");
        }
        if (state != ExtractionState.RUNNING) {
            throw new IllegalStateException("job " + logFile() + " already finished as " + state);
        }
        state = outcome;
    }

    /**
     * Bricht den Job ab, weil seine Session verdrängt wurde; der Prozess wird beendet.
     */
    void cancel() {
        cancelled = true;
        Process p = process;
        if (p != null) stopBestEffort(p);
    }

    private static void stopBestEffort(Process p) {
        try {
            if (p.isAlive()) {
                p.destroy();
                p.waitFor(800, TimeUnit.MILLISECONDS);
                if (p.isAlive()) {
                    p.destroyForcibly();
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            if (p.isAlive()) {
                p.destroyForcibly();
            }
        }
    }
}

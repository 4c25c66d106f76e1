package de.htwsaar.ministream.streamer.cache;

import java.util.Objects;

/**
 * Cache-Eintrag: Session plus Zugriffszeitpunkt und Stichprobe für die Transferrate.
 *
 * <p>Alle veränderlichen Felder sind über die Instanz synchronisiert.</p>
 */
public final class CacheEntry {

    /** Mindestabstand zwischen zwei Geschwindigkeits-Stichproben. */
    static final long MIN_SAMPLE_INTERVAL_MS = 500;

    private final Session session;

    private long lastAccessedAtMs;
    private long sampledBytes;
    private long sampledAtMs;
    private double speedBytesPerSecond;

    public CacheEntry(Session session, long nowMs) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.lastAccessedAtMs = nowMs;
        this.sampledAtMs = nowMs;
        this.sampledBytes = session.progress().bytesCompleted();
    }

    public Session session() {
        return session;
    }

    public synchronized void touch(long nowMs) {
        lastAccessedAtMs = Math.max(lastAccessedAtMs, nowMs);
    }

    public synchronized long lastAccessedAtMs() {
        return lastAccessedAtMs;
    }

    public synchronized long idleMs(long nowMs) {
        return nowMs - lastAccessedAtMs;
    }

    /**
     * Berechnet die Transferrate neu, wenn seit der letzten Stichprobe mehr als
     * {@value #MIN_SAMPLE_INTERVAL_MS} ms vergangen sind; sonst bleibt der letzte Wert.
     *
     * @param bytesCompleted aktuell verfügbare Bytes
     * @param nowMs          aktueller Zeitpunkt
     * @return Bytes pro Sekunde
     */
    public synchronized double sampleSpeed(long bytesCompleted, long nowMs) {
        long elapsed = nowMs - sampledAtMs;
        if (elapsed > MIN_SAMPLE_INTERVAL_MS) {
            speedBytesPerSecond = Math.max(0, bytesCompleted - sampledBytes) * 1000.0 / elapsed;
            sampledBytes = bytesCompleted;
            sampledAtMs = nowMs;
        }
        return speedBytesPerSecond;
    }
}

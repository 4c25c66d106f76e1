package de.htwsaar.ministream.streamer.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Beim Start eingelesene Streamer-Konfiguration.
 *
 * @param cacheCapacity       maximale Anzahl gleichzeitig aktiver Sessions (mindestens 1)
 * @param resolveTimeoutMs    Wartezeit auf die Inhalts-Infos beim Cold Path
 * @param streamChunkBytes    Puffergröße beim Ausliefern von Bytes
 * @param inactiveAfterMs     Inaktivitätsschwelle für den Sweeper (0 = deaktiviert)
 * @param artifactDir         Verzeichnis für abgeleitete Untertitel-Artefakte
 */
public record StreamerSettings(
        int cacheCapacity, long resolveTimeoutMs, int streamChunkBytes, long inactiveAfterMs, Path artifactDir) {

    public StreamerSettings {
        Objects.requireNonNull(artifactDir, "artifactDir must not be null");
        if (cacheCapacity < 1) throw new IllegalArgumentException("cacheCapacity must be at least 1");
        if (resolveTimeoutMs <= 0) throw new IllegalArgumentException("resolveTimeoutMs must be positive");
        if (streamChunkBytes <= 0) throw new IllegalArgumentException("streamChunkBytes must be positive");
    }
}

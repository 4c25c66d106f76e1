package de.htwsaar.ministream.streamer.cache;

import de.htwsaar.ministream.streamer.domain.SessionKey;

/**
 * Entfernt alle aus einer Session abgeleiteten Artefakte, sobald sie den Cache verlässt.
 */
@FunctionalInterface
public interface SessionArtifactCleanup {

    void cleanup(SessionKey key);
}

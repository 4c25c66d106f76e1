package de.htwsaar.ministream.streamer.cache;

import de.htwsaar.ministream.streamer.domain.SessionKey;

/**
 * Callback für entfernte Cache-Einträge. Wird außerhalb des Cache-Locks aufgerufen,
 * aber bevor die auslösende Operation zurückkehrt.
 */
@FunctionalInterface
public interface EvictionListener {

    void onEvicted(SessionKey key, CacheEntry entry, EvictionCause cause);
}

package de.htwsaar.ministream.streamer.cache;

import de.htwsaar.ministream.streamer.domain.SessionKey;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Begrenzter LRU-Cache für aktive Sessions via {@link LinkedHashMap} mit {@code accessOrder=true}.
 *
 * <p>Thread-Safety: {@code synchronized} auf der Instanz. Der {@link EvictionListener}
 * läuft nach Freigabe des Locks, damit Aufräumarbeiten (Dateien löschen, Prozesse beenden)
 * andere Zugriffe nicht blockieren.</p>
 */
public final class SessionCache {

    private static final Logger log = LoggerFactory.getLogger(SessionCache.class);

    private final Map<SessionKey, CacheEntry> map = new LinkedHashMap<>(16, 0.75f, true);
    private final int capacity;
    private final EvictionListener listener;

    public SessionCache(int capacity, EvictionListener listener) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * @return Eintrag oder {@code null}; ein Treffer zählt als Zugriff für die LRU-Reihenfolge
     */
    public synchronized CacheEntry get(SessionKey key) {
        if (key == null) return null;
        return map.get(key);
    }

    /**
     * Legt einen Eintrag ab und verdrängt bei Bedarf die am längsten nicht genutzten Einträge.
     */
    public void put(SessionKey key, CacheEntry entry) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(entry, "entry must not be null");
        List<Evicted> evicted = new ArrayList<>();
        synchronized (this) {
            CacheEntry previous = map.put(key, entry);
            if (previous != null && previous != entry) {
                evicted.add(new Evicted(key, previous, EvictionCause.REPLACED));
            }
            while (map.size() > capacity) {
                Iterator<Map.Entry<SessionKey, CacheEntry>> it = map.entrySet().iterator();
                Map.Entry<SessionKey, CacheEntry> eldest = it.next();
                it.remove();
                evicted.add(new Evicted(eldest.getKey(), eldest.getValue(), EvictionCause.CAPACITY));
            }
        }
        notifyEvicted(evicted);
    }

    public boolean remove(SessionKey key) {
        if (key == null) return false;
        CacheEntry removed;
        synchronized (this) {
            removed = map.remove(key);
        }
        if (removed == null) return false;
        notifyEvicted(List.of(new Evicted(key, removed, EvictionCause.REMOVED)));
        return true;
    }

    public void clear() {
        List<Evicted> evicted = new ArrayList<>();
        synchronized (this) {
            map.forEach((k, v) -> evicted.add(new Evicted(k, v, EvictionCause.CLEARED)));
            map.clear();
        }
        notifyEvicted(evicted);
    }

    /**
     * Kopie aller Einträge in LRU-Reihenfolge (ältester zuerst), ohne die Reihenfolge zu verändern.
     */
    public synchronized Map<SessionKey, CacheEntry> snapshot() {
        return new LinkedHashMap<>(map);
    }

    public synchronized List<SessionKey> keys() {
        return new ArrayList<>(map.keySet());
    }

    public synchronized int size() {
        return map.size();
    }

    private void notifyEvicted(List<Evicted> evicted) {
        for (Evicted e : evicted) {
            try {
                listener.onEvicted(e.key(), e.entry(), e.cause());
            } catch (RuntimeException ex) {
                log.warn("Cleanup of evicted session {} failed: {}", e.key(), ex.getMessage(), ex);
            }
        }
    }

    private record Evicted(SessionKey key, CacheEntry entry, EvictionCause cause) {}
}

package de.htwsaar.ministream.streamer.service;

import de.htwsaar.ministream.streamer.cache.CacheEntry;
import de.htwsaar.ministream.streamer.cache.EvictionCause;
import de.htwsaar.ministream.streamer.cache.Session;
import de.htwsaar.ministream.streamer.cache.SessionArtifactCleanup;
import de.htwsaar.ministream.streamer.cache.SessionCache;
import de.htwsaar.ministream.streamer.config.StreamerSettings;
import de.htwsaar.ministream.streamer.descriptor.MagnetLinks;
import de.htwsaar.ministream.streamer.domain.ContentDescriptor;
import de.htwsaar.ministream.streamer.domain.ContentEngine;
import de.htwsaar.ministream.streamer.domain.ContentEngineException;
import de.htwsaar.ministream.streamer.domain.ContentHandle;
import de.htwsaar.ministream.streamer.domain.MetadataStore;
import de.htwsaar.ministream.streamer.domain.MetadataStoreException;
import de.htwsaar.ministream.streamer.domain.SessionKey;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Löst Descriptoren in Sessions auf: erst Cache (hot), dann persistierte Metadaten (warm),
 * zuletzt die Content-Engine (cold).
 *
 * <p>Gleichzeitige Anfragen für denselben Schlüssel teilen sich eine laufende Auflösung,
 * sodass pro Schlüssel höchstens ein Handle bei der Engine existiert.</p>
 *
 * <p><b>Kein</b> Spring-Web-Typ hier; Fehler werden als {@link StreamerException} gemeldet.</p>
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final ContentEngine engine;
    private final MetadataStore metadataStore;
    private final SessionArtifactCleanup artifactCleanup;
    private final Clock clock;
    private final long resolveTimeoutMs;
    private final SessionCache cache;

    private final Map<SessionKey, CompletableFuture<Session>> inFlight = new ConcurrentHashMap<>();
    private final CompletableFuture<Void> shutdownSignal = new CompletableFuture<>();

    /**
     * Erstellt den Service mit Constructor Injection.
     *
     * @param engine          Port zur Content-Engine
     * @param metadataStore   Port zum Metadaten-Speicher
     * @param artifactCleanup räumt abgeleitete Artefakte verdrängter Sessions auf
     * @param settings        Kapazität und Timeout
     * @param clock           Zeitquelle
     */
    public SessionService(
            ContentEngine engine,
            MetadataStore metadataStore,
            SessionArtifactCleanup artifactCleanup,
            StreamerSettings settings,
            Clock clock) {

        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore must not be null");
        this.artifactCleanup = Objects.requireNonNull(artifactCleanup, "artifactCleanup must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.resolveTimeoutMs = settings.resolveTimeoutMs();
        this.cache = new SessionCache(settings.cacheCapacity(), this::onEvicted);
    }

    /**
     * Parst einen Locator (Magnet-Link) in einen Descriptor.
     *
     * @throws StreamerException {@link ErrorKind#INVALID_INPUT} bei ungültigem Locator
     */
    public ContentDescriptor parse(String rawLocator) {
        return MagnetLinks.parse(rawLocator);
    }

    public Session resolve(String rawLocator) {
        return resolve(parse(rawLocator));
    }

    /**
     * Liefert die Session zu einem Descriptor und markiert sie als benutzt.
     *
     * @param descriptor aufzulösender Inhalt
     * @return Session mit bekannter Dateiliste
     * @throws StreamerException bei Timeout, Engine-Fehlern oder laufendem Shutdown
     */
    public Session resolve(ContentDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        SessionKey key = descriptor.key();

        Session hot = lookupHot(key);
        if (hot != null) return hot;

        CompletableFuture<Session> mine = new CompletableFuture<>();
        CompletableFuture<Session> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            log.debug("Joining running resolution of {}", key);
            return join(running, key);
        }

        try {
            // eine gerade beendete Auflösung kann den Eintrag schon abgelegt haben
            Session session = lookupHot(key);
            if (session == null) session = resolveWarm(key);
            if (session == null) session = resolveCold(descriptor);
            mine.complete(session);
            return session;
        } catch (RuntimeException ex) {
            mine.completeExceptionally(ex);
            throw ex;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * Cache-Eintrag ohne Auflösung; für Statusabfragen.
     *
     * @return Eintrag oder leer, wenn die Session nicht aktiv ist
     */
    public Optional<CacheEntry> cachedEntry(SessionKey key) {
        return Optional.ofNullable(cache.get(key));
    }

    /**
     * Entfernt eine Session aus dem Cache und gibt ihre Ressourcen frei.
     *
     * @return {@code true}, wenn die Session aktiv war
     */
    public boolean evict(SessionKey key) {
        return cache.remove(key);
    }

    /**
     * @param thresholdMs Inaktivitätsschwelle
     * @return Schlüssel aller Sessions, deren letzter Zugriff strikt länger zurückliegt
     */
    public List<SessionKey> idleKeys(long thresholdMs) {
        long now = clock.millis();
        List<SessionKey> idle = new ArrayList<>();
        cache.snapshot().forEach((key, entry) -> {
            if (entry.idleMs(now) > thresholdMs) idle.add(key);
        });
        return idle;
    }

    public List<SessionKey> activeKeys() {
        return cache.keys();
    }

    /**
     * Beendet wartende Auflösungen und gibt alle aktiven Sessions frei.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down: releasing {} active session(s)", cache.size());
        shutdownSignal.complete(null);
        cache.clear();
    }

    private Session lookupHot(SessionKey key) {
        CacheEntry entry = cache.get(key);
        if (entry == null) return null;
        entry.touch(clock.millis());
        log.debug("Cache hit for {}", key);
        return entry.session();
    }

    private Session resolveWarm(SessionKey key) {
        Optional<byte[]> metadata;
        try {
            metadata = metadataStore.get(key);
        } catch (MetadataStoreException ex) {
            log.warn("Metadata lookup for {} failed, falling back to engine: {}", key, ex.getMessage());
            return null;
        }
        if (metadata.isEmpty()) return null;

        ContentHandle handle;
        try {
            handle = engine.rehydrate(key, metadata.get());
        } catch (ContentEngineException ex) {
            log.warn("Persisted metadata for {} unusable, falling back to engine: {}", key, ex.getMessage());
            return null;
        }
        try {
            awaitInfo(handle);
        } catch (StreamerException ex) {
            if (ex.getKind() == ErrorKind.UNAVAILABLE) throw ex;
            log.warn("Restoring {} from persisted metadata failed, falling back to engine: {}", key, ex.getMessage());
            return null;
        }
        log.info("Restored session {} from persisted metadata", key);
        return admit(handle);
    }

    private Session resolveCold(ContentDescriptor descriptor) {
        SessionKey key = descriptor.key();
        if (shutdownSignal.isDone()) {
            throw new StreamerException(ErrorKind.UNAVAILABLE, "Service is shutting down");
        }
        log.info("Resolving {} via content engine", key);
        ContentHandle handle;
        try {
            handle = engine.resolve(descriptor);
        } catch (ContentEngineException ex) {
            throw new StreamerException(ErrorKind.ENGINE_FAILURE, "Failed to add content: " + ex.getMessage(), ex);
        }
        awaitInfo(handle);
        persistBestEffort(key, handle);
        return admit(handle);
    }

    /**
     * Wartet auf "Infos bekannt", Timeout oder Shutdown. In allen Fehlerfällen wird das Handle freigegeben.
     */
    private void awaitInfo(ContentHandle handle) {
        SessionKey key = handle.key();
        try {
            CompletableFuture.anyOf(handle.infoReady(), shutdownSignal).get(resolveTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            releaseQuietly(handle);
            log.warn("Timeout after {} ms waiting for content info of {}", resolveTimeoutMs, key);
            throw new StreamerException(ErrorKind.RESOLUTION_TIMEOUT, "Timeout getting content info for " + key);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            releaseQuietly(handle);
            throw new StreamerException(ErrorKind.UNAVAILABLE, "Interrupted while resolving " + key, ex);
        } catch (ExecutionException ex) {
            releaseQuietly(handle);
            throw new StreamerException(
                    ErrorKind.ENGINE_FAILURE, "Content engine failed for " + key + ": " + ex.getCause().getMessage(),
                    ex.getCause());
        }
        if (!handle.infoReady().isDone()) {
            releaseQuietly(handle);
            throw new StreamerException(ErrorKind.UNAVAILABLE, "Service is shutting down");
        }
    }

    private void persistBestEffort(SessionKey key, ContentHandle handle) {
        try {
            metadataStore.put(key, handle.serializeMetadata());
            log.debug("Persisted metadata for {}", key);
        } catch (MetadataStoreException | ContentEngineException ex) {
            log.warn("Failed to persist metadata for {}: {}", key, ex.getMessage());
        }
    }

    private Session admit(ContentHandle handle) {
        Session session = Session.fromHandle(handle);
        cache.put(session.key(), new CacheEntry(session, clock.millis()));
        log.info("Session {} active ('{}', {} file(s))", session.key(), session.displayName(), session.files().size());
        return session;
    }

    private Session join(CompletableFuture<Session> running, SessionKey key) {
        try {
            Session session = running.get();
            CacheEntry entry = cache.get(key);
            if (entry != null) entry.touch(clock.millis());
            return session;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new StreamerException(ErrorKind.UNAVAILABLE, "Interrupted while waiting for " + key, ex);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof StreamerException se) throw se;
            throw new StreamerException(ErrorKind.INTERNAL, "Resolution of " + key + " failed", ex.getCause());
        }
    }

    private void onEvicted(SessionKey key, CacheEntry entry, EvictionCause cause) {
        log.info("Evicting session {} ({})", key, cause);
        releaseQuietly(entry.session().handle());
        artifactCleanup.cleanup(key);
    }

    private void releaseQuietly(ContentHandle handle) {
        try {
            engine.release(handle);
        } catch (RuntimeException ex) {
            log.warn("Releasing handle {} failed: {}", handle.key(), ex.getMessage());
        }
    }
}

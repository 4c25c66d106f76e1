package de.htwsaar.ministream.streamer.service;

import de.htwsaar.ministream.streamer.config.StreamerSettings;
import de.htwsaar.ministream.streamer.domain.MetadataStore;
import de.htwsaar.ministream.streamer.domain.MetadataStoreException;
import de.htwsaar.ministream.streamer.domain.SessionKey;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Entfernt periodisch Sessions, auf die länger als die konfigurierte Schwelle nicht zugegriffen wurde,
 * samt ihrer persistierten Metadaten.
 */
@Component
public class InactivitySweeper {

    private static final Logger log = LoggerFactory.getLogger(InactivitySweeper.class);

    private final SessionService sessionService;
    private final MetadataStore metadataStore;
    private final long inactiveAfterMs;

    public InactivitySweeper(SessionService sessionService, MetadataStore metadataStore, StreamerSettings settings) {
        this.sessionService = Objects.requireNonNull(sessionService, "sessionService must not be null");
        this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore must not be null");
        this.inactiveAfterMs = Objects.requireNonNull(settings, "settings must not be null").inactiveAfterMs();
        if (inactiveAfterMs <= 0) {
            log.info("Inactivity sweeper disabled (threshold {} ms)", inactiveAfterMs);
        }
    }

    @Scheduled(
            fixedDelayString = "${streamer.sweep.interval-ms:300000}",
            initialDelayString = "${streamer.sweep.interval-ms:300000}")
    public void scheduledSweep() {
        sweep();
    }

    /**
     * Ein Durchlauf: erst alle inaktiven Schlüssel sammeln, dann einzeln entfernen.
     *
     * @return Anzahl tatsächlich verdrängter Sessions
     */
    public int sweep() {
        if (inactiveAfterMs <= 0) return 0;

        List<SessionKey> idle = sessionService.idleKeys(inactiveAfterMs);
        if (idle.isEmpty()) {
            log.debug("Sweep: no inactive sessions");
            return 0;
        }

        int evicted = 0;
        for (SessionKey key : idle) {
            log.info("Removing inactive session {}", key);
            if (sessionService.evict(key)) evicted++;
            try {
                metadataStore.delete(key);
            } catch (MetadataStoreException ex) {
                log.warn("Failed to delete metadata of {}: {}", key, ex.getMessage());
            }
        }
        log.info("Sweep removed {} inactive session(s)", evicted);
        return evicted;
    }
}

package de.htwsaar.ministream.streamer.service;

import static de.htwsaar.ministream.streamer.support.TestKeys.*;
import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.ministream.streamer.config.StreamerSettings;
import de.htwsaar.ministream.streamer.domain.SessionKey;
import de.htwsaar.ministream.streamer.support.FakeContentEngine;
import de.htwsaar.ministream.streamer.support.InMemoryMetadataStore;
import de.htwsaar.ministream.streamer.support.MutableClock;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InactivitySweeperTest {

    private static final long THIRTY_MINUTES = 30 * 60 * 1000L;

    private FakeContentEngine engine;
    private InMemoryMetadataStore store;
    private MutableClock clock;
    private List<SessionKey> cleanedUp;

    @BeforeEach
    void setUp() {
        engine = new FakeContentEngine().addSingle(HEX_A, "a.mp4", 10).addSingle(HEX_B, "b.mp4", 10);
        store = new InMemoryMetadataStore();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        cleanedUp = new ArrayList<>();
    }

    @Test
    void sweep_shouldEvictOnlySessionsIdleStrictlyLongerThanThreshold() {
        SessionService sessions = sessions(THIRTY_MINUTES);
        InactivitySweeper sweeper = new InactivitySweeper(sessions, store, settings(THIRTY_MINUTES));
        sessions.resolve(magnet(HEX_A));
        clock.plusMinutes(10);
        sessions.resolve(magnet(HEX_B));

        clock.plusMinutes(20);
        assertEquals(0, sweeper.sweep(), "a ist genau 30 min inaktiv und bleibt");

        clock.plusMillis(1);
        assertEquals(1, sweeper.sweep());

        assertTrue(sessions.cachedEntry(key(HEX_A)).isEmpty(), "a muss entfernt sein");
        assertTrue(sessions.cachedEntry(key(HEX_B)).isPresent(), "b muss bleiben");
        assertFalse(store.contains(key(HEX_A)), "Metadaten von a müssen gelöscht sein");
        assertTrue(store.contains(key(HEX_B)));
        assertEquals(List.of(key(HEX_A)), cleanedUp);
    }

    @Test
    void sweep_shouldBeNoOpWhenThresholdNotPositive() {
        SessionService sessions = sessions(0);
        InactivitySweeper sweeper = new InactivitySweeper(sessions, store, settings(0));
        sessions.resolve(magnet(HEX_A));
        clock.plusMinutes(24 * 60);

        assertEquals(0, sweeper.sweep());
        assertTrue(sessions.cachedEntry(key(HEX_A)).isPresent());

        InactivitySweeper negative = new InactivitySweeper(sessions, store, settings(-1));
        assertEquals(0, negative.sweep());
        assertTrue(sessions.cachedEntry(key(HEX_A)).isPresent());
    }

    @Test
    void sweep_shouldContinueWhenMetadataDeleteFails() {
        SessionService sessions = sessions(THIRTY_MINUTES);
        InactivitySweeper sweeper = new InactivitySweeper(sessions, store, settings(THIRTY_MINUTES));
        sessions.resolve(magnet(HEX_A));
        sessions.resolve(magnet(HEX_B));
        store.failDeletes = true;
        clock.plusMinutes(31);

        assertEquals(2, sweeper.sweep());
        assertTrue(sessions.activeKeys().isEmpty());
    }

    private SessionService sessions(long inactiveAfterMs) {
        return new SessionService(engine, store, cleanedUp::add, settings(inactiveAfterMs), clock);
    }

    private static StreamerSettings settings(long inactiveAfterMs) {
        return new StreamerSettings(2, 1_000, 1024, inactiveAfterMs, Path.of("unused"));
    }
}

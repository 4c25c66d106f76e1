package de.htwsaar.ministream.streamer.cache;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.ministream.streamer.support.FakeContentHandle;
import de.htwsaar.ministream.streamer.support.TestKeys;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CacheEntryTest {

    @Test
    void idleMs_shouldBeMeasuredFromLastTouch() {
        CacheEntry entry = new CacheEntry(session(), 1_000L);
        entry.touch(5_000L);

        assertEquals(5_000L, entry.lastAccessedAtMs());
        assertEquals(2_000L, entry.idleMs(7_000L));
    }

    @Test
    void touch_shouldNeverMoveBackwards() {
        CacheEntry entry = new CacheEntry(session(), 5_000L);
        entry.touch(4_000L);

        assertEquals(5_000L, entry.lastAccessedAtMs());
    }

    @Test
    void sampleSpeed_shouldRecomputeOnlyAfterInterval() {
        FakeContentHandle handle = FakeContentHandle.single(TestKeys.HEX_A, "movie.mp4", 100_000);
        handle.setBytesCompleted(0);
        CacheEntry entry = new CacheEntry(Session.fromHandle(handle), 0L);

        assertEquals(20_000.0, entry.sampleSpeed(20_000, 1_000), 0.001, "20 kB in 1 s");
        assertEquals(20_000.0, entry.sampleSpeed(90_000, 1_400), 0.001, "innerhalb von 500 ms bleibt der letzte Wert");
        assertEquals(70_000.0, entry.sampleSpeed(90_000, 2_000), 0.001, "70 kB seit der letzten Stichprobe in 1 s");
    }

    @Test
    void session_shouldSelectLargestFileWhenIndexInvalid() {
        Map<String, byte[]> files = new LinkedHashMap<>();
        files.put("a.srt", new byte[10]);
        files.put("b.mkv", new byte[300]);
        files.put("c.mp4", new byte[300]);
        Session session = Session.fromHandle(FakeContentHandle.ready(TestKeys.HEX_A, "x", files));

        assertEquals(1, session.selectFileIndex(Session.AUTO_SELECT), "bei Gleichstand die erste größte Datei");
        assertEquals(1, session.selectFileIndex(99));
        assertEquals(0, session.selectFileIndex(0));
        assertEquals(610, session.totalSize());
        assertEquals(2, session.indexOfPath("c.mp4"));
        assertEquals(-1, session.indexOfPath("missing"));
    }

    private static Session session() {
        return Session.fromHandle(FakeContentHandle.single(TestKeys.HEX_A, "movie.mp4", 10));
    }
}

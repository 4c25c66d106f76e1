package de.htwsaar.ministream.streamer.stream;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.ministream.streamer.cache.Session;
import de.htwsaar.ministream.streamer.config.StreamerSettings;
import de.htwsaar.ministream.streamer.service.ErrorKind;
import de.htwsaar.ministream.streamer.service.StreamerException;
import de.htwsaar.ministream.streamer.support.FakeContentHandle;
import de.htwsaar.ministream.streamer.support.InMemoryChannel;
import de.htwsaar.ministream.streamer.support.TestKeys;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RangeStreamerTest {

    private final RangeStreamer streamer =
            new RangeStreamer(new StreamerSettings(2, 1_000, 64, 0, Path.of("unused")));

    @Test
    void rangeRequest_shouldProducePartialContent() {
        Session session = session("movie.mp4", 1000);

        StreamPlan plan = streamer.plan(session, 0, "bytes=100-199");

        assertEquals(206, plan.status());
        assertEquals(100, plan.start());
        assertEquals(100, plan.length());
        assertEquals("bytes 100-199/1000", plan.headers().get("Content-Range"));
        assertEquals("100", plan.headers().get("Content-Length"));
        assertEquals("bytes", plan.headers().get("Accept-Ranges"));
        assertEquals("video/mp4", plan.headers().get("Content-Type"));
        assertEquals("movie.mp4", plan.headers().get("X-Filename"));
        assertEquals("1000", plan.headers().get("X-Filesize"));
        assertEquals("inline; filename=\"movie.mp4\"; filename*=UTF-8''movie.mp4", plan.headers().get("Content-Disposition"));

        byte[] body = transfer(session, plan);
        assertArrayEquals(Arrays.copyOfRange(FakeContentHandle.pattern(1000), 100, 200), body);
    }

    @Test
    void withoutRange_shouldServeWholeFile() {
        Session session = session("movie.mkv", 1000);

        StreamPlan plan = streamer.plan(session, Session.AUTO_SELECT, null);

        assertEquals(200, plan.status());
        assertEquals("1000", plan.headers().get("Content-Length"));
        assertNull(plan.headers().get("Content-Range"));
        assertEquals("video/x-matroska", plan.headers().get("Content-Type"));
        assertArrayEquals(FakeContentHandle.pattern(1000), transfer(session, plan));
    }

    @Test
    void unsatisfiableRange_shouldProduce416WithoutBody() {
        StreamPlan plan = streamer.plan(session("movie.mp4", 1000), 0, "bytes=2000-");

        assertEquals(416, plan.status());
        assertEquals("bytes */1000", plan.headers().get("Content-Range"));
        assertFalse(plan.hasBody());
    }

    @Test
    void sessionWithoutFiles_shouldBeNotFound() {
        Session empty = Session.fromHandle(FakeContentHandle.ready(TestKeys.HEX_A, "empty", Map.of()));

        StreamerException ex = assertThrows(StreamerException.class, () -> streamer.plan(empty, 0, null));
        assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
    }

    @Test
    void copy_shouldStopSilentlyWhenClientDisconnects() {
        OutputStream failing = new OutputStream() {
            private int writes;

            @Override
            public void write(int b) {}

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                if (++writes > 2) throw new IOException("Broken pipe");
            }
        };

        long written = streamer.copy(new InMemoryChannel(new byte[1000]), 1000, failing);

        assertEquals(128, written, "zwei Blöcke à 64 Bytes wurden geschrieben");
    }

    @Test
    void copy_shouldStopOnReadError() {
        SeekableByteChannel broken = new InMemoryChannel(new byte[1000]) {
            private int reads;

            @Override
            public int read(ByteBuffer dst) throws IOException {
                if (++reads > 1) throw new IOException("piece unavailable");
                return super.read(dst);
            }
        };
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertEquals(64, streamer.copy(broken, 1000, out));
        assertEquals(64, out.size());
    }

    @Test
    void copy_shouldStopAtEndOfStream() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertEquals(10, streamer.copy(new InMemoryChannel(new byte[10]), 100, out));
    }

    @Test
    void contentTypes_shouldFallBackToOctetStream() {
        assertEquals("text/vtt", ContentTypes.forPath("a/b.VTT"));
        assertEquals("audio/mpeg", ContentTypes.forPath("song.mp3"));
        assertEquals(ContentTypes.FALLBACK, ContentTypes.forPath("archive.rar"));
        assertEquals(ContentTypes.FALLBACK, ContentTypes.forPath("README"));
    }

    private byte[] transfer(Session session, StreamPlan plan) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (SeekableByteChannel channel = streamer.open(session, plan)) {
            streamer.copy(channel, plan.length(), out);
        } catch (IOException ex) {
            fail(ex);
        }
        return out.toByteArray();
    }

    private static Session session(String path, int size) {
        return Session.fromHandle(FakeContentHandle.single(TestKeys.HEX_A, path, size));
    }
}

package de.htwsaar.ministream.streamer.stream;

import de.htwsaar.ministream.streamer.cache.Session;
import de.htwsaar.ministream.streamer.config.StreamerSettings;
import de.htwsaar.ministream.streamer.domain.FileDescriptor;
import de.htwsaar.ministream.streamer.service.ErrorKind;
import de.htwsaar.ministream.streamer.service.StreamerException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Liefert eine Datei einer Session ganz oder als Byte-Bereich aus.
 *
 * <p>Ablauf im Web-Layer: {@link #plan} → {@link #open} → Header setzen → {@link #copy}.
 * So werden Fehler beim Öffnen noch vor dem ersten Byte als Fehlerantwort gemeldet.</p>
 */
@Service
public class RangeStreamer {

    private static final Logger log = LoggerFactory.getLogger(RangeStreamer.class);

    private final int chunkBytes;

    public RangeStreamer(StreamerSettings settings) {
        this.chunkBytes = Objects.requireNonNull(settings, "settings must not be null").streamChunkBytes();
    }

    /**
     * @param session     aufgelöste Session
     * @param fileIndex   gewünschte Datei oder {@link Session#AUTO_SELECT}
     * @param rangeHeader Wert des {@code Range}-Headers oder {@code null}
     * @return Plan mit Status und Headern
     * @throws StreamerException {@link ErrorKind#NOT_FOUND}, wenn die Session keine Dateien hat
     */
    public StreamPlan plan(Session session, int fileIndex, String rangeHeader) {
        int index = session.selectFileIndex(fileIndex);
        if (index < 0) {
            throw new StreamerException(ErrorKind.NOT_FOUND, "No suitable file found to stream");
        }
        FileDescriptor file = session.file(index);
        long size = file.size();
        String contentType = ContentTypes.forPath(file.path());
        RangeRequest range = RangeRequest.parse(rangeHeader, size);

        Map<String, String> headers = new LinkedHashMap<>();
        if (range.kind() == RangeRequest.Kind.UNSATISFIABLE) {
            headers.put("Content-Range", "bytes */" + size);
            headers.put("Accept-Ranges", "bytes");
            return new StreamPlan(index, 416, 0, 0, headers);
        }

        boolean partial = range.kind() == RangeRequest.Kind.PARTIAL;
        long start = partial ? range.start() : 0;
        long length = partial ? range.length() : size;

        headers.put("Content-Type", contentType);
        headers.put("Content-Length", Long.toString(length));
        headers.put("Accept-Ranges", "bytes");
        headers.put("Content-Disposition", contentDisposition(file.name()));
        headers.put("X-Filename", file.name());
        headers.put("X-Filesize", Long.toString(size));
        headers.put("X-Content-Type", contentType);
        if (partial) {
            headers.put("Content-Range", "bytes " + range.start() + "-" + range.end() + "/" + size);
        }
        return new StreamPlan(index, partial ? 206 : 200, start, length, headers);
    }

    /**
     * Öffnet den Reader und positioniert ihn auf den Planstart.
     *
     * @throws StreamerException {@link ErrorKind#INTERNAL}, wenn der Inhalt nicht lesbar ist
     */
    public SeekableByteChannel open(Session session, StreamPlan plan) {
        SeekableByteChannel channel = null;
        try {
            channel = session.openReader(plan.fileIndex());
            channel.position(plan.start());
            return channel;
        } catch (IOException ex) {
            closeAfterFailure(channel);
            throw new StreamerException(ErrorKind.INTERNAL, "Error seeking file: " + ex.getMessage(), ex);
        }
    }

    /**
     * Kopiert höchstens {@code length} Bytes in Blöcken und flusht nach jedem Block.
     * Schreibfehler (Client weg) und Lesefehler beenden die Übertragung ohne Exception.
     *
     * @return tatsächlich geschriebene Bytes
     */
    public long copy(SeekableByteChannel channel, long length, OutputStream out) {
        byte[] chunk = new byte[(int) Math.max(1, Math.min(chunkBytes, length))];
        ByteBuffer buffer = ByteBuffer.wrap(chunk);
        long written = 0;
        while (written < length) {
            buffer.clear().limit((int) Math.min(chunk.length, length - written));
            int n;
            try {
                n = channel.read(buffer);
            } catch (IOException ex) {
                log.warn("Error reading content after {} of {} bytes: {}", written, length, ex.getMessage());
                return written;
            }
            if (n < 0) {
                log.debug("Content ended after {} of {} bytes", written, length);
                return written;
            }
            try {
                out.write(chunk, 0, n);
                out.flush();
            } catch (IOException ex) {
                log.debug("Client went away after {} bytes: {}", written, ex.getMessage());
                return written;
            }
            written += n;
        }
        return written;
    }

    private static String contentDisposition(String fileName) {
        String plain = fileName.replace('"', '_');
        String encoded = URLEncoder.encode(fileName, StandardCharsets.UTF_8).replace("+", "%20");
        return "inline; filename=\"" + plain + "\"; filename*=UTF-8''" + encoded;
    }

    private static void closeAfterFailure(SeekableByteChannel channel) {
        if (channel == null) return;
        try {
            channel.close();
        } catch (IOException ex) {
            log.debug("Closing reader failed: {}", ex.getMessage());
        }
    }
}

package de.htwsaar.ministream.streamer.subtitle;

import de.htwsaar.ministream.common.util.Sha256Util;
import de.htwsaar.ministream.streamer.cache.Session;
import de.htwsaar.ministream.streamer.domain.SessionKey;
import de.htwsaar.ministream.streamer.service.ErrorKind;
import de.htwsaar.ministream.streamer.service.StreamerException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Synchrone Umwandlung von SRT-Dateien einer Session in WebVTT mit inhaltsadressiertem Dateicache.
 */
@Service
public class SubtitleConversionService {

    private static final Logger log = LoggerFactory.getLogger(SubtitleConversionService.class);

    /** Obergrenze für Quelldateien; Untertitel sind klein, Videos nicht. */
    static final long MAX_SOURCE_BYTES = 16L * 1024 * 1024;

    private final ArtifactRegistry registry;

    public SubtitleConversionService(ArtifactRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Schlüssel eines konvertierten Untertitels: {@code <key>_<sha256(key + path)>.vtt}.
     */
    public static String artifactKey(SessionKey key, String sourcePath) {
        return key.artifactPrefix() + Sha256Util.sha256Hex(key.hex() + sourcePath) + ".vtt";
    }

    /**
     * Konvertiert eine Datei der Session; eine bereits vorhandene Ausgabe wird nicht neu geschrieben.
     *
     * @param session    aufgelöste Session
     * @param sourcePath exakter Pfad der SRT-Datei innerhalb der Session
     * @return Artefakt-Schlüssel für {@link #fetch(String)}
     */
    public String convert(Session session, String sourcePath) {
        if (sourcePath == null || sourcePath.isBlank()) {
            throw new StreamerException(ErrorKind.INVALID_INPUT, "Missing 'filePath' query parameter");
        }
        int index = session.indexOfPath(sourcePath);
        if (index < 0) {
            throw new StreamerException(ErrorKind.NOT_FOUND, "Subtitle file not found in session");
        }

        String key = artifactKey(session.key(), sourcePath);
        Path target = registry.directory().resolve(key);
        if (Files.exists(target)) {
            log.debug("Using existing VTT artifact {}", key);
            registry.register(key, target);
            return key;
        }

        String vtt = SrtToVttConverter.convert(new String(readSource(session, index), StandardCharsets.UTF_8));
        write(target, vtt);
        registry.register(key, target);
        log.info("Converted '{}' of session {} to {}", sourcePath, session.key(), key);
        return key;
    }

    /**
     * @param key Artefakt-Schlüssel aus {@link #convert}
     * @return VTT-Inhalt
     * @throws StreamerException {@link ErrorKind#NOT_FOUND} für unbekannte Schlüssel
     */
    public byte[] fetch(String key) {
        Path path = registry.lookup(key)
                .orElseThrow(() -> new StreamerException(ErrorKind.NOT_FOUND, "VTT file not found"));
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new StreamerException(ErrorKind.NOT_FOUND, "VTT file not found", ex);
        }
    }

    private static byte[] readSource(Session session, int index) {
        if (session.file(index).size() > MAX_SOURCE_BYTES) {
            throw new StreamerException(ErrorKind.INVALID_INPUT, "File is too large to be a subtitle");
        }
        try (SeekableByteChannel channel = session.openReader(index);
                InputStream in = Channels.newInputStream(channel)) {
            return in.readAllBytes();
        } catch (IOException ex) {
            throw new StreamerException(ErrorKind.INTERNAL, "Failed to read subtitle file: " + ex.getMessage(), ex);
        }
    }

    private void write(Path target, String vtt) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile(registry.directory(), target.getFileName().toString(), ".tmp");
            Files.writeString(tmp, vtt, StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            deleteQuietly(tmp);
            throw new StreamerException(ErrorKind.INTERNAL, "Failed to write VTT file: " + ex.getMessage(), ex);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) return;
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.debug("Could not delete temp file {}: {}", path, ex.getMessage());
        }
    }
}

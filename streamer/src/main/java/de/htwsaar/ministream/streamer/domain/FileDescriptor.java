package de.htwsaar.ministream.streamer.domain;

import java.util.Objects;

/**
 * Eine Datei innerhalb einer Session. Unveränderlich, sobald die Session-Infos bekannt sind.
 *
 * @param path Pfad innerhalb des Inhalts, {@code /}-getrennt
 * @param size Größe in Bytes
 */
public record FileDescriptor(String path, long size) {

    public FileDescriptor {
        Objects.requireNonNull(path, "path must not be null");
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
    }

    /** Dateiname ohne Verzeichnisanteil. */
    public String name() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}

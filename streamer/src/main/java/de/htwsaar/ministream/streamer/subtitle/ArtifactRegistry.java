package de.htwsaar.ministream.streamer.subtitle;

import de.htwsaar.ministream.streamer.config.StreamerSettings;
import de.htwsaar.ministream.streamer.service.ErrorKind;
import de.htwsaar.ministream.streamer.service.StreamerException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Verzeichnis der abgeleiteten Artefakte (Schlüssel → Datei) und Zugriff auf das Artefakt-Verzeichnis.
 *
 * <p>Thread-Safety: einfaches {@code synchronized}, unabhängig vom Session-Cache.</p>
 */
@Component
public class ArtifactRegistry {

    private final Path directory;
    private final Map<String, Path> artifacts = new HashMap<>();

    public ArtifactRegistry(StreamerSettings settings) {
        this.directory = settings.artifactDir().toAbsolutePath().normalize();
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot create artifact directory " + directory, ex);
        }
    }

    public Path directory() {
        return directory;
    }

    public synchronized void register(String key, Path path) {
        artifacts.put(key, path);
    }

    public synchronized Optional<Path> lookup(String key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(artifacts.get(key));
    }

    /**
     * Entfernt alle Einträge, deren Schlüssel mit {@code prefix} beginnt.
     *
     * @return Pfade der entfernten Einträge
     */
    public synchronized List<Path> removeByPrefix(String prefix) {
        List<Path> removed = new ArrayList<>();
        Iterator<Map.Entry<String, Path>> it = artifacts.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Path> e = it.next();
            if (e.getKey().startsWith(prefix)) {
                removed.add(e.getValue());
                it.remove();
            }
        }
        return removed;
    }

    public synchronized int size() {
        return artifacts.size();
    }

    /**
     * Löst einen Dateinamen innerhalb des Artefakt-Verzeichnisses auf.
     *
     * @throws StreamerException {@link ErrorKind#INVALID_INPUT}, wenn der Name leer ist oder das Verzeichnis verlässt
     */
    public Path resolveName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new StreamerException(ErrorKind.INVALID_INPUT, "File name is required");
        }
        Path resolved;
        try {
            resolved = directory.resolve(fileName).normalize();
        } catch (IllegalArgumentException ex) {
            throw new StreamerException(ErrorKind.INVALID_INPUT, "Invalid file name", ex);
        }
        if (!resolved.startsWith(directory) || resolved.equals(directory)) {
            throw new StreamerException(ErrorKind.INVALID_INPUT, "Invalid file path");
        }
        return resolved;
    }
}

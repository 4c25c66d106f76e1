package de.htwsaar.ministream.streamer.adapter.engine;

import de.htwsaar.ministream.common.serialization.JacksonCodec;
import de.htwsaar.ministream.common.serialization.MiniStreamSerializationException;
import de.htwsaar.ministream.streamer.domain.ContentEngineException;
import de.htwsaar.ministream.streamer.domain.ContentHandle;
import de.htwsaar.ministream.streamer.domain.FileDescriptor;
import de.htwsaar.ministream.streamer.domain.ProgressSnapshot;
import de.htwsaar.ministream.streamer.domain.SessionKey;
import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Handle auf einen Eintrag der lokalen Bibliothek: ein Verzeichnis oder eine einzelne Datei.
 * Solange der Eintrag fehlt, bleibt das Handle im Zustand "Infos ausstehend".
 */
final class LocalContentHandle implements ContentHandle {

    private final SessionKey key;
    private final Path root;
    private final String requestedName;
    private final CompletableFuture<Void> infoReady = new CompletableFuture<>();

    private volatile List<FileDescriptor> files = List.of();
    private volatile String displayName = "";
    private volatile boolean singleFile;
    private volatile boolean released;
    private ScheduledFuture<?> watcher;

    LocalContentHandle(SessionKey key, Path root, String requestedName) {
        this.key = key;
        this.root = root;
        this.requestedName = requestedName == null ? "" : requestedName;
    }

    /**
     * Handle mit bereits bekannten Infos aus persistierten Metadaten.
     */
    static LocalContentHandle restored(SessionKey key, LibraryMetadata metadata) {
        LocalContentHandle handle = new LocalContentHandle(key, Path.of(metadata.root()), metadata.name());
        handle.files = List.copyOf(metadata.files());
        handle.displayName = metadata.name();
        handle.singleFile = metadata.singleFile();
        handle.infoReady.complete(null);
        return handle;
    }

    /**
     * Prüft, ob der Eintrag jetzt vorhanden ist, und liest ggf. die Dateiliste ein.
     *
     * @return {@code true}, wenn keine weitere Prüfung nötig ist
     */
    synchronized boolean tryLoad() {
        if (infoReady.isDone() || released) return true;
        if (!Files.exists(root)) return false;
        try {
            singleFile = Files.isRegularFile(root);
            files = singleFile ? List.of(new FileDescriptor(root.getFileName().toString(), Files.size(root))) : scan(root);
        } catch (IOException ex) {
            infoReady.completeExceptionally(new ContentEngineException("Failed to scan " + root + ": " + ex.getMessage(), ex));
            return true;
        }
        displayName = requestedName.isBlank() ? root.getFileName().toString() : requestedName;
        infoReady.complete(null);
        return true;
    }

    synchronized void watch(ScheduledExecutorService scheduler, long pollMs) {
        if (tryLoad()) return;
        watcher = scheduler.scheduleWithFixedDelay(() -> {
            if (tryLoad()) stopWatching();
        }, pollMs, pollMs, TimeUnit.MILLISECONDS);
    }

    synchronized void release() {
        released = true;
        stopWatching();
    }

    private synchronized void stopWatching() {
        if (watcher != null) {
            watcher.cancel(false);
            watcher = null;
        }
    }

    @Override
    public SessionKey key() {
        return key;
    }

    @Override
    public CompletableFuture<Void> infoReady() {
        return infoReady;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public List<FileDescriptor> files() {
        return files;
    }

    @Override
    public SeekableByteChannel openReader(int fileIndex) throws IOException {
        if (released) throw new IOException("content " + key + " has been released");
        List<FileDescriptor> current = files;
        if (fileIndex < 0 || fileIndex >= current.size()) {
            throw new IOException("file index " + fileIndex + " out of range");
        }
        Path file = singleFile ? root : root.resolve(current.get(fileIndex).path());
        return Files.newByteChannel(file, StandardOpenOption.READ);
    }

    @Override
    public ProgressSnapshot progress() {
        List<Long> perFile = files.stream().map(FileDescriptor::size).toList();
        long total = perFile.stream().mapToLong(Long::longValue).sum();
        return new ProgressSnapshot(total, total, 0, perFile);
    }

    @Override
    public byte[] serializeMetadata() {
        try {
            return JacksonCodec.toJsonBytes(new LibraryMetadata(
                    key.hex(), displayName, root.toAbsolutePath().toString(), singleFile, files));
        } catch (MiniStreamSerializationException ex) {
            throw new ContentEngineException("Failed to serialize metadata of " + key, ex);
        }
    }

    private static List<FileDescriptor> scan(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> regular = walk.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> relative(dir, p)))
                    .toList();
            List<FileDescriptor> result = new ArrayList<>(regular.size());
            for (Path p : regular) {
                result.add(new FileDescriptor(relative(dir, p), Files.size(p)));
            }
            return List.copyOf(result);
        }
    }

    private static String relative(Path dir, Path file) {
        return dir.relativize(file).toString().replace('\\', '/');
    }
}

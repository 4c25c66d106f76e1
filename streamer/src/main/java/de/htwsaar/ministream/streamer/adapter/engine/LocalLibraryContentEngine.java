package de.htwsaar.ministream.streamer.adapter.engine;

import de.htwsaar.ministream.common.serialization.JacksonCodec;
import de.htwsaar.ministream.common.serialization.MiniStreamSerializationException;
import de.htwsaar.ministream.streamer.domain.ContentDescriptor;
import de.htwsaar.ministream.streamer.domain.ContentEngine;
import de.htwsaar.ministream.streamer.domain.ContentEngineException;
import de.htwsaar.ministream.streamer.domain.ContentHandle;
import de.htwsaar.ministream.streamer.domain.SessionKey;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapter-Implementierung des {@link ContentEngine}-Ports über ein lokales Bibliotheksverzeichnis.
 *
 * <p>Ein Inhalt liegt unter {@code <library>/<hex-schlüssel>}, entweder als Verzeichnis oder als
 * einzelne Datei. Fehlt er noch, wird in festem Abstand erneut geprüft, bis er erscheint oder das
 * Handle freigegeben wird; so verhält sich der Adapter wie eine Engine, die erst Metadaten abwarten muss.</p>
 */
public class LocalLibraryContentEngine implements ContentEngine, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalLibraryContentEngine.class);

    private final Path libraryDir;
    private final long pollMs;
    private final ScheduledExecutorService scheduler;

    public LocalLibraryContentEngine(Path libraryDir, long pollMs) {
        this(libraryDir, pollMs, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "library-watcher");
            t.setDaemon(true);
            return t;
        }));
    }

    LocalLibraryContentEngine(Path libraryDir, long pollMs, ScheduledExecutorService scheduler) {
        this.libraryDir = Objects.requireNonNull(libraryDir, "libraryDir must not be null").toAbsolutePath().normalize();
        this.pollMs = Math.max(10, pollMs);
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    public Path libraryDir() {
        return libraryDir;
    }

    @Override
    public ContentHandle resolve(ContentDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        LocalContentHandle handle =
                new LocalContentHandle(descriptor.key(), libraryDir.resolve(descriptor.key().hex()), descriptor.displayName());
        handle.watch(scheduler, pollMs);
        if (!handle.infoReady().isDone()) {
            log.info("Content {} not yet in library {}, waiting for it to appear", descriptor.key(), libraryDir);
        }
        return handle;
    }

    @Override
    public ContentHandle rehydrate(SessionKey key, byte[] metadata) {
        LibraryMetadata md;
        try {
            md = JacksonCodec.fromJson(metadata, LibraryMetadata.class);
        } catch (MiniStreamSerializationException ex) {
            throw new ContentEngineException("Unreadable metadata for " + key, ex);
        }
        if (md.key() == null || !key.hex().equals(md.key()) || md.root() == null || md.files() == null) {
            throw new ContentEngineException("Metadata does not belong to " + key);
        }
        if (!Files.exists(Path.of(md.root()))) {
            throw new ContentEngineException("Content of " + key + " is no longer present at " + md.root());
        }
        return LocalContentHandle.restored(key, md);
    }

    @Override
    public void release(ContentHandle handle) {
        if (handle instanceof LocalContentHandle local) {
            local.release();
            log.debug("Released content {}", handle.key());
        } else if (handle != null) {
            throw new IllegalArgumentException("Foreign handle type: " + handle.getClass().getName());
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}

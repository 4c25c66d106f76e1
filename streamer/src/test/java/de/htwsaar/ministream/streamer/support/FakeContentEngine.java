package de.htwsaar.ministream.streamer.support;

import de.htwsaar.ministream.streamer.domain.ContentDescriptor;
import de.htwsaar.ministream.streamer.domain.ContentEngine;
import de.htwsaar.ministream.streamer.domain.ContentEngineException;
import de.htwsaar.ministream.streamer.domain.ContentHandle;
import de.htwsaar.ministream.streamer.domain.SessionKey;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-Memory-Engine mit Aufrufzählern. Unbekannte Inhalte werden nie "bereit".
 */
public final class FakeContentEngine implements ContentEngine {

    public final AtomicInteger resolveCalls = new AtomicInteger();
    public final AtomicInteger rehydrateCalls = new AtomicInteger();
    public final AtomicInteger releaseCalls = new AtomicInteger();

    private final Map<SessionKey, Map<String, byte[]>> library = new ConcurrentHashMap<>();
    private final Map<SessionKey, String> names = new ConcurrentHashMap<>();
    private final List<FakeContentHandle> pending = new CopyOnWriteArrayList<>();
    private final List<FakeContentHandle> handed = new CopyOnWriteArrayList<>();
    private volatile boolean deferInfo;
    private volatile String rehydratedInfoFailure;

    public static byte[] metadataFor(SessionKey key) {
        return ("fake:" + key.hex()).getBytes(StandardCharsets.UTF_8);
    }

    public FakeContentEngine add(String hex, String name, Map<String, byte[]> files) {
        library.put(SessionKey.of(hex), new LinkedHashMap<>(files));
        names.put(SessionKey.of(hex), name);
        return this;
    }

    public FakeContentEngine addSingle(String hex, String path, int size) {
        return add(hex, "item-" + hex.substring(0, 4), Map.of(path, FakeContentHandle.pattern(size)));
    }

    /** Neue Handles bleiben "Infos ausstehend", bis {@link #completePending()} gerufen wird. */
    public void deferInfo(boolean defer) {
        this.deferInfo = defer;
    }

    /** Wiederhergestellte Handles liefern statt "Infos bekannt" diesen Fehler. */
    public void failRehydratedInfo(String message) {
        this.rehydratedInfoFailure = message;
    }

    public void completePending() {
        pending.forEach(FakeContentHandle::markReady);
        pending.clear();
    }

    /** Alle bisher ausgegebenen Handles, in Ausgabereihenfolge. */
    public List<FakeContentHandle> handles() {
        return handed;
    }

    @Override
    public ContentHandle resolve(ContentDescriptor descriptor) {
        resolveCalls.incrementAndGet();
        SessionKey key = descriptor.key();
        Map<String, byte[]> files = library.getOrDefault(key, Map.of());
        FakeContentHandle handle = new FakeContentHandle(key, names.getOrDefault(key, ""), files);
        handed.add(handle);
        if (library.containsKey(key) && !deferInfo) {
            handle.markReady();
        } else {
            pending.add(handle);
        }
        return handle;
    }

    @Override
    public ContentHandle rehydrate(SessionKey key, byte[] metadata) {
        rehydrateCalls.incrementAndGet();
        if (!Arrays.equals(metadataFor(key), metadata) || !library.containsKey(key)) {
            throw new ContentEngineException("unusable metadata for " + key);
        }
        FakeContentHandle handle = new FakeContentHandle(key, names.get(key), library.get(key));
        if (rehydratedInfoFailure != null) {
            handle.markFailed(rehydratedInfoFailure);
        } else {
            handle.markReady();
        }
        handed.add(handle);
        return handle;
    }

    @Override
    public void release(ContentHandle handle) {
        releaseCalls.incrementAndGet();
        ((FakeContentHandle) handle).release();
    }
}

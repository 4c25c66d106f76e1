package de.htwsaar.ministream.streamer.cache;

import de.htwsaar.ministream.streamer.domain.ContentHandle;
import de.htwsaar.ministream.streamer.domain.FileDescriptor;
import de.htwsaar.ministream.streamer.domain.ProgressSnapshot;
import de.htwsaar.ministream.streamer.domain.SessionKey;
import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.util.List;
import java.util.Objects;

/**
 * Aufgelöster Inhalt mit bekannter Dateiliste. Dateiliste und Größen ändern sich nach
 * dem Erzeugen nicht mehr; nur der Fortschritt wird live aus dem Handle gelesen.
 */
public final class Session {

    /** Dateiindex für "automatisch wählen" (größte Datei). */
    public static final int AUTO_SELECT = -1;

    private final SessionKey key;
    private final String displayName;
    private final List<FileDescriptor> files;
    private final long totalSize;
    private final ContentHandle handle;

    private Session(SessionKey key, String displayName, List<FileDescriptor> files, ContentHandle handle) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.displayName = displayName == null ? "" : displayName;
        this.files = List.copyOf(files);
        this.totalSize = this.files.stream().mapToLong(FileDescriptor::size).sum();
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
    }

    /**
     * Erzeugt eine Session aus einem Handle, dessen Infos bereits bekannt sind.
     *
     * @param handle Handle im Zustand "Infos bekannt"
     * @return neue Session
     */
    public static Session fromHandle(ContentHandle handle) {
        Objects.requireNonNull(handle, "handle must not be null");
        return new Session(handle.key(), handle.displayName(), handle.files(), handle);
    }

    public SessionKey key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public List<FileDescriptor> files() {
        return files;
    }

    public long totalSize() {
        return totalSize;
    }

    public FileDescriptor file(int index) {
        return files.get(index);
    }

    public boolean hasFile(int index) {
        return index >= 0 && index < files.size();
    }

    /**
     * Wählt die zu liefernde Datei: gültiger Index wird übernommen,
     * sonst die größte Datei (bei Gleichstand die erste).
     *
     * @param requested gewünschter Index oder {@link #AUTO_SELECT}
     * @return gewählter Index, {@code -1} wenn die Session keine Dateien hat
     */
    public int selectFileIndex(int requested) {
        if (hasFile(requested)) return requested;
        int best = -1;
        long bestSize = -1;
        for (int i = 0; i < files.size(); i++) {
            if (files.get(i).size() > bestSize) {
                best = i;
                bestSize = files.get(i).size();
            }
        }
        return best;
    }

    /**
     * @param path Dateipfad innerhalb der Session
     * @return Index der Datei oder {@code -1}
     */
    public int indexOfPath(String path) {
        if (path == null) return -1;
        for (int i = 0; i < files.size(); i++) {
            if (files.get(i).path().equals(path)) return i;
        }
        return -1;
    }

    public SeekableByteChannel openReader(int index) throws IOException {
        return handle.openReader(index);
    }

    public ProgressSnapshot progress() {
        return handle.progress();
    }

    public ContentHandle handle() {
        return handle;
    }
}

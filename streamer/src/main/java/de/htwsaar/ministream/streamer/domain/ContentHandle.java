package de.htwsaar.ministream.streamer.domain;

import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Handle auf einen von der {@link ContentEngine} verwalteten Inhalt.
 *
 * <p>Dateiliste, Anzeigename und Metadaten sind erst gültig, wenn {@link #infoReady()}
 * erfolgreich abgeschlossen ist.</p>
 */
public interface ContentHandle {

    SessionKey key();

    /**
     * Signal "Infos bekannt". Wird normal abgeschlossen, sobald Dateiliste und Größen feststehen,
     * oder mit einer Exception, wenn die Auflösung endgültig scheitert.
     */
    CompletableFuture<Void> infoReady();

    String displayName();

    List<FileDescriptor> files();

    /**
     * Öffnet einen Random-Access-Reader auf eine Datei. Lesezugriffe auf noch nicht
     * übertragene Bereiche dürfen blockieren, bis die Daten vorliegen.
     *
     * @param fileIndex Index in {@link #files()}
     * @return positionierbarer Kanal, vom Aufrufer zu schließen
     * @throws IOException wenn der Inhalt nicht (mehr) lesbar ist
     */
    SeekableByteChannel openReader(int fileIndex) throws IOException;

    ProgressSnapshot progress();

    /**
     * Serialisiert die Metadaten so, dass {@link ContentEngine#rehydrate} den Inhalt
     * ohne Netzwerk-Wartezeit wiederherstellen kann.
     *
     * @return undurchsichtiger Metadaten-Blob
     * @throws ContentEngineException wenn die Metadaten nicht serialisiert werden können
     */
    byte[] serializeMetadata();
}

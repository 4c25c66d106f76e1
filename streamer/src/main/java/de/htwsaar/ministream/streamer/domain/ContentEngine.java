package de.htwsaar.ministream.streamer.domain;

/**
 * Port zur Transfer-Engine, die Inhalte auflöst und Bytes bereitstellt.
 * Das eigentliche Transferprotokoll liegt vollständig hinter diesem Port.
 *
 * <p>Implementierungen müssen für parallele Aufrufer sicher sein.</p>
 */
public interface ContentEngine {

    /**
     * Beginnt die Auflösung eines Descriptors. Kehrt sofort zurück; die Infos
     * sind verfügbar, sobald {@link ContentHandle#infoReady()} abgeschlossen ist.
     *
     * @param descriptor aufzulösender Inhalt
     * @return Handle im Zustand "Infos ausstehend" oder bereits "Infos bekannt"
     * @throws ContentEngineException wenn die Auflösung nicht gestartet werden kann
     */
    ContentHandle resolve(ContentDescriptor descriptor);

    /**
     * Stellt einen Inhalt aus zuvor persistierten Metadaten wieder her.
     *
     * @param key      Session-Schlüssel
     * @param metadata Blob aus {@link ContentHandle#serializeMetadata()}
     * @return Handle, dessen Infos sofort bekannt sind
     * @throws ContentEngineException bei unbrauchbaren Metadaten
     */
    ContentHandle rehydrate(SessionKey key, byte[] metadata);

    /**
     * Gibt alle Ressourcen eines Handles frei. Danach darf das Handle nicht mehr benutzt werden.
     *
     * @param handle freizugebendes Handle
     */
    void release(ContentHandle handle);
}

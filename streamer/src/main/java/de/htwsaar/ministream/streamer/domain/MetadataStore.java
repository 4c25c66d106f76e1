package de.htwsaar.ministream.streamer.domain;

import java.util.Optional;

/**
 * Port zum dauerhaften Metadaten-Speicher (Fingerabdruck → undurchsichtiger Blob).
 */
public interface MetadataStore {

    /**
     * @param key Session-Schlüssel
     * @return gespeicherte Metadaten oder leer
     * @throws MetadataStoreException bei Speicherfehlern
     */
    Optional<byte[]> get(SessionKey key);

    /**
     * Speichert oder überschreibt die Metadaten eines Schlüssels.
     *
     * @throws MetadataStoreException bei Speicherfehlern
     */
    void put(SessionKey key, byte[] metadata);

    /**
     * Löscht die Metadaten eines Schlüssels; unbekannte Schlüssel sind kein Fehler.
     *
     * @throws MetadataStoreException bei Speicherfehlern
     */
    void delete(SessionKey key);
}

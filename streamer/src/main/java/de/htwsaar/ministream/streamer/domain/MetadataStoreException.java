package de.htwsaar.ministream.streamer.domain;

/**
 * Fehler beim Lesen oder Schreiben des {@link MetadataStore}.
 */
public class MetadataStoreException extends RuntimeException {

    public MetadataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package de.htwsaar.ministream.streamer.domain;

/**
 * Fehler innerhalb der {@link ContentEngine}.
 */
public class ContentEngineException extends RuntimeException {

    public ContentEngineException(String message) {
        super(message);
    }

    public ContentEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}

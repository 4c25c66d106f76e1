package de.htwsaar.ministream.streamer.service;

import java.util.Objects;

/**
 * Fachliche Exception des Streamers.
 * Wird im Web-Layer in HTTP-Statuscodes und einen {@code {"error": …}}-Body gemappt.
 */
public class StreamerException extends RuntimeException {

    private final ErrorKind kind;
    private final int statusCode;

    /**
     * @param kind    Fehlerklasse
     * @param message Fehlerbeschreibung für den Client
     */
    public StreamerException(ErrorKind kind, String message) {
        this(kind, message, kind.statusCode(), null);
    }

    public StreamerException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, kind.statusCode(), cause);
    }

    /**
     * Variante mit abweichendem Statuscode, z. B. um einen Upstream-Status weiterzureichen.
     *
     * @param kind       Fehlerklasse
     * @param message    Fehlerbeschreibung
     * @param statusCode gewünschter HTTP-Statuscode
     * @param cause      Ursache oder {@code null}
     */
    public StreamerException(ErrorKind kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.statusCode = statusCode;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Gibt den zugehörigen HTTP-Statuscode zurück.
     *
     * @return HTTP-Statuscode
     */
    public int getStatusCode() {
        return statusCode;
    }
}

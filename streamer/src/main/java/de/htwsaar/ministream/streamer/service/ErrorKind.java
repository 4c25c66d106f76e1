package de.htwsaar.ministream.streamer.service;

/**
 * Fehlerklassen des Streamers mit ihrem HTTP-Statuscode.
 */
public enum ErrorKind {
    INVALID_INPUT(400),
    NOT_FOUND(404),
    RESOLUTION_TIMEOUT(500),
    TOOL_UNAVAILABLE(500),
    ENGINE_FAILURE(502),
    UPSTREAM_FAILURE(502),
    UNAVAILABLE(503),
    INTERNAL(500);

    private final int statusCode;

    ErrorKind(int statusCode) {
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}

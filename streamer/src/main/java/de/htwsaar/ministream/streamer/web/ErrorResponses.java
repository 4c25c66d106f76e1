package de.htwsaar.ministream.streamer.web;

import de.htwsaar.ministream.common.serialization.JacksonCodec;
import de.htwsaar.ministream.streamer.service.StreamerException;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * Übersetzt {@link StreamerException} in {@code {"error": …}}-Antworten.
 */
final class ErrorResponses {

    private static final Logger log = LoggerFactory.getLogger(ErrorResponses.class);

    private ErrorResponses() {}

    static ResponseEntity<Map<String, String>> of(StreamerException ex) {
        logFailure(ex);
        return ResponseEntity.status(ex.getStatusCode())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", String.valueOf(ex.getMessage())));
    }

    /**
     * Variante für Endpunkte, die direkt in die {@link HttpServletResponse} schreiben.
     */
    static void write(HttpServletResponse response, StreamerException ex) throws IOException {
        logFailure(ex);
        if (response.isCommitted()) return;
        response.setStatus(ex.getStatusCode());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(JacksonCodec.toJson(Map.of("error", String.valueOf(ex.getMessage()))));
    }

    private static void logFailure(StreamerException ex) {
        if (ex.getStatusCode() >= 500) {
            log.warn("Request failed ({} {}): {}", ex.getStatusCode(), ex.getKind(), ex.getMessage());
        } else {
            log.debug("Request rejected ({} {}): {}", ex.getStatusCode(), ex.getKind(), ex.getMessage());
        }
    }
}

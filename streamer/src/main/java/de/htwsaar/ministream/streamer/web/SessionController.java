package de.htwsaar.ministream.streamer.web;

import de.htwsaar.ministream.streamer.service.SessionInfoService;
import de.htwsaar.ministream.streamer.service.StreamerException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP-Adapter für Dateilisten, Metadaten und Status von Sessions.
 *
 * <p>Kein Fachcode hier – nur HTTP-Mapping und Fehlerbehandlung.</p>
 */
@RestController
@RequestMapping("/api")
public class SessionController {

    private final SessionInfoService infoService;

    public SessionController(SessionInfoService infoService) {
        this.infoService = infoService;
    }

    /**
     * Löst den Inhalt auf und listet seine Dateien.
     *
     * @param url Magnet-Link
     * @return Infohash und Dateiliste
     */
    @GetMapping("/files")
    public ResponseEntity<?> files(@RequestParam(value = "url", required = false) String url) {
        try {
            return ResponseEntity.ok(infoService.listFiles(RequestParams.requireText(url, "url")));
        } catch (StreamerException ex) {
            return ErrorResponses.of(ex);
        }
    }

    @GetMapping("/metadata")
    public ResponseEntity<?> metadata(@RequestParam(value = "url", required = false) String url) {
        try {
            return ResponseEntity.ok(infoService.describe(RequestParams.requireText(url, "url")));
        } catch (StreamerException ex) {
            return ErrorResponses.of(ex);
        }
    }

    /**
     * Fortschritt einer aktiven Session; löst nichts neu auf.
     *
     * @param url   Magnet-Link
     * @param index optional die gestreamte Datei
     * @return Status oder 404, wenn die Session nicht aktiv ist
     */
    @GetMapping("/status")
    public ResponseEntity<?> status(
            @RequestParam(value = "url", required = false) String url,
            @RequestParam(value = "index", required = false) String index) {
        try {
            return ResponseEntity.ok(
                    infoService.status(RequestParams.requireText(url, "url"), RequestParams.optionalIndex(index)));
        } catch (StreamerException ex) {
            return ErrorResponses.of(ex);
        }
    }
}

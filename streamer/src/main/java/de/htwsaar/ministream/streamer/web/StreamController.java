package de.htwsaar.ministream.streamer.web;

import de.htwsaar.ministream.streamer.cache.Session;
import de.htwsaar.ministream.streamer.service.SessionService;
import de.htwsaar.ministream.streamer.service.StreamerException;
import de.htwsaar.ministream.streamer.stream.RangeStreamer;
import de.htwsaar.ministream.streamer.stream.StreamPlan;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP-Adapter für das Streamen einzelner Dateien inkl. {@code Range}-Unterstützung.
 */
@RestController
@RequestMapping("/api")
public class StreamController {

    private static final Logger log = LoggerFactory.getLogger(StreamController.class);

    private final SessionService sessionService;
    private final RangeStreamer rangeStreamer;

    public StreamController(SessionService sessionService, RangeStreamer rangeStreamer) {
        this.sessionService = sessionService;
        this.rangeStreamer = rangeStreamer;
    }

    /**
     * Streamt eine Datei ganz (200) oder teilweise (206).
     *
     * @param url      Magnet-Link
     * @param index    Dateiindex; fehlt er oder ist ungültig, wird die größte Datei geliefert
     * @param range    optionaler {@code Range}-Header
     * @param response Servlet-Response, in die direkt geschrieben wird
     * @throws IOException wenn der Ausgabestrom nicht geöffnet werden kann
     */
    @GetMapping("/stream")
    public void stream(
            @RequestParam(value = "url", required = false) String url,
            @RequestParam(value = "index", required = false) String index,
            @RequestHeader(value = HttpHeaders.RANGE, required = false) String range,
            HttpServletResponse response)
            throws IOException {

        StreamPlan plan;
        SeekableByteChannel channel = null;
        try {
            Session session = sessionService.resolve(RequestParams.requireText(url, "url"));
            plan = rangeStreamer.plan(session, RequestParams.indexOrAuto(index), range);
            if (plan.hasBody()) {
                channel = rangeStreamer.open(session, plan);
            }
            log.info("Streaming file {} of {} (status {}, {} bytes from {})",
                    plan.fileIndex(), session.key(), plan.status(), plan.length(), plan.start());
        } catch (StreamerException ex) {
            ErrorResponses.write(response, ex);
            return;
        }

        response.setStatus(plan.status());
        plan.headers().forEach(response::setHeader);
        if (channel == null) return;
        try (SeekableByteChannel in = channel) {
            rangeStreamer.copy(in, plan.length(), response.getOutputStream());
        }
    }
}

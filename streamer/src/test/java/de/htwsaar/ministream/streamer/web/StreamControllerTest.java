package de.htwsaar.ministream.streamer.web;

import static de.htwsaar.ministream.streamer.support.TestKeys.*;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import de.htwsaar.ministream.streamer.config.StreamerSettings;
import de.htwsaar.ministream.streamer.service.SessionService;
import de.htwsaar.ministream.streamer.stream.RangeStreamer;
import de.htwsaar.ministream.streamer.support.FakeContentEngine;
import de.htwsaar.ministream.streamer.support.FakeContentHandle;
import de.htwsaar.ministream.streamer.support.InMemoryMetadataStore;
import de.htwsaar.ministream.streamer.support.MutableClock;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class StreamControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        Map<String, byte[]> files = new LinkedHashMap<>();
        files.put("Movie/sample.txt", FakeContentHandle.pattern(10));
        files.put("Movie/movie.mp4", FakeContentHandle.pattern(1000));
        FakeContentEngine engine = new FakeContentEngine().add(HEX_A, "Movie", files);

        StreamerSettings settings = new StreamerSettings(2, 200, 256, 0, Path.of("unused"));
        SessionService sessionService = new SessionService(
                engine, new InMemoryMetadataStore(), key -> {}, settings,
                new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));

        mockMvc = MockMvcBuilders.standaloneSetup(new StreamController(sessionService, new RangeStreamer(settings)))
                .build();
    }

    @Test
    @DisplayName("Range-Anfrage liefert 206 mit passendem Ausschnitt")
    void rangeRequest_shouldReturnPartialContent() throws Exception {
        mockMvc.perform(get("/api/stream").param("url", magnet(HEX_A)).param("index", "1")
                        .header(HttpHeaders.RANGE, "bytes=100-199"))
                .andExpect(status().isPartialContent())
                .andExpect(header().string("Content-Range", "bytes 100-199/1000"))
                .andExpect(header().string("Content-Length", "100"))
                .andExpect(header().string("Accept-Ranges", "bytes"))
                .andExpect(header().string("Content-Type", "video/mp4"))
                .andExpect(header().string("X-Filename", "movie.mp4"))
                .andExpect(content().bytes(Arrays.copyOfRange(FakeContentHandle.pattern(1000), 100, 200)));
    }

    @Test
    @DisplayName("Ohne Index wird die größte Datei vollständig geliefert")
    void withoutIndex_shouldStreamLargestFile() throws Exception {
        mockMvc.perform(get("/api/stream").param("url", magnet(HEX_A)))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Filesize", "1000"))
                .andExpect(header().doesNotExist("Content-Range"))
                .andExpect(content().bytes(FakeContentHandle.pattern(1000)));
    }

    @Test
    void nonNumericIndex_shouldFallBackToAutoSelect() throws Exception {
        mockMvc.perform(get("/api/stream").param("url", magnet(HEX_A)).param("index", "abc"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Filename", "movie.mp4"));
    }

    @Test
    void unsatisfiableRange_shouldReturn416() throws Exception {
        mockMvc.perform(get("/api/stream").param("url", magnet(HEX_A)).param("index", "1")
                        .header(HttpHeaders.RANGE, "bytes=5000-"))
                .andExpect(status().isRequestedRangeNotSatisfiable())
                .andExpect(header().string("Content-Range", "bytes */1000"));
    }

    @Test
    void missingUrl_shouldReturn400() throws Exception {
        mockMvc.perform(get("/api/stream"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("url")));
    }

    @Test
    void invalidMagnet_shouldReturn400() throws Exception {
        mockMvc.perform(get("/api/stream").param("url", "http://example.org/video.mp4"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", startsWith("Invalid magnet link")));
    }

    @Test
    @DisplayName("Inhalt ohne Metadaten läuft in den Timeout")
    void unknownContent_shouldTimeOut() throws Exception {
        mockMvc.perform(get("/api/stream").param("url", magnet(HEX_B)))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").exists());
    }
}

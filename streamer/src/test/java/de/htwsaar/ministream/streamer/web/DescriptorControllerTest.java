package de.htwsaar.ministream.streamer.web;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import de.htwsaar.ministream.common.util.Sha256Util;
import de.htwsaar.ministream.streamer.descriptor.DescriptorService;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

class DescriptorControllerTest {

    private static final String INFO = "d4:name8:demo.mkv6:lengthi5ee";
    private static final String TORRENT = "d8:announce20:udp://t.example:1337" + "4:info" + INFO + "e";

    private MockMvc mockMvc;
    private RestTemplate restTemplate; // gemockt, damit keine echten HTTP-Calls passieren

    @BeforeEach
    void setUp() {
        restTemplate = mock(RestTemplate.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new DescriptorController(new DescriptorService(restTemplate)))
                .build();
    }

    @Test
    @DisplayName("Hochgeladene Torrent-Datei wird in einen Magnet-Link umgewandelt")
    void upload_shouldReturnMagnetLink() throws Exception {
        String hash = Sha256Util.sha1Hex(INFO.getBytes(StandardCharsets.US_ASCII));

        mockMvc.perform(post("/api/descriptors/upload")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(TORRENT.getBytes(StandardCharsets.US_ASCII)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.magnetLink", startsWith("magnet:?xt=urn:btih:" + hash + "&dn=demo.mkv")))
                .andExpect(jsonPath("$.magnetLink", containsString("&tr=udp%3A%2F%2Ft.example%3A1337")));
    }

    @Test
    void upload_invalidContent_shouldReturn400() throws Exception {
        mockMvc.perform(post("/api/descriptors/upload")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content("kein torrent".getBytes(StandardCharsets.UTF_8)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", startsWith("Failed to parse torrent file")));

        mockMvc.perform(post("/api/descriptors/upload")).andExpect(status().isBadRequest());
    }

    @Test
    void fetch_shouldDownloadAndConvert() throws Exception {
        when(restTemplate.getForEntity(URI.create("https://example.org/demo.torrent"), byte[].class))
                .thenReturn(ResponseEntity.ok(TORRENT.getBytes(StandardCharsets.US_ASCII)));

        mockMvc.perform(post("/api/descriptors/fetch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.org/demo.torrent\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.magnetLink", containsString("&dn=demo.mkv")));
    }

    @Test
    @DisplayName("Upstream-Status wird an den Client durchgereicht")
    void fetch_upstreamError_shouldPropagateStatus() throws Exception {
        when(restTemplate.getForEntity(any(URI.class), eq(byte[].class)))
                .thenThrow(new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE));

        mockMvc.perform(post("/api/descriptors/fetch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.org/demo.torrent\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error", containsString("503")));
    }

    @Test
    void fetch_invalidUrl_shouldReturn400() throws Exception {
        mockMvc.perform(post("/api/descriptors/fetch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"file:///etc/passwd\"}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/descriptors/fetch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(restTemplate);
    }
}

package de.htwsaar.ministream.streamer.web;

import de.htwsaar.ministream.streamer.descriptor.DescriptorService;
import de.htwsaar.ministream.streamer.dto.FetchTorrentRequest;
import de.htwsaar.ministream.streamer.dto.MagnetLinkResponse;
import de.htwsaar.ministream.streamer.service.StreamerException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP-Adapter zum Umwandeln von Torrent-Dateien in Magnet-Links.
 */
@RestController
@RequestMapping("/api/descriptors")
public class DescriptorController {

    private final DescriptorService descriptorService;

    public DescriptorController(DescriptorService descriptorService) {
        this.descriptorService = descriptorService;
    }

    /**
     * @param torrent Rohinhalt der {@code .torrent}-Datei als Request-Body
     * @return {@code {"magnetLink": …}}
     */
    @PostMapping("/upload")
    public ResponseEntity<?> upload(@RequestBody(required = false) byte[] torrent) {
        try {
            return ResponseEntity.ok(new MagnetLinkResponse(descriptorService.magnetFromTorrent(torrent)));
        } catch (StreamerException ex) {
            return ErrorResponses.of(ex);
        }
    }

    /**
     * @param request {@code {"url": …}} einer Torrent-Datei
     * @return {@code {"magnetLink": …}}
     */
    @PostMapping("/fetch")
    public ResponseEntity<?> fetch(@RequestBody(required = false) FetchTorrentRequest request) {
        try {
            String url = request == null ? null : request.url();
            return ResponseEntity.ok(new MagnetLinkResponse(descriptorService.magnetFromUrl(url)));
        } catch (StreamerException ex) {
            return ErrorResponses.of(ex);
        }
    }
}

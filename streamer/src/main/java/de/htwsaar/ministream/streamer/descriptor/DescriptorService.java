package de.htwsaar.ministream.streamer.descriptor;

import de.htwsaar.ministream.streamer.service.ErrorKind;
import de.htwsaar.ministream.streamer.service.StreamerException;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Wandelt Torrent-Metadateien (hochgeladen oder per URL) in Magnet-Links um.
 */
@Service
public class DescriptorService {

    private static final Logger log = LoggerFactory.getLogger(DescriptorService.class);

    private final RestTemplate restTemplate;

    public DescriptorService(RestTemplate restTemplate) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
    }

    /**
     * @param torrent Rohinhalt einer {@code .torrent}-Datei
     * @return Magnet-Link
     */
    public String magnetFromTorrent(byte[] torrent) {
        TorrentMetainfo info = TorrentMetainfo.parse(torrent);
        log.info("Converted torrent '{}' ({}) to magnet link", info.name(), info.infoHash());
        return info.toMagnetLink();
    }

    /**
     * Lädt eine Torrent-Metadatei per HTTP(S) und wandelt sie um.
     *
     * @param url absolute http- oder https-URL
     * @return Magnet-Link
     * @throws StreamerException bei ungültiger URL, Upstream-Fehlern oder ungültigem Inhalt
     */
    public String magnetFromUrl(String url) {
        URI uri = parseHttpUri(url);
        ResponseEntity<byte[]> response;
        try {
            response = restTemplate.getForEntity(uri, byte[].class);
        } catch (HttpStatusCodeException ex) {
            int status = ex.getStatusCode().value();
            throw new StreamerException(
                    ErrorKind.UPSTREAM_FAILURE, "Failed to fetch torrent: upstream status " + status, status, ex);
        } catch (RestClientException ex) {
            throw new StreamerException(ErrorKind.UPSTREAM_FAILURE, "Failed to fetch torrent: " + ex.getMessage(), ex);
        }
        log.debug("Fetched torrent from {} ({} bytes)", uri, response.getBody() == null ? 0 : response.getBody().length);
        return magnetFromTorrent(response.getBody());
    }

    private static URI parseHttpUri(String url) {
        if (url == null || url.isBlank()) {
            throw new StreamerException(ErrorKind.INVALID_INPUT, "URL is required");
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException ex) {
            throw new StreamerException(ErrorKind.INVALID_INPUT, "Invalid URL: " + url, ex);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https") || uri.getHost() == null) {
            throw new StreamerException(ErrorKind.INVALID_INPUT, "Invalid URL: only absolute http(s) URLs are supported");
        }
        return uri;
    }
}

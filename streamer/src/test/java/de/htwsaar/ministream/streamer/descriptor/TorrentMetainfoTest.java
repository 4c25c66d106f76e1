package de.htwsaar.ministream.streamer.descriptor;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.ministream.common.util.Sha256Util;
import de.htwsaar.ministream.streamer.service.ErrorKind;
import de.htwsaar.ministream.streamer.service.StreamerException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class TorrentMetainfoTest {

    static final String INFO = "d" + str("length") + "i1024e" + str("name") + str("demo.mkv")
            + str("piece length") + "i16384e" + str("pieces") + str("") + "e";

    static final String TORRENT = "d" + str("announce") + str("udp://tracker.example.org:1337")
            + str("announce-list") + "l"
            + "l" + str("udp://tracker.example.org:1337") + "e"
            + "l" + str("http://backup.example.org/announce") + "e"
            + "e"
            + str("info") + INFO + "e";

    @Test
    void parse_shouldHashExactInfoBytes() {
        TorrentMetainfo info = TorrentMetainfo.parse(bytes(TORRENT));

        assertEquals(Sha256Util.sha1Hex(bytes(INFO)), info.infoHash());
        assertEquals("demo.mkv", info.name());
        assertEquals(List.of("udp://tracker.example.org:1337", "http://backup.example.org/announce"), info.trackers(),
                "doppelte Tracker werden nur einmal übernommen");
    }

    @Test
    void toMagnetLink_shouldCarryHashNameAndTrackers() {
        TorrentMetainfo info = TorrentMetainfo.parse(bytes(TORRENT));

        String magnet = info.toMagnetLink();

        assertTrue(magnet.startsWith("magnet:?xt=urn:btih:" + info.infoHash() + "&dn=demo.mkv&tr="));
        assertEquals(info.infoHash(), MagnetLinks.parse(magnet).key().hex());
    }

    @Test
    void parse_shouldPreferUtf8Name() {
        String info = "d" + str("name") + str("plain") + str("name.utf-8") + str("Füße") + "e";

        assertEquals("Füße", TorrentMetainfo.parse(bytes("d" + str("info") + info + "e")).name());
    }

    @Test
    void invalidContent_shouldBeRejected() {
        for (String content : List.of(
                "",
                "not bencode",
                "l" + str("a") + "e",
                "d" + str("announce") + str("x") + "e",
                "d" + str("info") + "i1e" + "e",
                TORRENT + "trailing",
                "d" + str("info") + "d" + str("name"))) {
            StreamerException ex = assertThrows(StreamerException.class, () -> TorrentMetainfo.parse(bytes(content)), content);
            assertEquals(ErrorKind.INVALID_INPUT, ex.getKind(), content);
        }
    }

    static String str(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length + ":" + s;
    }

    static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}

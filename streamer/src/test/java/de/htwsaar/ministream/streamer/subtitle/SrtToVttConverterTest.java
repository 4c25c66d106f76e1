package de.htwsaar.ministream.streamer.subtitle;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class SrtToVttConverterTest {

    @Test
    void convert_shouldRewriteTimestampsAndDropCueNumbers() {
        String srt = "1\r\n00:00:01,000 --> 00:00:02,500\r\nHello, world\r\n\r\n"
                + "2\n00:00:03,000 --> 00:00:04,000\nWorld\nsecond line\n";

        String vtt = SrtToVttConverter.convert(srt);

        assertEquals("WEBVTT\n\n"
                + "00:00:01.000 --> 00:00:02.500\nHello, world\n\n"
                + "00:00:03.000 --> 00:00:04.000\nWorld\nsecond line\n\n", vtt);
    }

    @Test
    void convert_shouldSkipBlocksWithoutTimestamp() {
        String vtt = SrtToVttConverter.convert("garbage\n\n1\n00:00:01,000 --> 00:00:02,000\nText\n");

        assertEquals("WEBVTT\n\n00:00:01.000 --> 00:00:02.000\nText\n\n", vtt);
    }

    @Test
    void convert_shouldStripByteOrderMark() {
        String vtt = SrtToVttConverter.convert("\uFEFF1\n00:00:01,000 --> 00:00:02,000\nText\n");

        assertTrue(vtt.startsWith("WEBVTT\n\n00:00:01.000"), "BOM darf nicht im Ergebnis landen");
    }

    @Test
    void convert_emptyInput_shouldYieldHeaderOnly() {
        assertEquals(SrtToVttConverter.HEADER, SrtToVttConverter.convert(""));
        assertEquals(SrtToVttConverter.HEADER, SrtToVttConverter.convert(null));
    }
}

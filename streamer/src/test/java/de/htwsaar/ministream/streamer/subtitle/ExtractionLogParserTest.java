package de.htwsaar.ministream.streamer.subtitle;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ExtractionLogParserTest {

    @Test
    void runningLog_shouldReportLatestProgress() {
        String log = "Input #0, matroska,webm, from 'http://localhost/api/stream':\n"
                + "size=       1kB time=00:00:05.00 bitrate=   1.6kbits/s speed=10.0x\r"
                + "size=      12kB time=00:01:30.50 bitrate=   1.1kbits/s speed=  12x\r";

        ExtractionStatus status = ExtractionLogParser.parse(log);

        assertEquals(ExtractionState.RUNNING, status.state());
        assertNotNull(status.progress());
        assertEquals("12kB", status.progress().size());
        assertEquals("00:01:30.50", status.progress().time());
        assertEquals("1.1kbits/s", status.progress().bitrate());
        assertEquals("12x", status.progress().speed());
        assertTrue(status.lastLine().startsWith("size=      12kB"));
    }

    @Test
    void markers_shouldDetermineState() {
        assertEquals(ExtractionState.SUCCEEDED,
                ExtractionLogParser.parse("x\n\n" + ExtractionLogParser.SUCCESS_MARKER + "\n").state());
        assertEquals(ExtractionState.FAILED,
                ExtractionLogParser.parse("x\n\n" + ExtractionLogParser.FAILURE_MARKER + ": exit code 1\n").state());
    }

    @Test
    void lastLine_shouldIgnoreTrailingBlankLines() {
        ExtractionStatus status = ExtractionLogParser.parse("first\nExtraction failed: exit code 1\n\n\n");

        assertEquals("Extraction failed: exit code 1", status.lastLine());
        assertNull(status.progress());
    }

    @Test
    void emptyLog_shouldBeRunningWithoutLastLine() {
        ExtractionStatus status = ExtractionLogParser.parse("");

        assertEquals(ExtractionState.RUNNING, status.state());
        assertEquals("", status.lastLine());
    }
}

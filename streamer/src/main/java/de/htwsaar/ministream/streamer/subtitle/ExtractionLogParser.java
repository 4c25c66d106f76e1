package de.htwsaar.ministream.streamer.subtitle;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Liest Zustand und Fortschritt aus dem Log einer Extraktion.
 */
public final class ExtractionLogParser {

    public static final String SUCCESS_MARKER = "Extraction finished successfully.";
    public static final String FAILURE_MARKER = "Extraction failed";

    private static final Pattern PROGRESS =
            Pattern.compile("size=\\s*(\\S+)\\s*time=\\s*(\\S+)\\s*bitrate=\\s*(\\S+)\\s*speed=\\s*(\\S+)");

    private ExtractionLogParser() {}

    public static ExtractionStatus parse(String log) {
        String text = log == null ? "" : log;

        ExtractionState state = ExtractionState.RUNNING;
        if (text.contains(SUCCESS_MARKER)) {
            state = ExtractionState.SUCCEEDED;
        } else if (text.contains(FAILURE_MARKER)) {
            state = ExtractionState.FAILED;
        }

        ExtractionProgress progress = null;
        Matcher m = PROGRESS.matcher(text);
        while (m.find()) {
            progress = new ExtractionProgress(m.group(1), m.group(2), m.group(3), m.group(4));
        }
        return new ExtractionStatus(state, progress, lastLine(text));
    }

    static String lastLine(String text) {
        // ffmpeg überschreibt Fortschrittszeilen mit \r
        String[] lines = text.split("[\r\n]+");
        for (int i = lines.length - 1; i >= 0; i--) {
            if (!lines[i].isBlank()) return lines[i].strip();
        }
        return "";
    }
}

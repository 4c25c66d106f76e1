package de.htwsaar.ministream.streamer.subtitle;

/**
 * Wandelt SubRip (SRT) in WebVTT um.
 *
 * <p>Blöcke ohne Zeitstempelzeile ({@code -->}) werden verworfen; die Blocknummern ebenso.</p>
 */
public final class SrtToVttConverter {

    static final String HEADER = "WEBVTT\n\n";

    private SrtToVttConverter() {}

    public static String convert(String srt) {
        StringBuilder vtt = new StringBuilder(HEADER);
        if (srt == null || srt.isEmpty()) return vtt.toString();

        String normalized = srt.replace("\r\n", "\n");
        if (normalized.charAt(0) == '\uFEFF') normalized = normalized.substring(1);

        for (String block : normalized.split("\n\n")) {
            String trimmed = block.strip();
            if (trimmed.isEmpty()) continue;

            String[] lines = trimmed.split("\n");
            int timestamp = -1;
            for (int i = 0; i < lines.length; i++) {
                if (lines[i].contains("-->")) {
                    timestamp = i;
                    break;
                }
            }
            if (timestamp < 0) continue;

            vtt.append(lines[timestamp].replace(',', '.')).append('\n');
            for (int i = timestamp + 1; i < lines.length; i++) {
                vtt.append(lines[i]).append('\n');
            }
            vtt.append('\n');
        }
        return vtt.toString();
    }
}

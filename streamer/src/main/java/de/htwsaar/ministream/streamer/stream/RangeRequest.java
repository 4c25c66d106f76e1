package de.htwsaar.ministream.streamer.stream;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ausgewerteter {@code Range}-Header bezogen auf eine konkrete Dateigröße.
 *
 * @param kind  Art der Antwort
 * @param start erstes Byte (inklusive), nur bei {@link Kind#PARTIAL} relevant
 * @param end   letztes Byte (inklusive), nur bei {@link Kind#PARTIAL} relevant
 */
public record RangeRequest(Kind kind, long start, long end) {

    /** Antwortart für einen Range-Header. */
    public enum Kind {
        /** Kein oder nicht unterstützter Header: ganze Datei mit 200. */
        FULL,
        /** Einzelner erfüllbarer Bereich: 206. */
        PARTIAL,
        /** Bereich liegt außerhalb der Datei: 416. */
        UNSATISFIABLE
    }

    private static final String UNIT = "bytes=";
    private static final Pattern SINGLE_RANGE = Pattern.compile("(\\d*)\\s*-\\s*(\\d*)");

    public static RangeRequest full(long size) {
        return new RangeRequest(Kind.FULL, 0, size - 1);
    }

    /**
     * @param header Wert des {@code Range}-Headers oder {@code null}
     * @param size   Dateigröße in Bytes
     * @return ausgewerteter Bereich; ungültige oder mehrteilige Header ergeben {@link Kind#FULL}
     */
    public static RangeRequest parse(String header, long size) {
        if (header == null || header.isBlank()) return full(size);
        String value = header.trim();
        if (!value.toLowerCase(Locale.ROOT).startsWith(UNIT)) return full(size);
        String ranges = value.substring(UNIT.length()).trim();
        if (ranges.contains(",")) return full(size);

        Matcher m = SINGLE_RANGE.matcher(ranges);
        if (!m.matches()) return full(size);
        String first = m.group(1);
        String last = m.group(2);
        if (first.isEmpty() && last.isEmpty()) return full(size);

        try {
            if (first.isEmpty()) {
                long suffix = Long.parseLong(last);
                if (suffix == 0 || size == 0) return unsatisfiable();
                return new RangeRequest(Kind.PARTIAL, Math.max(0, size - suffix), size - 1);
            }
            long start = Long.parseLong(first);
            long end = last.isEmpty() ? size - 1 : Math.min(Long.parseLong(last), size - 1);
            if (start >= size || start > end) return unsatisfiable();
            return new RangeRequest(Kind.PARTIAL, start, end);
        } catch (NumberFormatException ex) {
            // Zahl passt nicht in long
            return full(size);
        }
    }

    public long length() {
        return end - start + 1;
    }

    private static RangeRequest unsatisfiable() {
        return new RangeRequest(Kind.UNSATISFIABLE, 0, -1);
    }
}

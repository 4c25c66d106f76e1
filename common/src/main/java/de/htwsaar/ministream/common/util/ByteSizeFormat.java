package de.htwsaar.ministream.common.util;

import java.util.Locale;

/**
 * Formatiert Byte-Angaben menschenlesbar (Basis 1024).
 *
 * <p>Beispiele: {@code 512 B}, {@code 1.50 KB}, {@code 2.00 GB}. Die Ausgabe ist
 * unabhängig von der Default-Locale, damit Clients immer einen Punkt als Dezimaltrenner sehen.</p>
 */
public final class ByteSizeFormat {

    private static final int UNIT = 1024;
    private static final String PREFIXES = "KMGTPE";

    private ByteSizeFormat() {}

    public static String humanReadable(long bytes) {
        if (bytes < UNIT) {
            return bytes + " B";
        }
        long div = UNIT;
        int exp = 0;
        for (long n = bytes / UNIT; n >= UNIT; n /= UNIT) {
            div *= UNIT;
            exp++;
        }
        return String.format(Locale.ROOT, "%.2f %cB", (double) bytes / div, PREFIXES.charAt(exp));
    }

    public static String humanReadableSpeed(double bytesPerSecond) {
        return humanReadable((long) bytesPerSecond) + "/s";
    }
}

package de.htwsaar.ministream.streamer.web;

import de.htwsaar.ministream.streamer.cache.Session;
import de.htwsaar.ministream.streamer.service.ErrorKind;
import de.htwsaar.ministream.streamer.service.StreamerException;
import java.util.OptionalInt;

/**
 * Gemeinsame Prüfungen für Query-Parameter.
 */
final class RequestParams {

    private RequestParams() {}

    static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new StreamerException(ErrorKind.INVALID_INPUT, "Missing '" + name + "' query parameter");
        }
        return value;
    }

    /**
     * Nicht angegebene oder nicht-numerische Indizes bedeuten "automatisch wählen".
     */
    static int indexOrAuto(String value) {
        if (value == null || value.isBlank()) return Session.AUTO_SELECT;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return Session.AUTO_SELECT;
        }
    }

    /**
     * Für den Status: ohne oder mit nicht-numerischem Index leer, jeder Zahlenwert wird übernommen.
     */
    static OptionalInt optionalIndex(String value) {
        if (value == null || value.isBlank()) return OptionalInt.empty();
        try {
            return OptionalInt.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }

    static int requireIndex(String value) {
        String text = requireText(value, "index");
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException ex) {
            throw new StreamerException(ErrorKind.INVALID_INPUT, "Invalid 'index' query parameter");
        }
    }
}

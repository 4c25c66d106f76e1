package de.htwsaar.ministream.streamer.domain;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stabiler Fingerabdruck eines Inhalts (hex-codierter Hash) und damit Cache-Schlüssel einer Session.
 *
 * <p>Wird immer in Kleinbuchstaben normalisiert, damit {@code ABC…} und {@code abc…}
 * auf denselben Cache-Eintrag zeigen.</p>
 *
 * @param hex hex-codierter Fingerabdruck
 */
public record SessionKey(String hex) {

    private static final Pattern HEX = Pattern.compile("[0-9a-f]+");

    public SessionKey {
        Objects.requireNonNull(hex, "hex must not be null");
        hex = hex.trim().toLowerCase(Locale.ROOT);
        if (!HEX.matcher(hex).matches()) {
            throw new IllegalArgumentException("session key must be hex-encoded: '" + hex + "'");
        }
    }

    public static SessionKey of(String hex) {
        return new SessionKey(hex);
    }

    /**
     * Präfix aller abgeleiteten Artefakte dieser Session (z. B. {@code abc…_3.ass}).
     *
     * @return {@code hex + "_"}
     */
    public String artifactPrefix() {
        return hex + "_";
    }

    @Override
    public String toString() {
        return hex;
    }
}

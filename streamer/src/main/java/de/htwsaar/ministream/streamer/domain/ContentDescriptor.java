package de.htwsaar.ministream.streamer.domain;

import java.util.Objects;

/**
 * Vom Aufrufer übergebener Locator eines Inhalts (z. B. ein Magnet-Link).
 * Wird nur für die Cold-Path-Auflösung benötigt; der Schlüssel ist bereits daraus abgeleitet.
 *
 * @param key         abgeleiteter Session-Schlüssel
 * @param displayName bereinigter Anzeigename (leer, wenn unbekannt)
 * @param raw         unveränderter Original-Locator
 */
public record ContentDescriptor(SessionKey key, String displayName, String raw) {

    public ContentDescriptor {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(raw, "raw must not be null");
        displayName = displayName == null ? "" : displayName;
    }
}

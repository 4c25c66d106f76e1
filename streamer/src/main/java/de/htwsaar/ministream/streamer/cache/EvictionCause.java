package de.htwsaar.ministream.streamer.cache;

/**
 * Grund, aus dem eine Session den Cache verlassen hat.
 */
public enum EvictionCause {
    /** Kapazität überschritten, am längsten nicht genutzte Session verdrängt. */
    CAPACITY,
    /** Unter demselben Schlüssel wurde eine neue Session abgelegt. */
    REPLACED,
    /** Explizit entfernt (z. B. durch den Sweeper). */
    REMOVED,
    /** Cache wurde beim Herunterfahren geleert. */
    CLEARED
}

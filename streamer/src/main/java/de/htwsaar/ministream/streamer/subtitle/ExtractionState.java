package de.htwsaar.ministream.streamer.subtitle;

/** Zustände eines Extraktionsjobs: {@code RUNNING → SUCCEEDED | FAILED}. */
public enum ExtractionState {
    RUNNING,
    SUCCEEDED,
    FAILED
}

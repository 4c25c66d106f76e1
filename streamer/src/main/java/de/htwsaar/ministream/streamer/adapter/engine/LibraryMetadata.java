package de.htwsaar.ministream.streamer.adapter.engine;

import de.htwsaar.ministream.streamer.domain.FileDescriptor;
import java.util.List;

/**
 * Persistierte Metadaten eines Bibliothekseintrags (JSON).
 *
 * @param key        Session-Schlüssel (hex)
 * @param name       Anzeigename
 * @param root       absoluter Pfad des Eintrags
 * @param singleFile {@code true}, wenn der Eintrag eine einzelne Datei ist
 * @param files      Dateiliste
 */
public record LibraryMetadata(String key, String name, String root, boolean singleFile, List<FileDescriptor> files) {}

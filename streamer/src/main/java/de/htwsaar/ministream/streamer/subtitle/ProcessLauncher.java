package de.htwsaar.ministream.streamer.subtitle;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Startet externe Prozesse; stdout und stderr landen gemeinsam in einer Logdatei.
 */
@FunctionalInterface
public interface ProcessLauncher {

    Process launch(List<String> command, Path logFile) throws IOException;

    /**
     * Standard-Implementierung über {@link ProcessBuilder}.
     */
    static ProcessLauncher processBuilder() {
        return (command, logFile) -> new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()))
                .start();
    }
}

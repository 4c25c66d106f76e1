package de.htwsaar.ministream.streamer.subtitle;

import de.htwsaar.ministream.streamer.service.ErrorKind;
import de.htwsaar.ministream.streamer.service.StreamerException;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Findet das Extraktionswerkzeug (standardmäßig {@code ffmpeg}) als Pfad oder im {@code PATH}.
 */
public class SubtitleToolLocator {

    private final String tool;
    private final String searchPath;

    public SubtitleToolLocator(String tool) {
        this(tool, System.getenv("PATH"));
    }

    SubtitleToolLocator(String tool, String searchPath) {
        this.tool = Objects.requireNonNull(tool, "tool must not be null").trim();
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    public String tool() {
        return tool;
    }

    /**
     * @return ausführbare Datei des Werkzeugs
     * @throws StreamerException {@link ErrorKind#TOOL_UNAVAILABLE}, wenn nichts Ausführbares gefunden wird
     */
    public Path locate() {
        if (tool.isEmpty()) throw unavailable();
        try {
            if (tool.contains("/") || tool.contains(File.separator)) {
                Path direct = Path.of(tool);
                if (isExecutable(direct)) return direct.toAbsolutePath();
                throw unavailable();
            }
            for (String dir : searchPath.split(File.pathSeparator)) {
                if (dir.isBlank()) continue;
                for (String name : candidateNames()) {
                    Path candidate = Path.of(dir, name);
                    if (isExecutable(candidate)) return candidate;
                }
            }
        } catch (InvalidPathException ex) {
            throw new StreamerException(ErrorKind.TOOL_UNAVAILABLE, "Invalid tool path: " + tool, ex);
        }
        throw unavailable();
    }

    public boolean isAvailable() {
        try {
            locate();
            return true;
        } catch (StreamerException ex) {
            return false;
        }
    }

    private String[] candidateNames() {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
        return windows ? new String[] {tool, tool + ".exe"} : new String[] {tool};
    }

    private static boolean isExecutable(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }

    private StreamerException unavailable() {
        return new StreamerException(
                ErrorKind.TOOL_UNAVAILABLE,
                tool + " executable not found. Please ensure " + tool + " is installed and in the system PATH.");
    }
}

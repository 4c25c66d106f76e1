package de.htwsaar.ministream.streamer.subtitle;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.ministream.streamer.config.StreamerSettings;
import de.htwsaar.ministream.streamer.service.ErrorKind;
import de.htwsaar.ministream.streamer.service.StreamerException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void constructor_shouldCreateDirectory() {
        Path dir = tempDir.resolve("nested/artifacts");

        ArtifactRegistry registry = registry(dir);

        assertTrue(Files.isDirectory(dir));
        assertEquals(dir.toAbsolutePath().normalize(), registry.directory());
    }

    @Test
    void resolveName_shouldRejectPathsOutsideDirectory() {
        ArtifactRegistry registry = registry(tempDir);

        assertEquals(tempDir.resolve("a_0.log").toAbsolutePath().normalize(), registry.resolveName("a_0.log"));
        for (String name : List.of("../secret.txt", "x/../../secret.txt", "", " ", ".")) {
            StreamerException ex = assertThrows(StreamerException.class, () -> registry.resolveName(name), name);
            assertEquals(ErrorKind.INVALID_INPUT, ex.getKind());
        }
    }

    @Test
    void removeByPrefix_shouldOnlyRemoveMatchingKeys() {
        ArtifactRegistry registry = registry(tempDir);
        registry.register("aaa_1.vtt", tempDir.resolve("aaa_1.vtt"));
        registry.register("aaa_2.vtt", tempDir.resolve("aaa_2.vtt"));
        registry.register("bbb_1.vtt", tempDir.resolve("bbb_1.vtt"));

        List<Path> removed = registry.removeByPrefix("aaa_");

        assertEquals(2, removed.size());
        assertEquals(1, registry.size());
        assertTrue(registry.lookup("bbb_1.vtt").isPresent());
        assertTrue(registry.lookup("aaa_1.vtt").isEmpty());
        assertTrue(registry.lookup(null).isEmpty());
    }

    private static ArtifactRegistry registry(Path dir) {
        return new ArtifactRegistry(new StreamerSettings(2, 1_000, 64, 0, dir));
    }
}

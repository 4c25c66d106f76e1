package de.htwsaar.ministream.streamer;

import de.htwsaar.ministream.streamer.adapter.engine.LocalLibraryContentEngine;
import de.htwsaar.ministream.streamer.adapter.store.JooqMetadataStore;
import de.htwsaar.ministream.streamer.config.StreamerSettings;
import de.htwsaar.ministream.streamer.domain.ContentEngine;
import de.htwsaar.ministream.streamer.domain.MetadataStore;
import de.htwsaar.ministream.streamer.subtitle.ProcessLauncher;
import de.htwsaar.ministream.streamer.subtitle.SubtitleToolLocator;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Zentrale Spring-Verdrahtung des Streamers.
 *
 * <p>Schichtung: Controller → Service → Domain/Ports → Adapter/Infrastructure</p>
 */
@Configuration
public class StreamerBeans {

    private static final Logger log = LoggerFactory.getLogger(StreamerBeans.class);

    /**
     * Systemuhr für den gesamten Streamer-Kontext.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * HTTP-Client-Template zum Laden von Torrent-Dateien.
     *
     * @param timeoutMs Connect- und Read-Timeout in ms (Standard: 30000)
     * @return RestTemplate mit Timeouts
     */
    @Bean
    public RestTemplate restTemplate(@Value("${streamer.http.timeout-ms:30000}") int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    /**
     * Liest die Streamer-Konfiguration aus den Properties.
     *
     * @param cacheCapacity    maximale aktive Sessions (Standard: 2)
     * @param resolveTimeoutMs Wartezeit auf Inhalts-Infos in ms (Standard: 30000)
     * @param chunkBytes       Blockgröße beim Streamen (Standard: 512 KiB)
     * @param inactiveAfterMs  Inaktivitätsschwelle in ms, ≤ 0 deaktiviert den Sweeper (Standard: 30 min)
     * @param artifactDir      Verzeichnis für Untertitel-Artefakte
     * @return unveränderliche {@link StreamerSettings}
     */
    @Bean
    public StreamerSettings streamerSettings(
            @Value("${streamer.cache.capacity:2}") int cacheCapacity,
            @Value("${streamer.resolve.timeout-ms:30000}") long resolveTimeoutMs,
            @Value("${streamer.stream.chunk-bytes:524288}") int chunkBytes,
            @Value("${streamer.sweep.inactive-after-ms:1800000}") long inactiveAfterMs,
            @Value("${streamer.artifact-dir:./data/artifacts}") String artifactDir) {

        return new StreamerSettings(
                Math.max(1, cacheCapacity),
                resolveTimeoutMs,
                chunkBytes,
                inactiveAfterMs,
                Path.of(artifactDir));
    }

    /**
     * Adapter-Implementierung des {@link ContentEngine}-Ports über die lokale Bibliothek.
     *
     * @param libraryDir Bibliotheksverzeichnis
     * @param pollMs     Prüfintervall für noch fehlende Inhalte
     * @return {@link LocalLibraryContentEngine}
     */
    @Bean(destroyMethod = "close")
    public LocalLibraryContentEngine contentEngine(
            @Value("${engine.library-dir:./data/library}") String libraryDir,
            @Value("${engine.library.poll-ms:1000}") long pollMs) {
        LocalLibraryContentEngine engine = new LocalLibraryContentEngine(Path.of(libraryDir), pollMs);
        log.info("Serving content from library {}", engine.libraryDir());
        return engine;
    }

    /**
     * Adapter-Implementierung des {@link MetadataStore}-Ports via jOOQ/SQLite.
     *
     * @param jdbcUrl JDBC-URL der SQLite-Datenbank
     * @param clock   Zeitquelle für {@code stored_at}
     * @return {@link JooqMetadataStore}
     * @throws SQLException wenn die Datenbank nicht geöffnet werden kann
     */
    @Bean(destroyMethod = "close")
    public JooqMetadataStore metadataStore(
            @Value("${streamer.metadata.jdbc-url:jdbc:sqlite:./data/metadata.db}") String jdbcUrl, Clock clock)
            throws SQLException {
        return new JooqMetadataStore(jdbcUrl, clock);
    }

    /**
     * Findet das Extraktionswerkzeug; bei aktivierter Startprüfung bricht ein fehlendes Werkzeug den Start ab.
     *
     * @param tool            Name oder Pfad des Werkzeugs (Standard: ffmpeg)
     * @param checkOnStartup  Werkzeug beim Start prüfen (Standard: true)
     * @return {@link SubtitleToolLocator}
     */
    @Bean
    public SubtitleToolLocator subtitleToolLocator(
            @Value("${subtitles.extraction.tool:ffmpeg}") String tool,
            @Value("${subtitles.extraction.check-tool-on-startup:true}") boolean checkOnStartup) {
        SubtitleToolLocator locator = new SubtitleToolLocator(tool);
        if (checkOnStartup) {
            log.info("{} executable found at {}", tool, locator.locate());
        }
        return locator;
    }

    @Bean
    public ProcessLauncher processLauncher() {
        return ProcessLauncher.processBuilder();
    }

    /**
     * Executor für die Monitor-Tasks laufender Extraktionen.
     *
     * @return gecachter Thread-Pool mit Daemon-Threads
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService extractionMonitorExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "extraction-monitor-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}

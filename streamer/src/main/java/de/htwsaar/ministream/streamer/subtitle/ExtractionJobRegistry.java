package de.htwsaar.ministream.streamer.subtitle;

import de.htwsaar.ministream.streamer.domain.SessionKey;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Buchführung der Extraktionsjobs, ein Job je {@code (sessionKey, fileIndex)}.
 */
@Component
public class ExtractionJobRegistry {

    private final Map<String, ExtractionJob> jobs = new HashMap<>();

    /**
     * Registriert {@code candidate}, sofern für dieselbe Datei kein Job läuft.
     *
     * @return der laufende Job oder {@code candidate}
     */
    public synchronized ExtractionJob registerIfIdle(ExtractionJob candidate) {
        String id = jobId(candidate.sessionKey(), candidate.fileIndex());
        ExtractionJob existing = jobs.get(id);
        if (existing != null && existing.isRunning()) return existing;
        jobs.put(id, candidate);
        return candidate;
    }

    public synchronized Optional<ExtractionJob> find(SessionKey key, int fileIndex) {
        return Optional.ofNullable(jobs.get(jobId(key, fileIndex)));
    }

    public synchronized void remove(ExtractionJob job) {
        jobs.remove(jobId(job.sessionKey(), job.fileIndex()), job);
    }

    /**
     * Entfernt alle Jobs einer Session.
     *
     * @return die entfernten Jobs
     */
    public synchronized List<ExtractionJob> removeSession(SessionKey key) {
        List<ExtractionJob> removed = new ArrayList<>();
        Iterator<ExtractionJob> it = jobs.values().iterator();
        while (it.hasNext()) {
            ExtractionJob job = it.next();
            if (job.sessionKey().equals(key)) {
                removed.add(job);
                it.remove();
            }
        }
        return removed;
    }

    public synchronized int size() {
        return jobs.size();
    }

    private static String jobId(SessionKey key, int fileIndex) {
        return key.artifactPrefix() + fileIndex;
    }
}

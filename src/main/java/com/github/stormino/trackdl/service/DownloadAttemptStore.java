package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.model.DownloadAttempt;
import com.github.stormino.trackdl.util.DownloadConstants;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Bounded store of download attempts, keyed by task id. Once the limit is exceeded the
 * oldest quarter of the entries (by attempt timestamp, then insertion order) is evicted.
 */
@Slf4j
public class DownloadAttemptStore {

    private final int maxAttempts;
    private final Map<String, DownloadAttempt> attempts = new LinkedHashMap<>();

    public DownloadAttemptStore() {
        this(DownloadConstants.MAX_STORED_ATTEMPTS);
    }

    public DownloadAttemptStore(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    public synchronized void put(String taskId, DownloadAttempt attempt) {
        attempts.put(taskId, attempt);
        if (attempts.size() > maxAttempts) {
            evictOldest();
        }
    }

    public synchronized Optional<DownloadAttempt> get(String taskId) {
        return Optional.ofNullable(attempts.get(taskId));
    }

    public synchronized int size() {
        return attempts.size();
    }

    public synchronized void clear() {
        attempts.clear();
    }

    private void evictOldest() {
        int toRemove = Math.max(1, (int) Math.floor(maxAttempts * DownloadConstants.ATTEMPT_EVICTION_RATIO));
        List<String> oldest = attempts.entrySet().stream()
                .sorted(Comparator.comparing(e -> e.getValue().getTimestamp()))
                .limit(toRemove)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        oldest.forEach(attempts::remove);
        log.debug("Evicted {} oldest download attempts, {} remain", oldest.size(), attempts.size());
    }
}

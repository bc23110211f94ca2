package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.model.DownloadAttempt;
import com.github.stormino.trackdl.model.DownloadOptions;
import com.github.stormino.trackdl.testsupport.TestTracks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DownloadAttemptStore")
class DownloadAttemptStoreTest {

    private static DownloadAttempt attemptAt(long epochSecond) {
        return new DownloadAttempt(TestTracks.nativeTrack("t" + epochSecond), DownloadOptions.defaults(),
                Instant.ofEpochSecond(epochSecond));
    }

    @Test
    @DisplayName("stores and returns attempts by task id")
    void putAndGet() {
        DownloadAttemptStore store = new DownloadAttemptStore(10);
        DownloadAttempt attempt = attemptAt(1);

        store.put("task-1", attempt);

        assertSame(attempt, store.get("task-1").orElseThrow());
        assertTrue(store.get("missing").isEmpty());
    }

    @Test
    @DisplayName("exceeding the limit evicts the oldest quarter")
    void evictsOldestQuarter() {
        DownloadAttemptStore store = new DownloadAttemptStore(50);

        for (int i = 1; i <= 51; i++) {
            store.put("task-" + i, attemptAt(i));
        }

        // 51 entries, 12 evicted
        assertEquals(39, store.size());
        for (int i = 1; i <= 12; i++) {
            assertTrue(store.get("task-" + i).isEmpty(), "task-" + i + " should be evicted");
        }
        assertTrue(store.get("task-13").isPresent());
        assertTrue(store.get("task-51").isPresent());
    }

    @Test
    @DisplayName("eviction uses timestamps, not insertion order")
    void evictsByTimestamp() {
        DownloadAttemptStore store = new DownloadAttemptStore(4);
        store.put("newest", attemptAt(100));
        store.put("a", attemptAt(2));
        store.put("b", attemptAt(3));
        store.put("c", attemptAt(4));

        store.put("oldest", attemptAt(1));

        assertEquals(4, store.size());
        assertTrue(store.get("oldest").isEmpty());
        assertTrue(store.get("newest").isPresent());
    }

    @Test
    @DisplayName("small stores evict at least one entry")
    void evictsAtLeastOne() {
        DownloadAttemptStore store = new DownloadAttemptStore(2);
        store.put("a", attemptAt(1));
        store.put("b", attemptAt(2));
        store.put("c", attemptAt(3));

        assertEquals(2, store.size());
        assertTrue(store.get("a").isEmpty());
    }

    @Test
    @DisplayName("rejects non-positive limits")
    void rejectsInvalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> new DownloadAttemptStore(0));
    }

    @Test
    @DisplayName("clear removes everything")
    void clear() {
        DownloadAttemptStore store = new DownloadAttemptStore();
        store.put("a", attemptAt(1));

        store.clear();

        assertEquals(0, store.size());
    }
}

package com.example.trackscheduler.infrastructure.library;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import static org.mockito.Mockito.mock;

import com.example.trackscheduler.application.service.PersistenceAdvisoryService;
import com.example.trackscheduler.common.config.AppSchedulerProperties;
import com.example.trackscheduler.domain.model.TrackRecord;
import com.example.trackscheduler.infrastructure.persistence.JsonFileStore;
import com.example.trackscheduler.infrastructure.persistence.TrackQueueRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PersistentTrackCollectionTest {

    @TempDir
    Path dataDir;

    private AppSchedulerProperties properties;
    private PersistentTrackCollection collection;

    @BeforeEach
    void setUp() {
        properties = new AppSchedulerProperties();
        properties.setDataDir(dataDir.toString());
        properties.setLibraryFlushDebounceMs(60_000L);
        collection = newCollection();
    }

    private PersistentTrackCollection newCollection() {
        TrackQueueRepository repository = new TrackQueueRepository(new JsonFileStore(new ObjectMapper()), properties);
        return new PersistentTrackCollection(repository, mock(PersistenceAdvisoryService.class),
                mock(ScheduledExecutorService.class), properties);
    }

    @Test
    void shouldSkipDuplicatesByLookupKey() {
        List<Integer> appended = collection.append(Arrays.asList(
                TrackRecord.placeholder("/Music/A.mp3"),
                TrackRecord.placeholder("/music/a.mp3"),
                TrackRecord.placeholder("/Music/B.mp3")));

        assertEquals(Arrays.asList(0, 1), appended);
        assertEquals(2, collection.size());
        assertEquals(Integer.valueOf(0), collection.indexOfKey("/music/a.mp3"));
        assertTrue(collection.append(Collections.singletonList(TrackRecord.placeholder("/Music/B.mp3"))).isEmpty());
    }

    @Test
    void shouldReindexAfterRemoval() {
        collection.append(Arrays.asList(
                TrackRecord.placeholder("/a.mp3"),
                TrackRecord.placeholder("/b.mp3"),
                TrackRecord.placeholder("/c.mp3")));

        assertEquals("/a.mp3", collection.remove(0).getPath());
        assertEquals(Integer.valueOf(0), collection.indexOfKey("/b.mp3"));
        assertEquals(Integer.valueOf(1), collection.indexOfKey("/c.mp3"));
        assertNull(collection.indexOfKey("/a.mp3"));
        assertNull(collection.remove(5));
        assertNull(collection.get(-1));
    }

    @Test
    void shouldUpdateInPlaceKeepingStoredPath() {
        collection.append(Collections.singletonList(TrackRecord.placeholder("/Music/A.mp3")));
        TrackRecord hydrated = new TrackRecord("/music/a.mp3", "Title", "Artist", "Album", 215, true);

        assertTrue(collection.update(hydrated));
        assertEquals("/Music/A.mp3", collection.get(0).getPath());
        assertEquals("Title", collection.get(0).getTitle());
        assertFalse(collection.update(TrackRecord.placeholder("/other.mp3")));
    }

    @Test
    void shouldReadBackQueueInIndexOrderAfterFlush() {
        collection.append(Arrays.asList(
                TrackRecord.placeholder("/Music/B.mp3"),
                TrackRecord.placeholder("/Music/A.mp3")));
        collection.update(new TrackRecord("/Music/A.mp3", "Title", "Artist", null, 180, true));
        collection.flush();

        PersistentTrackCollection reloaded = newCollection();

        assertEquals(2, reloaded.size());
        assertEquals("/Music/B.mp3", reloaded.get(0).getPath());
        assertEquals(Integer.valueOf(1), reloaded.indexOfKey("/music/a.mp3"));
        assertEquals("Title", reloaded.get(1).getTitle());
        assertTrue(reloaded.get(1).isHydrated());
        assertFalse(reloaded.get(0).isHydrated());
    }

    @Test
    void shouldStartEmptyWhenQueueFileIsCorrupt() throws Exception {
        Files.write(dataDir.resolve("track-queue.json"), "{not json".getBytes("UTF-8"));

        assertEquals(0, newCollection().size());
    }
}

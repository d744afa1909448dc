package com.example.trackscheduler.infrastructure.library;

import com.example.trackscheduler.application.service.PersistenceAdvisoryService;
import com.example.trackscheduler.common.config.AppSchedulerProperties;
import com.example.trackscheduler.common.util.PathKeys;
import com.example.trackscheduler.domain.model.TrackRecord;
import com.example.trackscheduler.infrastructure.persistence.DebouncedFlusher;
import com.example.trackscheduler.infrastructure.persistence.TrackQueueRepository;
import com.example.trackscheduler.infrastructure.persistence.model.TrackQueueDocument;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * List-backed collection with a lookup-key index, saved to track-queue.json
 * after every change (debounced) and read back on first access.
 *
 * <p>Mutated only through the scheduler; the monitor guards the snapshot
 * taken by the background save.
 */
@Component
public class PersistentTrackCollection implements TrackCollection {

    private static final Logger log = LoggerFactory.getLogger(PersistentTrackCollection.class);

    private final List<TrackRecord> records = new ArrayList<>();
    private final Map<String, Integer> indexByLookupKey = new HashMap<>();
    private final TrackQueueRepository repository;
    private final PersistenceAdvisoryService advisoryService;
    private final DebouncedFlusher flusher;
    private boolean loaded;

    public PersistentTrackCollection(TrackQueueRepository repository,
                                     PersistenceAdvisoryService advisoryService,
                                     @Qualifier("persistenceExecutor") ScheduledExecutorService persistenceExecutor,
                                     AppSchedulerProperties properties) {
        this.repository = repository;
        this.advisoryService = advisoryService;
        this.flusher = new DebouncedFlusher("queue", persistenceExecutor,
                properties.getLibraryFlushDebounceMs(), this::saveNow);
    }

    @Override
    public synchronized List<TrackRecord> allRecords() {
        loadIfNeeded();
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    @Override
    public synchronized int size() {
        loadIfNeeded();
        return records.size();
    }

    @Override
    public synchronized TrackRecord get(int index) {
        loadIfNeeded();
        if (index < 0 || index >= records.size()) {
            return null;
        }
        return records.get(index);
    }

    @Override
    public synchronized Integer indexOfKey(String key) {
        loadIfNeeded();
        if (key == null) {
            return null;
        }
        for (String lookupKey : PathKeys.lookupKeys(key)) {
            Integer index = indexByLookupKey.get(lookupKey);
            if (index != null) {
                return index;
            }
        }
        return null;
    }

    @Override
    public synchronized List<Integer> append(List<TrackRecord> toAppend) {
        loadIfNeeded();
        List<Integer> appended = appendRecords(toAppend);
        if (!appended.isEmpty()) {
            flusher.schedule();
        }
        return appended;
    }

    @Override
    public synchronized TrackRecord remove(int index) {
        loadIfNeeded();
        if (index < 0 || index >= records.size()) {
            return null;
        }
        TrackRecord removed = records.remove(index);
        rebuildIndex();
        flusher.schedule();
        return removed;
    }

    @Override
    public synchronized void clear() {
        loadIfNeeded();
        records.clear();
        indexByLookupKey.clear();
        flusher.schedule();
    }

    @Override
    public synchronized boolean update(TrackRecord record) {
        loadIfNeeded();
        if (record == null) {
            return false;
        }
        Integer index = indexOfKey(record.getPath());
        if (index == null) {
            return false;
        }
        TrackRecord existing = records.get(index);
        // Keep the stored path so the record's key never changes.
        record.setPath(existing.getPath());
        records.set(index, record);
        flusher.schedule();
        return true;
    }

    /**
     * Writes pending changes now instead of waiting for the debounce timer.
     */
    @PreDestroy
    public void flush() {
        synchronized (this) {
            if (!loaded) {
                return;
            }
        }
        flusher.flushNow();
    }

    private List<Integer> appendRecords(List<TrackRecord> toAppend) {
        if (toAppend == null || toAppend.isEmpty()) {
            return Collections.emptyList();
        }
        List<Integer> appended = new ArrayList<>();
        for (TrackRecord record : toAppend) {
            if (record == null || record.getPath() == null || indexOfKey(record.getPath()) != null) {
                continue;
            }
            int index = records.size();
            records.add(record);
            indexRecord(record, index);
            appended.add(index);
        }
        return appended;
    }

    private void loadIfNeeded() {
        if (loaded) {
            return;
        }
        loaded = true;
        TrackQueueDocument document = repository.load();
        if (document == null || document.getTracks() == null) {
            return;
        }
        List<TrackRecord> stored = new ArrayList<>(document.getTracks().size());
        for (TrackQueueDocument.Track track : document.getTracks()) {
            if (track != null && track.getPath() != null && !track.getPath().trim().isEmpty()) {
                stored.add(new TrackRecord(PathKeys.canonical(track.getPath()), track.getTitle(), track.getArtist(),
                        track.getAlbum(), track.getDurationSec(), track.isHydrated()));
            }
        }
        int appended = appendRecords(stored).size();
        log.info("QUEUE_EVENT event=loaded tracks={} skipped={}", appended, document.getTracks().size() - appended);
    }

    private void saveNow() {
        TrackQueueDocument document = new TrackQueueDocument();
        document.setVersion(TrackQueueDocument.CURRENT_VERSION);
        synchronized (this) {
            for (TrackRecord record : records) {
                document.getTracks().add(new TrackQueueDocument.Track(record.getPath(), record.getTitle(),
                        record.getArtist(), record.getAlbum(), record.getDurationSec(), record.isHydrated()));
            }
        }
        try {
            repository.save(document);
        } catch (IOException | RuntimeException e) {
            advisoryService.report("queue", "播放队列保存失败", "请检查磁盘权限或空间", e);
        }
    }

    private void rebuildIndex() {
        indexByLookupKey.clear();
        for (int i = 0; i < records.size(); i++) {
            indexRecord(records.get(i), i);
        }
    }

    private void indexRecord(TrackRecord record, int index) {
        for (String lookupKey : PathKeys.lookupKeys(record.getPath())) {
            indexByLookupKey.putIfAbsent(lookupKey, index);
        }
    }
}

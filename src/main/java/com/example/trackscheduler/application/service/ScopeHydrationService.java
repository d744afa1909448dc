package com.example.trackscheduler.application.service;

import com.example.trackscheduler.common.config.AppSchedulerProperties;
import com.example.trackscheduler.domain.model.AudioMetadata;
import com.example.trackscheduler.domain.model.PlaybackScope;
import com.example.trackscheduler.domain.model.TrackRecord;
import com.example.trackscheduler.infrastructure.parser.AudioMetadataParser;
import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Reads tags for the members of a freshly activated playlist scope in the
 * background, batch by batch. Only one hydration runs at a time; starting a
 * new one or calling {@link #cancel()} abandons the previous generation, and
 * batches it still produces are refused by {@link #isCurrent(long)}.
 */
@Service
public class ScopeHydrationService {

    private static final Logger log = LoggerFactory.getLogger(ScopeHydrationService.class);

    private final ExecutorService executor;
    private final AudioMetadataParser metadataParser;
    private final int batchSize;
    private final AtomicLong generation = new AtomicLong();
    private Future<?> running;

    public ScopeHydrationService(@Qualifier("hydrationExecutor") ExecutorService executor,
                                 AudioMetadataParser metadataParser,
                                 AppSchedulerProperties properties) {
        this.executor = executor;
        this.metadataParser = metadataParser;
        this.batchSize = Math.max(1, properties.getHydrationBatchSize());
    }

    /**
     * Receives hydrated records. Called from a hydration thread.
     */
    public interface HydrationSink {

        void accept(long generation, PlaybackScope scope, List<TrackRecord> batch);
    }

    /**
     * @return the generation of the new hydration
     */
    public synchronized long start(PlaybackScope scope, List<String> paths, HydrationSink sink) {
        cancelRunning();
        long current = generation.incrementAndGet();
        if (paths == null || paths.isEmpty()) {
            return current;
        }
        final List<String> snapshot = new ArrayList<>(paths);
        try {
            running = executor.submit(() -> hydrate(current, scope, snapshot, sink));
            log.info("HYDRATION_EVENT event=started scope={} generation={} tracks={}",
                    scope, current, snapshot.size());
        } catch (RejectedExecutionException e) {
            log.warn("HYDRATION_EVENT event=rejected scope={} generation={}", scope, current);
            running = null;
        }
        return current;
    }

    public synchronized void cancel() {
        cancelRunning();
        generation.incrementAndGet();
    }

    public boolean isCurrent(long candidate) {
        return generation.get() == candidate;
    }

    private void cancelRunning() {
        if (running != null && !running.isDone()) {
            running.cancel(true);
            log.info("HYDRATION_EVENT event=cancelled generation={}", generation.get());
        }
        running = null;
    }

    private void hydrate(long owner, PlaybackScope scope, List<String> paths, HydrationSink sink) {
        int hydrated = 0;
        List<TrackRecord> batch = new ArrayList<>(batchSize);
        for (String path : paths) {
            if (Thread.currentThread().isInterrupted() || !isCurrent(owner)) {
                log.info("HYDRATION_EVENT event=abandoned scope={} generation={} hydrated={}", scope, owner, hydrated);
                return;
            }
            TrackRecord record = readRecord(path);
            if (record != null) {
                batch.add(record);
                hydrated++;
            }
            if (batch.size() >= batchSize) {
                sink.accept(owner, scope, batch);
                batch = new ArrayList<>(batchSize);
            }
        }
        if (!batch.isEmpty() && isCurrent(owner)) {
            sink.accept(owner, scope, batch);
        }
        log.info("HYDRATION_EVENT event=finished scope={} generation={} hydrated={}", scope, owner, hydrated);
    }

    private TrackRecord readRecord(String path) {
        File file = new File(path);
        if (!file.isFile()) {
            return null;
        }
        try {
            AudioMetadata metadata = metadataParser.parse(file);
            TrackRecord record = TrackRecord.placeholder(path);
            if (metadata != null) {
                if (StringUtils.hasText(metadata.getTitle())) {
                    record.setTitle(metadata.getTitle());
                }
                record.setArtist(metadata.getArtist());
                record.setAlbum(metadata.getAlbum());
                record.setDurationSec(metadata.getDurationSec());
            }
            record.setHydrated(true);
            return record;
        } catch (Exception e) {
            // placeholder stays; its file-name title is still usable
            log.warn("HYDRATION_EVENT event=tag_read_failed path={} reason={}",
                    path, e.getClass().getSimpleName() + ": " + e.getMessage());
            return null;
        }
    }
}

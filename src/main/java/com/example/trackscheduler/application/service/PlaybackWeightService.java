package com.example.trackscheduler.application.service;

import com.example.trackscheduler.common.config.AppSchedulerProperties;
import com.example.trackscheduler.common.util.PathKeys;
import com.example.trackscheduler.domain.WeightLevel;
import com.example.trackscheduler.domain.model.PlaybackScope;
import com.example.trackscheduler.domain.model.WeightMutation;
import com.example.trackscheduler.domain.model.WeightSyncResult;
import com.example.trackscheduler.infrastructure.persistence.DebouncedFlusher;
import com.example.trackscheduler.infrastructure.persistence.WeightLevelsRepository;
import com.example.trackscheduler.infrastructure.persistence.model.WeightLevelsDocument;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Per-track weight levels, isolated per scope: one namespace for the queue and
 * one per playlist. Storage is sparse; a missing entry means
 * {@link WeightLevel#GREEN}.
 *
 * <p>All map access is serialized behind one lock. Every effective write bumps
 * {@link #revision()} and schedules a debounced save; bulk deletions save
 * immediately.
 */
@Service
public class PlaybackWeightService {

    private static final Logger log = LoggerFactory.getLogger(PlaybackWeightService.class);

    private final WeightLevelsRepository repository;
    private final PersistenceAdvisoryService advisoryService;
    private final MeterRegistry meterRegistry;
    private final DebouncedFlusher flusher;

    private final Object lock = new Object();
    private final AtomicLong revision = new AtomicLong();
    private boolean loaded;
    private final Map<String, Integer> queueLevels = new HashMap<>();
    private final Map<String, Map<String, Integer>> playlistLevels = new HashMap<>();

    public PlaybackWeightService(WeightLevelsRepository repository,
                                 PersistenceAdvisoryService advisoryService,
                                 @Qualifier("persistenceExecutor") ScheduledExecutorService persistenceExecutor,
                                 AppSchedulerProperties properties,
                                 ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.repository = repository;
        this.advisoryService = advisoryService;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
        this.flusher = new DebouncedFlusher("weights", persistenceExecutor,
                properties.getWeightFlushDebounceMs(), this::saveNow);
    }

    public WeightLevel level(String path, PlaybackScope scope) {
        loadIfNeeded();
        List<String> lookupKeys = PathKeys.lookupKeys(path);
        boolean migrated = false;
        Integer raw;
        synchronized (lock) {
            Map<String, Integer> levels = levelsFor(scope);
            PathKeys.Match<Integer> match = PathKeys.find(levels, lookupKeys);
            if (match == null) {
                return WeightLevel.GREEN;
            }
            raw = match.getValue();
            if (match.isLegacyHit()) {
                levels.remove(match.getMatchedKey());
                levels.put(match.getCanonicalKey(), raw);
                migrated = true;
            }
        }
        if (migrated) {
            log.info("WEIGHT_EVENT event=key_migrated scope={} key={}", scope, lookupKeys.get(0));
            flusher.schedule();
        }
        return WeightLevel.fromValue(raw);
    }

    public double multiplier(String path, PlaybackScope scope) {
        return level(path, scope).getMultiplier();
    }

    public WeightMutation setLevel(int rawLevel, String path, PlaybackScope scope) {
        loadIfNeeded();
        int clamped = WeightLevel.clamp(rawLevel);
        String key = PathKeys.canonical(path);
        boolean changed = false;
        synchronized (lock) {
            if (clamped == WeightLevel.GREEN.getValue()) {
                Map<String, Integer> levels = levelsFor(scope);
                if (levels != null && removeKeyVariants(key, levels)) {
                    changed = true;
                    dropIfEmpty(scope);
                }
            } else {
                Map<String, Integer> levels = levelsForWrite(scope);
                Integer current = levels.get(key);
                if (current == null || current != clamped) {
                    levels.put(key, clamped);
                    changed = true;
                }
                if (removeLegacyVariants(key, levels)) {
                    changed = true;
                }
            }
        }
        if (!changed) {
            return WeightMutation.unchanged();
        }
        log.info("WEIGHT_EVENT event=set_level scope={} key={} level={}", scope, key, clamped);
        return bumpAndSave(false);
    }

    /**
     * Drops every override of one scope and saves right away.
     */
    public WeightMutation clear(PlaybackScope scope) {
        loadIfNeeded();
        boolean changed;
        synchronized (lock) {
            if (scope.isQueue()) {
                changed = !queueLevels.isEmpty();
                queueLevels.clear();
            } else {
                changed = playlistLevels.remove(scope.getPlaylistId()) != null;
            }
        }
        if (!changed) {
            return WeightMutation.unchanged();
        }
        log.info("WEIGHT_EVENT event=clear_scope scope={}", scope);
        return bumpAndSave(true);
    }

    public WeightMutation clearAll() {
        loadIfNeeded();
        boolean changed;
        synchronized (lock) {
            changed = !queueLevels.isEmpty() || !playlistLevels.isEmpty();
            queueLevels.clear();
            playlistLevels.clear();
        }
        if (!changed) {
            return WeightMutation.unchanged();
        }
        log.info("WEIGHT_EVENT event=clear_all");
        return bumpAndSave(true);
    }

    public WeightMutation removePlaylist(String playlistId) {
        loadIfNeeded();
        boolean removed;
        synchronized (lock) {
            removed = playlistLevels.remove(playlistId) != null;
        }
        if (!removed) {
            return WeightMutation.unchanged();
        }
        log.info("WEIGHT_EVENT event=remove_playlist playlistId={}", playlistId);
        return bumpAndSave(true);
    }

    public WeightMutation removeTrack(String path, String playlistId) {
        loadIfNeeded();
        String key = PathKeys.canonical(path);
        PlaybackScope scope = PlaybackScope.playlist(playlistId);
        boolean removed = false;
        synchronized (lock) {
            Map<String, Integer> levels = playlistLevels.get(playlistId);
            if (levels != null && removeKeyVariants(key, levels)) {
                removed = true;
                dropIfEmpty(scope);
            }
        }
        if (!removed) {
            return WeightMutation.unchanged();
        }
        log.info("WEIGHT_EVENT event=remove_track playlistId={} key={}", playlistId, key);
        return bumpAndSave(true);
    }

    /**
     * Copies the playlist's non-default overrides into the queue namespace.
     * Queue entries the playlist leaves at default are not touched.
     */
    public WeightSyncResult syncOverridesToQueue(String playlistId) {
        loadIfNeeded();
        int total;
        int changed = 0;
        synchronized (lock) {
            Map<String, Integer> source = playlistLevels.get(playlistId);
            if (source == null || source.isEmpty()) {
                return new WeightSyncResult(0, 0);
            }
            total = source.size();
            for (Map.Entry<String, Integer> entry : source.entrySet()) {
                int clamped = WeightLevel.clamp(entry.getValue());
                if (clamped == WeightLevel.GREEN.getValue()) {
                    continue;
                }
                Integer current = queueLevels.get(entry.getKey());
                if (current == null || current != clamped) {
                    queueLevels.put(entry.getKey(), clamped);
                    changed++;
                }
            }
        }
        log.info("WEIGHT_EVENT event=sync_to_queue playlistId={} total={} changed={}", playlistId, total, changed);
        if (changed > 0) {
            bumpAndSave(false);
        }
        return new WeightSyncResult(total, changed);
    }

    /**
     * Non-default overrides of one scope, sorted by key.
     */
    public Map<String, WeightLevel> overrides(PlaybackScope scope) {
        loadIfNeeded();
        Map<String, WeightLevel> result = new TreeMap<>();
        synchronized (lock) {
            Map<String, Integer> levels = levelsFor(scope);
            if (levels != null) {
                for (Map.Entry<String, Integer> entry : levels.entrySet()) {
                    result.put(entry.getKey(), WeightLevel.fromValue(entry.getValue()));
                }
            }
        }
        return result;
    }

    public long revision() {
        return revision.get();
    }

    /**
     * Writes pending changes now instead of waiting for the debounce timer.
     */
    @PreDestroy
    public void flush() {
        synchronized (lock) {
            if (!loaded) {
                return;
            }
        }
        flusher.flushNow();
    }

    private WeightMutation bumpAndSave(boolean immediate) {
        long next = revision.incrementAndGet();
        if (immediate) {
            flusher.flushNow();
        } else {
            flusher.schedule();
        }
        return WeightMutation.changed(next);
    }

    private void loadIfNeeded() {
        boolean needsSave = false;
        synchronized (lock) {
            if (loaded) {
                return;
            }
            loaded = true;
            WeightLevelsDocument document = repository.load();
            if (document == null) {
                return;
            }
            Map<String, Integer> rawQueue = document.getQueueLevels() == null
                    ? new HashMap<String, Integer>()
                    : document.getQueueLevels();
            Map<String, Map<String, Integer>> rawPlaylists = document.getPlaylistLevels() == null
                    ? new HashMap<String, Map<String, Integer>>()
                    : document.getPlaylistLevels();

            Map<String, Integer> normalizedQueue = normalizeLevelMap(rawQueue);
            queueLevels.putAll(normalizedQueue);
            needsSave = !normalizedQueue.equals(rawQueue);
            for (Map.Entry<String, Map<String, Integer>> entry : rawPlaylists.entrySet()) {
                Map<String, Integer> raw = entry.getValue() == null ? new HashMap<String, Integer>() : entry.getValue();
                Map<String, Integer> normalized = normalizeLevelMap(raw);
                if (!normalized.isEmpty()) {
                    playlistLevels.put(entry.getKey(), normalized);
                }
                if (normalized.isEmpty() || !normalized.equals(raw)) {
                    needsSave = true;
                }
            }
            log.info("WEIGHT_EVENT event=loaded queueEntries={} playlists={} rewrite={}",
                    queueLevels.size(), playlistLevels.size(), needsSave);
        }
        if (needsSave) {
            flusher.schedule();
        }
    }

    private void saveNow() {
        WeightLevelsDocument document = new WeightLevelsDocument();
        document.setVersion(WeightLevelsDocument.CURRENT_VERSION);
        synchronized (lock) {
            document.setQueueLevels(new TreeMap<>(queueLevels));
            Map<String, Map<String, Integer>> playlists = new TreeMap<>();
            for (Map.Entry<String, Map<String, Integer>> entry : playlistLevels.entrySet()) {
                playlists.put(entry.getKey(), new TreeMap<>(entry.getValue()));
            }
            document.setPlaylistLevels(playlists);
        }
        try {
            repository.save(document);
            recordPersist("success");
        } catch (IOException | RuntimeException e) {
            recordPersist("failed");
            advisoryService.report("weights", "随机权重保存失败", "请检查磁盘权限或空间", e);
        }
    }

    private Map<String, Integer> levelsFor(PlaybackScope scope) {
        if (scope.isQueue()) {
            return queueLevels;
        }
        return playlistLevels.get(scope.getPlaylistId());
    }

    private Map<String, Integer> levelsForWrite(PlaybackScope scope) {
        if (scope.isQueue()) {
            return queueLevels;
        }
        return playlistLevels.computeIfAbsent(scope.getPlaylistId(), id -> new HashMap<>());
    }

    private void dropIfEmpty(PlaybackScope scope) {
        if (!scope.isQueue()) {
            Map<String, Integer> levels = playlistLevels.get(scope.getPlaylistId());
            if (levels != null && levels.isEmpty()) {
                playlistLevels.remove(scope.getPlaylistId());
            }
        }
    }

    private boolean removeKeyVariants(String key, Map<String, Integer> levels) {
        boolean removed = false;
        for (String variant : PathKeys.lookupKeys(key)) {
            if (levels.remove(variant) != null) {
                removed = true;
            }
        }
        return removed;
    }

    private boolean removeLegacyVariants(String canonicalKey, Map<String, Integer> levels) {
        boolean removed = false;
        for (String variant : PathKeys.lookupKeys(canonicalKey)) {
            if (!variant.equals(canonicalKey) && levels.remove(variant) != null) {
                removed = true;
            }
        }
        return removed;
    }

    private Map<String, Integer> normalizeLevelMap(Map<String, Integer> raw) {
        Map<String, Integer> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : raw.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            int clamped = WeightLevel.clamp(entry.getValue());
            if (clamped != WeightLevel.GREEN.getValue()) {
                normalized.put(PathKeys.canonical(entry.getKey()), clamped);
            }
        }
        return normalized;
    }

    private void recordPersist(String outcome) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("music.weights.persist", "outcome", outcome).increment();
        } catch (Exception ex) {
            log.debug("Weight persist metric failed, outcome={}", outcome, ex);
        }
    }
}

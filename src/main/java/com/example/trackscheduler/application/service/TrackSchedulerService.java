package com.example.trackscheduler.application.service;

import com.example.trackscheduler.common.exception.BusinessException;
import com.example.trackscheduler.common.logging.TraceIds;
import com.example.trackscheduler.domain.PlaybackMode;
import com.example.trackscheduler.domain.WeightLevel;
import com.example.trackscheduler.domain.model.MemberDelta;
import com.example.trackscheduler.domain.model.PlaybackScope;
import com.example.trackscheduler.domain.model.ScopeRestoration;
import com.example.trackscheduler.domain.model.TrackRecord;
import com.example.trackscheduler.domain.model.TrackSelection;
import com.example.trackscheduler.domain.model.WeightMutation;
import com.example.trackscheduler.domain.model.WeightSyncResult;
import com.example.trackscheduler.domain.shuffle.ShufflePopulation;
import com.example.trackscheduler.domain.shuffle.WeightedShuffleEngine;
import com.example.trackscheduler.infrastructure.library.PlaylistStore;
import com.example.trackscheduler.infrastructure.library.TrackCollection;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Decides which track plays next. Owns the physical collection, the shuffle
 * engine and the current-track pointer; every public method is synchronized,
 * so no two threads ever walk or patch the shuffle state at once.
 *
 * <p>Selections that find nothing playable return {@code null}. Only invalid
 * caller input raises {@link BusinessException}.
 */
@Service
public class TrackSchedulerService {

    private static final Logger log = LoggerFactory.getLogger(TrackSchedulerService.class);

    private final TrackCollection collection;
    private final PlaylistStore playlistStore;
    private final PlaybackWeightService weights;
    private final UnplayableTrackService unplayable;
    private final PlaybackScopeService scopeService;
    private final ScopeHydrationService hydration;
    private final MeterRegistry meterRegistry;
    private final WeightedShuffleEngine engine;

    private int currentIndex = -1;
    private long observedWeightRevision;

    @Autowired
    public TrackSchedulerService(TrackCollection collection,
                                 PlaylistStore playlistStore,
                                 PlaybackWeightService weights,
                                 UnplayableTrackService unplayable,
                                 PlaybackScopeService scopeService,
                                 ScopeHydrationService hydration,
                                 ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(collection, playlistStore, weights, unplayable, scopeService, hydration, meterRegistryProvider,
                new Random());
    }

    TrackSchedulerService(TrackCollection collection,
                          PlaylistStore playlistStore,
                          PlaybackWeightService weights,
                          UnplayableTrackService unplayable,
                          PlaybackScopeService scopeService,
                          ScopeHydrationService hydration,
                          ObjectProvider<MeterRegistry> meterRegistryProvider,
                          Random random) {
        this.collection = collection;
        this.playlistStore = playlistStore;
        this.weights = weights;
        this.unplayable = unplayable;
        this.scopeService = scopeService;
        this.hydration = hydration;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
        this.engine = new WeightedShuffleEngine(random);
        this.observedWeightRevision = weights.revision();
    }

    // ---- selection ----

    public synchronized TrackSelection next(PlaybackMode mode) {
        PlaybackMode resolved = requireMode(mode);
        return measure("next", resolved, () -> resolved == PlaybackMode.RANDOM
                ? randomForward(true)
                : sequential(1, true));
    }

    public synchronized TrackSelection previous(PlaybackMode mode) {
        PlaybackMode resolved = requireMode(mode);
        return measure("previous", resolved, () -> resolved == PlaybackMode.RANDOM
                ? randomBackward()
                : sequential(-1, true));
    }

    /**
     * What {@link #next} would return, without committing it.
     */
    public synchronized TrackSelection peekNext(PlaybackMode mode) {
        PlaybackMode resolved = requireMode(mode);
        return measure("peek", resolved, () -> resolved == PlaybackMode.RANDOM
                ? randomForward(false)
                : sequential(1, false));
    }

    public synchronized TrackSelection selectAt(int index) {
        if (collection.get(index) == null) {
            throw BusinessException.badRequest("曲目索引超出范围");
        }
        return measure("select_at", null, () -> select(index));
    }

    /**
     * Selects the record stored under {@code path}'s key.
     */
    public synchronized TrackSelection selectPath(String path) {
        requirePath(path);
        Integer index = collection.indexOfKey(path);
        if (index == null) {
            throw BusinessException.notFound("曲目不在播放队列中");
        }
        return measure("select_path", null, () -> select(index));
    }

    /**
     * First playable track of the active scope in scope order, ignoring the
     * current pointer.
     */
    public synchronized TrackSelection startSequential() {
        return measure("start", PlaybackMode.SEQUENTIAL, () -> sequential(1, true, true));
    }

    /**
     * Starts a fresh weighted shuffle and plays its first playable track.
     */
    public synchronized TrackSelection randomFirst() {
        return measure("random_first", PlaybackMode.RANDOM, () -> {
            syncWeightRevision();
            String key = engine.randomStart(new ScopePopulation());
            return selectKey(key);
        });
    }

    /**
     * One weighted draw that never returns the current track. Needs at least
     * two playable candidates; the shuffle order is left as it was.
     */
    public synchronized TrackSelection randomExcludingCurrent() {
        return measure("random_excluding_current", PlaybackMode.RANDOM, () -> {
            if (playableCount() < 2) {
                return null;
            }
            String key = engine.randomExcludingCurrent(new ScopePopulation(), currentKey());
            return selectKey(key);
        });
    }

    public synchronized TrackSelection nowPlaying() {
        TrackRecord record = collection.get(currentIndex);
        if (record == null) {
            return null;
        }
        return new TrackSelection(currentIndex, record, scopeService.currentScope());
    }

    /**
     * Members of the active scope that resolve to a record and are not marked
     * unplayable.
     */
    public synchronized int playableCount() {
        int count = 0;
        for (String key : new ScopePopulation().candidateKeys()) {
            if (resolveSelectable(key) != null) {
                count++;
            }
        }
        return count;
    }

    // ---- scope ----

    public synchronized PlaybackScope currentScope() {
        return scopeService.currentScope();
    }

    public synchronized void setScopeQueue() {
        if (scopeService.setScopeQueue()) {
            hydration.cancel();
            engine.invalidate();
            log.info("SCHEDULER_EVENT event=scope_switched scope=queue traceId={}", TraceIds.current());
        }
    }

    /**
     * Activates a playlist: members missing from the collection are added as
     * placeholders and their tags are read in the background.
     *
     * @return number of members in the new scope
     */
    public synchronized int setScopePlaylist(String playlistId) {
        if (!StringUtils.hasText(playlistId)) {
            throw BusinessException.badRequest("歌单ID不能为空");
        }
        List<String> members = playlistStore.membersInOrder(playlistId);
        if (members == null) {
            throw BusinessException.notFound("歌单不存在");
        }
        appendPlaceholders(members);
        scopeService.setScopePlaylist(playlistId, members);
        engine.invalidate();
        startHydration(PlaybackScope.playlist(playlistId), members);
        log.info("SCHEDULER_EVENT event=scope_switched scope=playlist playlistId={} members={} traceId={}",
                playlistId, members.size(), TraceIds.current());
        return members.size();
    }

    /**
     * Re-reads the playlist's members after it was edited. When it is the
     * active scope, the live shuffle is patched with the key delta.
     */
    public synchronized void playlistMembersChanged(String playlistId) {
        if (!scopeService.currentScope().isPlaylist(playlistId)) {
            return;
        }
        List<String> members = playlistStore.membersInOrder(playlistId);
        if (members == null) {
            playlistDeleted(playlistId);
            return;
        }
        appendPlaceholders(members);
        MemberDelta delta = scopeService.updateScopeMembersIfActive(playlistId, members);
        if (delta != null && !delta.isEmpty()) {
            engine.integrate(new ScopePopulation(), delta.getAddedKeys(), delta.getRemovedKeys());
        }
    }

    public synchronized void playlistDeleted(String playlistId) {
        if (scopeService.currentScope().isPlaylist(playlistId)) {
            log.info("SCHEDULER_EVENT event=active_playlist_deleted playlistId={} fallback=queue traceId={}",
                    playlistId, TraceIds.current());
            setScopeQueue();
        }
    }

    /**
     * Restores the saved scope and current-track pointer at startup.
     */
    public synchronized void restore() {
        ScopeRestoration restoration = scopeService.restore();
        engine.invalidate();
        PlaybackScope scope = restoration.getScope();
        if (!scope.isQueue()) {
            appendPlaceholders(restoration.getMemberPaths());
            startHydration(scope, restoration.getMemberPaths());
        }
        Integer index = restoration.getCurrentKey() == null
                ? null
                : collection.indexOfKey(restoration.getCurrentKey());
        currentIndex = index == null ? -1 : index;
        log.info("SCHEDULER_EVENT event=restored scope={} currentIndex={}", scope, currentIndex);
    }

    // ---- collection ----

    public synchronized List<TrackRecord> queue() {
        return collection.allRecords();
    }

    /**
     * Appends the paths not yet in the collection.
     *
     * @return index of {@code focusPath} after the append, or {@code null}
     */
    public synchronized Integer ensureInQueue(List<String> paths, String focusPath) {
        List<TrackRecord> records = new ArrayList<>();
        if (paths != null) {
            for (String path : paths) {
                if (StringUtils.hasText(path)) {
                    records.add(TrackRecord.placeholder(path));
                }
            }
        }
        addTracks(records);
        return StringUtils.hasText(focusPath) ? collection.indexOfKey(focusPath) : null;
    }

    /**
     * Appends records and folds them into the live shuffle: always in queue
     * scope, and in playlist scope only for members of the active playlist.
     *
     * @return indices of the records actually appended
     */
    public synchronized List<Integer> addTracks(List<TrackRecord> records) {
        List<Integer> appended = collection.append(records);
        if (appended.isEmpty()) {
            return appended;
        }
        boolean queueScope = scopeService.currentScope().isQueue();
        List<String> added = new ArrayList<>();
        for (Integer index : appended) {
            String key = collection.get(index).canonicalKey();
            if (queueScope || scopeService.isMember(key)) {
                added.add(key);
            }
        }
        if (!added.isEmpty()) {
            engine.integrate(new ScopePopulation(), added, Collections.<String>emptyList());
        }
        log.info("SCHEDULER_EVENT event=tracks_added count={} integrated={} traceId={}",
                appended.size(), added.size(), TraceIds.current());
        return appended;
    }

    public synchronized TrackRecord removeTrack(int index) {
        TrackRecord removed = collection.remove(index);
        if (removed == null) {
            throw BusinessException.notFound("曲目不存在");
        }
        String key = removed.canonicalKey();
        unplayable.clear(removed.getPath());
        engine.integrate(new ScopePopulation(), Collections.<String>emptyList(), Collections.singletonList(key));

        if (currentIndex > index) {
            currentIndex--;
        } else if (currentIndex == index) {
            currentIndex = index - 1;
        }
        if (collection.isEmpty()) {
            currentIndex = -1;
            engine.invalidate();
            if (scopeService.setScopeQueue()) {
                hydration.cancel();
            }
        }
        rememberCurrent();
        log.info("SCHEDULER_EVENT event=track_removed index={} key={} currentIndex={} traceId={}",
                index, key, currentIndex, TraceIds.current());
        return removed;
    }

    public synchronized void clearQueue() {
        collection.clear();
        unplayable.clearAll();
        engine.invalidate();
        hydration.cancel();
        scopeService.setScopeQueue();
        currentIndex = -1;
        rememberCurrent();
        log.info("SCHEDULER_EVENT event=queue_cleared traceId={}", TraceIds.current());
    }

    // ---- playability ----

    /**
     * Playback of {@code path} failed. A newly marked track drops out of every
     * future selection.
     */
    public synchronized boolean markUnplayable(String path, String reason) {
        requirePath(path);
        boolean changed = unplayable.mark(path, reason);
        if (changed) {
            engine.invalidate();
        }
        return changed;
    }

    /**
     * Playback of {@code path} succeeded.
     */
    public synchronized boolean markPlayable(String path) {
        requirePath(path);
        boolean changed = unplayable.clear(path);
        if (changed) {
            engine.invalidate();
        }
        return changed;
    }

    public String unplayableReason(String path) {
        return unplayable.reason(path);
    }

    // ---- weights ----

    public WeightLevel weightLevel(String path, PlaybackScope scope) {
        requirePath(path);
        return weights.level(path, scope);
    }

    public synchronized WeightMutation setWeightLevel(int level, String path, PlaybackScope scope) {
        requirePath(path);
        WeightMutation mutation = weights.setLevel(level, path, scope);
        applyWeightMutation(mutation);
        return mutation;
    }

    public synchronized WeightMutation clearWeights(PlaybackScope scope) {
        WeightMutation mutation = weights.clear(scope);
        applyWeightMutation(mutation);
        return mutation;
    }

    /**
     * Drops every queue and playlist override.
     */
    public synchronized WeightMutation clearAllWeights() {
        WeightMutation mutation = weights.clearAll();
        applyWeightMutation(mutation);
        log.info("SCHEDULER_EVENT event=weights_cleared scope=all changed={} traceId={}",
                mutation.isChanged(), TraceIds.current());
        return mutation;
    }

    public synchronized WeightSyncResult syncWeightsToQueue(String playlistId) {
        if (playlistStore.find(playlistId) == null) {
            throw BusinessException.notFound("歌单不存在");
        }
        WeightSyncResult result = weights.syncOverridesToQueue(playlistId);
        if (result.getChanged() > 0) {
            engine.invalidate();
            observedWeightRevision = weights.revision();
        }
        return result;
    }

    // ---- hydration ----

    synchronized void applyHydration(long generation, PlaybackScope scope, List<TrackRecord> batch) {
        if (!hydration.isCurrent(generation) || !scope.equals(scopeService.currentScope())) {
            log.info("HYDRATION_EVENT event=batch_discarded scope={} generation={} size={}",
                    scope, generation, batch.size());
            return;
        }
        int updated = 0;
        for (TrackRecord record : batch) {
            if (collection.update(record)) {
                updated++;
            }
        }
        log.debug("HYDRATION_EVENT event=batch_applied scope={} generation={} updated={}", scope, generation, updated);
    }

    private void startHydration(PlaybackScope scope, List<String> memberPaths) {
        List<String> pending = new ArrayList<>();
        for (String path : memberPaths) {
            Integer index = collection.indexOfKey(path);
            TrackRecord record = index == null ? null : collection.get(index);
            if (record != null && !record.isHydrated()) {
                pending.add(record.getPath());
            }
        }
        hydration.start(scope, pending, this::applyHydration);
    }

    private void appendPlaceholders(List<String> paths) {
        List<TrackRecord> placeholders = new ArrayList<>();
        for (String path : paths) {
            placeholders.add(TrackRecord.placeholder(path));
        }
        collection.append(placeholders);
    }

    // ---- internals ----

    private TrackSelection sequential(int direction, boolean commit) {
        return sequential(direction, commit, false);
    }

    private TrackSelection sequential(int direction, boolean commit, boolean fromStart) {
        PlaybackScope scope = scopeService.currentScope();
        if (scope.isQueue()) {
            int size = collection.size();
            if (size == 0) {
                return null;
            }
            int base = !fromStart && currentIndex >= 0 && currentIndex < size
                    ? currentIndex
                    : (direction > 0 ? -1 : 0);
            for (int step = 1; step <= size; step++) {
                int index = Math.floorMod(base + direction * step, size);
                TrackRecord record = collection.get(index);
                if (record != null && !unplayable.isUnplayable(record.getPath())) {
                    return commit ? select(index) : new TrackSelection(index, record, scope);
                }
            }
            return null;
        }

        List<String> keys = scopeService.trackKeys();
        int size = keys.size();
        if (size == 0) {
            return null;
        }
        String current = fromStart ? null : currentKey();
        Integer position = current == null ? null : scopeService.currentPosition(current);
        int base = position != null ? position : (direction > 0 ? -1 : 0);
        for (int step = 1; step <= size; step++) {
            Integer index = resolveSelectable(keys.get(Math.floorMod(base + direction * step, size)));
            if (index != null) {
                return commit ? select(index) : new TrackSelection(index, collection.get(index), scope);
            }
        }
        return null;
    }

    private TrackSelection randomForward(boolean commit) {
        syncWeightRevision();
        ScopePopulation population = new ScopePopulation();
        String key = commit ? engine.next(population, currentKey()) : engine.peek(population, currentKey());
        if (key == null) {
            return null;
        }
        if (commit) {
            return selectKey(key);
        }
        Integer index = collection.indexOfKey(key);
        return index == null ? null : new TrackSelection(index, collection.get(index), population.scope);
    }

    private TrackSelection randomBackward() {
        syncWeightRevision();
        return selectKey(engine.previous(new ScopePopulation()));
    }

    private TrackSelection selectKey(String key) {
        if (key == null) {
            return null;
        }
        Integer index = collection.indexOfKey(key);
        return index == null ? null : select(index);
    }

    private TrackSelection select(int index) {
        currentIndex = index;
        rememberCurrent();
        return new TrackSelection(index, collection.get(index), scopeService.currentScope());
    }

    private void rememberCurrent() {
        TrackRecord record = collection.get(currentIndex);
        if (record == null) {
            scopeService.rememberCurrent(null, null);
        } else {
            scopeService.rememberCurrent(record.canonicalKey(), currentIndex);
        }
    }

    private String currentKey() {
        TrackRecord record = collection.get(currentIndex);
        return record == null ? null : record.canonicalKey();
    }

    private Integer resolveSelectable(String key) {
        Integer index = collection.indexOfKey(key);
        if (index == null) {
            return null;
        }
        // Marks are made against the record's own path, which may differ in case from the member key.
        TrackRecord record = collection.get(index);
        return record == null || unplayable.isUnplayable(record.getPath()) ? null : index;
    }

    // Weight edits made outside this class (playlist cleanup) show up as a revision bump.
    private void syncWeightRevision() {
        long revision = weights.revision();
        if (revision != observedWeightRevision) {
            engine.invalidate();
            observedWeightRevision = revision;
        }
    }

    private void applyWeightMutation(WeightMutation mutation) {
        if (mutation.isChanged()) {
            engine.invalidate();
            observedWeightRevision = weights.revision();
        }
    }

    private PlaybackMode requireMode(PlaybackMode mode) {
        if (mode == null) {
            throw BusinessException.badRequest("不支持的播放模式");
        }
        return mode;
    }

    private void requirePath(String path) {
        if (!StringUtils.hasText(path)) {
            throw BusinessException.badRequest("曲目路径不能为空");
        }
    }

    private TrackSelection measure(String op, PlaybackMode mode, Supplier<TrackSelection> action) {
        String modeTag = mode == null ? "direct" : mode.getValue();
        long startedAtNanos = System.nanoTime();
        try {
            TrackSelection selection = action.get();
            String outcome = selection == null ? "no_candidate" : "selected";
            recordCounter("music.scheduler.selection", "op", op, "mode", modeTag, "outcome", outcome);
            if (selection == null) {
                log.info("SCHEDULER_EVENT event=selection op={} mode={} scope={} outcome={} traceId={}",
                        op, modeTag, scopeService.currentScope(), outcome, TraceIds.current());
            } else {
                log.info("SCHEDULER_EVENT event=selection op={} mode={} scope={} outcome={} index={} key={} traceId={}",
                        op, modeTag, selection.getScope(), outcome, selection.getIndex(),
                        selection.getRecord().canonicalKey(), TraceIds.current());
            }
            return selection;
        } catch (RuntimeException e) {
            recordCounter("music.scheduler.selection", "op", op, "mode", modeTag, "outcome", "failed");
            throw e;
        } finally {
            recordDuration("music.scheduler.selection.latency", System.nanoTime() - startedAtNanos);
        }
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Scheduler metric counter failed, name={}", name, ex);
        }
    }

    private void recordDuration(String name, long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Scheduler metric timer failed, name={}", name, ex);
        }
    }

    /**
     * Candidate pool of the scope active when it was created.
     */
    private final class ScopePopulation implements ShufflePopulation {

        private final PlaybackScope scope = scopeService.currentScope();

        @Override
        public List<String> candidateKeys() {
            if (!scope.isQueue()) {
                return scopeService.trackKeys();
            }
            List<TrackRecord> records = collection.allRecords();
            List<String> keys = new ArrayList<>(records.size());
            for (TrackRecord record : records) {
                keys.add(record.canonicalKey());
            }
            return keys;
        }

        @Override
        public boolean isSelectable(String key) {
            return resolveSelectable(key) != null;
        }

        @Override
        public double weightOf(String key) {
            return weights.multiplier(key, scope);
        }
    }
}

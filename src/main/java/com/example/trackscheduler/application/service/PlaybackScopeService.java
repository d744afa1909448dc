package com.example.trackscheduler.application.service;

import com.example.trackscheduler.common.config.AppSchedulerProperties;
import com.example.trackscheduler.common.util.PathKeys;
import com.example.trackscheduler.domain.ScopeKind;
import com.example.trackscheduler.domain.model.MemberDelta;
import com.example.trackscheduler.domain.model.PlaybackScope;
import com.example.trackscheduler.domain.model.ScopeRestoration;
import com.example.trackscheduler.infrastructure.library.PlaylistStore;
import com.example.trackscheduler.infrastructure.persistence.DebouncedFlusher;
import com.example.trackscheduler.infrastructure.persistence.ScopeSelectionRepository;
import com.example.trackscheduler.infrastructure.persistence.model.ScopeSelectionDocument;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Holds the active playback scope. For a playlist scope it also keeps the
 * ordered member keys and their positions, so sequential navigation never
 * has to consult the playlist store.
 *
 * <p>The scope selector and the current-track pointer are saved together,
 * debounced.
 */
@Service
public class PlaybackScopeService {

    private static final Logger log = LoggerFactory.getLogger(PlaybackScopeService.class);

    private final ScopeSelectionRepository repository;
    private final PlaylistStore playlistStore;
    private final PersistenceAdvisoryService advisoryService;
    private final DebouncedFlusher flusher;

    private PlaybackScope scope = PlaybackScope.queue();
    private List<String> trackKeys = Collections.emptyList();
    private Map<String, Integer> positionByKey = Collections.emptyMap();
    private String currentKey;
    private Integer currentIndex;

    public PlaybackScopeService(ScopeSelectionRepository repository,
                                PlaylistStore playlistStore,
                                PersistenceAdvisoryService advisoryService,
                                @Qualifier("persistenceExecutor") ScheduledExecutorService persistenceExecutor,
                                AppSchedulerProperties properties) {
        this.repository = repository;
        this.playlistStore = playlistStore;
        this.advisoryService = advisoryService;
        this.flusher = new DebouncedFlusher("scope", persistenceExecutor,
                properties.getScopeFlushDebounceMs(), this::saveNow);
    }

    public synchronized PlaybackScope currentScope() {
        return scope;
    }

    /**
     * @return true when the scope actually changed
     */
    public boolean setScopeQueue() {
        synchronized (this) {
            if (scope.isQueue()) {
                return false;
            }
            scope = PlaybackScope.queue();
            trackKeys = Collections.emptyList();
            positionByKey = Collections.emptyMap();
        }
        log.info("SCOPE_EVENT event=switch kind=queue");
        flusher.schedule();
        return true;
    }

    /**
     * Activates a playlist scope with the given member order. Always replaces
     * the member list, even when the playlist was already active.
     */
    public void setScopePlaylist(String playlistId, List<String> orderedMemberPaths) {
        PlaybackScope next = PlaybackScope.playlist(playlistId);
        int size;
        synchronized (this) {
            scope = next;
            replaceMembers(orderedMemberPaths);
            size = trackKeys.size();
        }
        log.info("SCOPE_EVENT event=switch kind=playlist playlistId={} members={}", playlistId, size);
        flusher.schedule();
    }

    /**
     * Replaces the member list if {@code playlistId} is the active scope.
     *
     * @return the key delta against the previous members, or {@code null}
     *         when another scope is active
     */
    public synchronized MemberDelta updateScopeMembersIfActive(String playlistId, List<String> orderedMemberPaths) {
        if (!scope.isPlaylist(playlistId)) {
            return null;
        }
        Set<String> before = new LinkedHashSet<>(trackKeys);
        replaceMembers(orderedMemberPaths);
        Set<String> after = new LinkedHashSet<>(trackKeys);

        List<String> added = new ArrayList<>();
        for (String key : after) {
            if (!before.contains(key)) {
                added.add(key);
            }
        }
        List<String> removed = new ArrayList<>();
        for (String key : before) {
            if (!after.contains(key)) {
                removed.add(key);
            }
        }
        log.info("SCOPE_EVENT event=members_updated playlistId={} added={} removed={}",
                playlistId, added.size(), removed.size());
        return new MemberDelta(added, removed);
    }

    public synchronized List<String> trackKeys() {
        return trackKeys;
    }

    /**
     * Position of the member in the active playlist, matched by lookup key.
     *
     * @return {@code null} in queue scope or when the key is not a member
     */
    public synchronized Integer currentPosition(String key) {
        if (scope.isQueue() || key == null) {
            return null;
        }
        PathKeys.Match<Integer> match = PathKeys.find(positionByKey, PathKeys.lookupKeys(key));
        return match == null ? null : match.getValue();
    }

    public boolean isMember(String key) {
        return currentPosition(key) != null;
    }

    /**
     * Records the current track so a restart resumes at the same place.
     */
    public void rememberCurrent(String key, Integer index) {
        synchronized (this) {
            currentKey = key;
            currentIndex = index;
        }
        flusher.schedule();
    }

    /**
     * Re-derives the scope saved on disk. A playlist that no longer exists or
     * has no resolvable members falls back to the queue.
     */
    public ScopeRestoration restore() {
        ScopeSelectionDocument document = repository.load();
        if (document == null) {
            return new ScopeRestoration(PlaybackScope.queue(), null, null);
        }
        String savedKey = StringUtils.hasText(document.getCurrentKey())
                ? PathKeys.canonical(document.getCurrentKey())
                : null;
        synchronized (this) {
            currentKey = savedKey;
            currentIndex = document.getCurrentIndex();
        }
        ScopeKind kind = ScopeKind.fromValue(document.getKind());
        if (kind != ScopeKind.PLAYLIST || !StringUtils.hasText(document.getPlaylistId())) {
            return new ScopeRestoration(PlaybackScope.queue(), null, savedKey);
        }

        String playlistId = document.getPlaylistId();
        List<String> members = playlistStore.membersInOrder(playlistId);
        if (members == null || members.isEmpty()) {
            log.warn("SCOPE_EVENT event=restore_fallback playlistId={} reason={}",
                    playlistId, members == null ? "playlist_missing" : "no_members");
            setScopeQueue();
            flusher.schedule();
            return new ScopeRestoration(PlaybackScope.queue(), null, savedKey);
        }
        setScopePlaylist(playlistId, members);
        log.info("SCOPE_EVENT event=restored playlistId={} members={}", playlistId, members.size());
        return new ScopeRestoration(PlaybackScope.playlist(playlistId), members, savedKey);
    }

    @PreDestroy
    public void flush() {
        flusher.flushNow();
    }

    private void replaceMembers(List<String> orderedMemberPaths) {
        List<String> keys = new ArrayList<>();
        Map<String, Integer> positions = new HashMap<>();
        if (orderedMemberPaths != null) {
            for (String path : orderedMemberPaths) {
                if (!StringUtils.hasText(path)) {
                    continue;
                }
                String key = PathKeys.canonical(path);
                if (PathKeys.find(positions, PathKeys.lookupKeys(key)) != null) {
                    continue;
                }
                positions.put(key, keys.size());
                keys.add(key);
            }
        }
        trackKeys = Collections.unmodifiableList(keys);
        positionByKey = positions;
    }

    private void saveNow() {
        ScopeSelectionDocument document;
        synchronized (this) {
            document = new ScopeSelectionDocument(
                    scope.getKind().getValue(),
                    scope.getPlaylistId(),
                    currentKey,
                    currentIndex);
        }
        try {
            repository.save(document);
        } catch (IOException | RuntimeException e) {
            advisoryService.report("scope", "播放范围保存失败", "请检查磁盘权限或空间", e);
        }
    }
}

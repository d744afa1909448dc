package com.example.trackscheduler.infrastructure.library;

import com.example.trackscheduler.application.service.PersistenceAdvisoryService;
import com.example.trackscheduler.common.config.AppSchedulerProperties;
import com.example.trackscheduler.common.util.PathKeys;
import com.example.trackscheduler.domain.model.UserPlaylist;
import com.example.trackscheduler.infrastructure.persistence.DebouncedFlusher;
import com.example.trackscheduler.infrastructure.persistence.PlaylistsRepository;
import com.example.trackscheduler.infrastructure.persistence.model.PlaylistsDocument;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Predicate;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Playlists kept in creation order and saved to playlists.json, debounced.
 * The file is read on first access.
 */
@Component
public class PersistentPlaylistStore implements PlaylistStore {

    private static final Logger log = LoggerFactory.getLogger(PersistentPlaylistStore.class);

    private final Map<String, UserPlaylist> playlists = new LinkedHashMap<>();
    private final PlaylistsRepository repository;
    private final PersistenceAdvisoryService advisoryService;
    private final DebouncedFlusher flusher;
    private final Predicate<String> pathExists;
    private final Clock clock;
    private boolean loaded;

    @Autowired
    public PersistentPlaylistStore(PlaylistsRepository repository,
                                   PersistenceAdvisoryService advisoryService,
                                   @Qualifier("persistenceExecutor") ScheduledExecutorService persistenceExecutor,
                                   AppSchedulerProperties properties) {
        this(repository, advisoryService, persistenceExecutor, properties.getLibraryFlushDebounceMs(),
                properties.isVerifyMemberPaths() ? PersistentPlaylistStore::existsOnDisk : path -> true,
                Clock.systemUTC());
    }

    PersistentPlaylistStore(PlaylistsRepository repository,
                            PersistenceAdvisoryService advisoryService,
                            ScheduledExecutorService persistenceExecutor,
                            long flushDebounceMs,
                            Predicate<String> pathExists,
                            Clock clock) {
        this.repository = repository;
        this.advisoryService = advisoryService;
        this.flusher = new DebouncedFlusher("playlists", persistenceExecutor, flushDebounceMs, this::saveNow);
        this.pathExists = pathExists;
        this.clock = clock;
    }

    @Override
    public synchronized List<UserPlaylist> listPlaylists() {
        loadIfNeeded();
        List<UserPlaylist> result = new ArrayList<>(playlists.size());
        for (UserPlaylist playlist : playlists.values()) {
            result.add(playlist.copy());
        }
        return result;
    }

    @Override
    public synchronized UserPlaylist find(String playlistId) {
        loadIfNeeded();
        UserPlaylist playlist = playlistId == null ? null : playlists.get(playlistId);
        return playlist == null ? null : playlist.copy();
    }

    @Override
    public synchronized List<String> membersInOrder(String playlistId) {
        loadIfNeeded();
        UserPlaylist playlist = playlistId == null ? null : playlists.get(playlistId);
        if (playlist == null) {
            return null;
        }
        List<String> members = new ArrayList<>(playlist.getTrackPaths().size());
        for (String path : playlist.getTrackPaths()) {
            if (pathExists.test(path)) {
                members.add(path);
            }
        }
        return members;
    }

    @Override
    public synchronized UserPlaylist create(String name, List<String> trackPaths) {
        loadIfNeeded();
        Instant now = clock.instant();
        UserPlaylist playlist = new UserPlaylist();
        playlist.setId(UUID.randomUUID().toString());
        playlist.setName(name);
        playlist.setCreatedAt(now);
        playlist.setUpdatedAt(now);
        appendDistinct(playlist.getTrackPaths(), trackPaths);
        playlists.put(playlist.getId(), playlist);
        flusher.schedule();
        return playlist.copy();
    }

    @Override
    public synchronized UserPlaylist rename(String playlistId, String name) {
        loadIfNeeded();
        UserPlaylist playlist = playlists.get(playlistId);
        if (playlist == null) {
            return null;
        }
        playlist.setName(name);
        playlist.setUpdatedAt(clock.instant());
        flusher.schedule();
        return playlist.copy();
    }

    @Override
    public synchronized boolean delete(String playlistId) {
        loadIfNeeded();
        if (playlistId == null || playlists.remove(playlistId) == null) {
            return false;
        }
        flusher.schedule();
        return true;
    }

    @Override
    public synchronized List<String> addTracks(String playlistId, List<String> trackPaths) {
        loadIfNeeded();
        UserPlaylist playlist = playlists.get(playlistId);
        if (playlist == null) {
            return null;
        }
        List<String> added = appendDistinct(playlist.getTrackPaths(), trackPaths);
        if (!added.isEmpty()) {
            playlist.setUpdatedAt(clock.instant());
            flusher.schedule();
        }
        return added;
    }

    @Override
    public synchronized String removeTrack(String playlistId, String trackPath) {
        loadIfNeeded();
        UserPlaylist playlist = playlists.get(playlistId);
        if (playlist == null || trackPath == null) {
            return null;
        }
        Iterator<String> iterator = playlist.getTrackPaths().iterator();
        while (iterator.hasNext()) {
            String member = iterator.next();
            if (PathKeys.sameTrack(member, trackPath)) {
                iterator.remove();
                playlist.setUpdatedAt(clock.instant());
                flusher.schedule();
                return member;
            }
        }
        return null;
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

    private void loadIfNeeded() {
        if (loaded) {
            return;
        }
        loaded = true;
        PlaylistsDocument document = repository.load();
        if (document == null || document.getPlaylists() == null) {
            return;
        }
        int skipped = 0;
        for (PlaylistsDocument.Entry entry : document.getPlaylists()) {
            if (entry == null || !StringUtils.hasText(entry.getId()) || playlists.containsKey(entry.getId())) {
                skipped++;
                continue;
            }
            UserPlaylist playlist = new UserPlaylist();
            playlist.setId(entry.getId());
            playlist.setName(entry.getName());
            playlist.setCreatedAt(toInstant(entry.getCreatedAt()));
            playlist.setUpdatedAt(toInstant(entry.getUpdatedAt()));
            appendDistinct(playlist.getTrackPaths(), entry.getTrackPaths());
            playlists.put(playlist.getId(), playlist);
        }
        log.info("PLAYLIST_EVENT event=loaded playlists={} skipped={}", playlists.size(), skipped);
    }

    private void saveNow() {
        PlaylistsDocument document = new PlaylistsDocument();
        document.setVersion(PlaylistsDocument.CURRENT_VERSION);
        synchronized (this) {
            for (UserPlaylist playlist : playlists.values()) {
                document.getPlaylists().add(new PlaylistsDocument.Entry(
                        playlist.getId(),
                        playlist.getName(),
                        new ArrayList<>(playlist.getTrackPaths()),
                        toMillis(playlist.getCreatedAt()),
                        toMillis(playlist.getUpdatedAt())));
            }
        }
        try {
            repository.save(document);
        } catch (IOException | RuntimeException e) {
            advisoryService.report("playlists", "歌单保存失败", "请检查磁盘权限或空间", e);
        }
    }

    private Instant toInstant(Long millis) {
        return millis == null ? clock.instant() : Instant.ofEpochMilli(millis);
    }

    private static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private List<String> appendDistinct(List<String> target, List<String> paths) {
        List<String> added = new ArrayList<>();
        if (paths == null) {
            return added;
        }
        for (String raw : paths) {
            if (raw == null || raw.trim().isEmpty()) {
                continue;
            }
            String path = PathKeys.canonical(raw.trim());
            boolean present = false;
            for (String member : target) {
                if (PathKeys.sameTrack(member, path)) {
                    present = true;
                    break;
                }
            }
            if (!present) {
                target.add(path);
                added.add(path);
            }
        }
        return added;
    }

    private static boolean existsOnDisk(String path) {
        try {
            return Files.exists(Paths.get(path));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}

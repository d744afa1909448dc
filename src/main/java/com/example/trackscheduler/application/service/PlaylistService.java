package com.example.trackscheduler.application.service;

import com.example.trackscheduler.api.response.AddPlaylistTracksResponse;
import com.example.trackscheduler.api.response.PlayPlaylistResponse;
import com.example.trackscheduler.api.response.PlaylistResponse;
import com.example.trackscheduler.common.exception.BusinessException;
import com.example.trackscheduler.domain.PlaybackMode;
import com.example.trackscheduler.domain.model.PlaybackScope;
import com.example.trackscheduler.domain.model.TrackSelection;
import com.example.trackscheduler.domain.model.UserPlaylist;
import com.example.trackscheduler.infrastructure.library.PlaylistStore;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Playlist CRUD. Every edit is pushed into the scheduler and the weight store
 * in the same call, so an active playlist scope never lags behind its store.
 */
@Service
public class PlaylistService {

    private static final Logger log = LoggerFactory.getLogger(PlaylistService.class);

    private static final int MAX_NAME_LENGTH = 128;

    private final PlaylistStore playlistStore;
    private final TrackSchedulerService scheduler;
    private final PlaybackWeightService weightService;
    private final TrackPresenter trackPresenter;

    public PlaylistService(PlaylistStore playlistStore,
                           TrackSchedulerService scheduler,
                           PlaybackWeightService weightService,
                           TrackPresenter trackPresenter) {
        this.playlistStore = playlistStore;
        this.scheduler = scheduler;
        this.weightService = weightService;
        this.trackPresenter = trackPresenter;
    }

    public List<PlaylistResponse> listPlaylists() {
        PlaybackScope scope = scheduler.currentScope();
        return playlistStore.listPlaylists().stream()
                .map(playlist -> toResponse(playlist, scope))
                .collect(Collectors.toList());
    }

    public PlaylistResponse getPlaylist(String playlistId) {
        return toResponse(requirePlaylist(playlistId), scheduler.currentScope());
    }

    public PlaylistResponse createPlaylist(String name, List<String> trackPaths) {
        String safeName = normalizePlaylistName(name);
        ensureNameAvailable(safeName, null);
        UserPlaylist created = playlistStore.create(safeName, trackPaths);
        log.info("PLAYLIST_EVENT event=created playlistId={} tracks={}", created.getId(), created.getTrackPaths().size());
        return toResponse(created, scheduler.currentScope());
    }

    public PlaylistResponse renamePlaylist(String playlistId, String name) {
        UserPlaylist playlist = requirePlaylist(playlistId);
        String safeName = normalizePlaylistName(name);
        if (!safeName.equals(playlist.getName())) {
            ensureNameAvailable(safeName, playlistId);
        }
        UserPlaylist renamed = playlistStore.rename(playlistId, safeName);
        if (renamed == null) {
            throw new BusinessException("404", "歌单不存在");
        }
        return toResponse(renamed, scheduler.currentScope());
    }

    /**
     * Deletes the playlist and its weight namespace. An active playlist scope
     * falls back to the queue.
     */
    public void deletePlaylist(String playlistId) {
        requirePlaylist(playlistId);
        if (!playlistStore.delete(playlistId)) {
            throw new BusinessException("404", "歌单不存在");
        }
        weightService.removePlaylist(playlistId);
        scheduler.playlistDeleted(playlistId);
        log.info("PLAYLIST_EVENT event=deleted playlistId={}", playlistId);
    }

    public AddPlaylistTracksResponse addTracks(String playlistId, List<String> trackPaths) {
        requirePlaylist(playlistId);
        List<String> requested = normalizePathList(trackPaths);
        List<String> added = playlistStore.addTracks(playlistId, requested);
        if (added == null) {
            throw new BusinessException("404", "歌单不存在");
        }
        if (!added.isEmpty()) {
            scheduler.playlistMembersChanged(playlistId);
        }
        UserPlaylist playlist = requirePlaylist(playlistId);
        return new AddPlaylistTracksResponse(
                playlistId,
                requested.size(),
                added.size(),
                requested.size() - added.size(),
                playlist.getTrackPaths().size()
        );
    }

    /**
     * Removes one member together with its playlist-scoped weight.
     */
    public boolean removeTrack(String playlistId, String trackPath) {
        requirePlaylist(playlistId);
        if (!StringUtils.hasText(trackPath)) {
            throw BusinessException.badRequest("曲目路径不能为空");
        }
        String removed = playlistStore.removeTrack(playlistId, trackPath);
        if (removed == null) {
            return false;
        }
        weightService.removeTrack(removed, playlistId);
        scheduler.playlistMembersChanged(playlistId);
        log.info("PLAYLIST_EVENT event=track_removed playlistId={} path={}", playlistId, removed);
        return true;
    }

    /**
     * Activates the playlist scope and starts playing it: at {@code startPath}
     * when given, otherwise at the first playable member, or from a fresh
     * weighted shuffle in random mode.
     */
    public PlayPlaylistResponse play(String playlistId, String startPath, String rawMode) {
        requirePlaylist(playlistId);
        PlaybackMode mode = PlaybackMode.SEQUENTIAL;
        if (StringUtils.hasText(rawMode)) {
            mode = PlaybackMode.fromValue(rawMode);
            if (mode == null) {
                throw BusinessException.badRequest("不支持的播放模式");
            }
        }
        int memberCount = scheduler.setScopePlaylist(playlistId);
        TrackSelection selection;
        if (StringUtils.hasText(startPath)) {
            selection = scheduler.selectPath(startPath);
        } else if (mode == PlaybackMode.RANDOM) {
            selection = scheduler.randomFirst();
        } else {
            selection = scheduler.startSequential();
        }
        log.info("PLAYLIST_EVENT event=play playlistId={} mode={} members={} selected={}",
                playlistId, mode.getValue(), memberCount, selection != null);
        return new PlayPlaylistResponse(playlistId, memberCount, trackPresenter.toResponse(selection));
    }

    private UserPlaylist requirePlaylist(String playlistId) {
        UserPlaylist playlist = StringUtils.hasText(playlistId) ? playlistStore.find(playlistId) : null;
        if (playlist == null) {
            throw new BusinessException("404", "歌单不存在");
        }
        return playlist;
    }

    private void ensureNameAvailable(String name, String exceptId) {
        for (UserPlaylist playlist : playlistStore.listPlaylists()) {
            if (name.equals(playlist.getName()) && !playlist.getId().equals(exceptId)) {
                throw new BusinessException("409", "歌单已存在");
            }
        }
    }

    private String normalizePlaylistName(String rawName) {
        if (!StringUtils.hasText(rawName)) {
            throw new BusinessException("400", "歌单名称不能为空");
        }
        String safeName = rawName.trim();
        if (safeName.length() > MAX_NAME_LENGTH) {
            throw new BusinessException("400", "歌单名称长度不能超过" + MAX_NAME_LENGTH);
        }
        return safeName;
    }

    private List<String> normalizePathList(List<String> paths) {
        if (paths == null || paths.isEmpty()) {
            throw new BusinessException("400", "trackPaths不能为空");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String path : paths) {
            if (StringUtils.hasText(path)) {
                unique.add(path.trim());
            }
        }
        if (unique.isEmpty()) {
            throw new BusinessException("400", "trackPaths不能为空");
        }
        return new ArrayList<>(unique);
    }

    private PlaylistResponse toResponse(UserPlaylist playlist, PlaybackScope scope) {
        return new PlaylistResponse(
                playlist.getId(),
                playlist.getName(),
                playlist.getTrackPaths().size(),
                playlist.getTrackPaths(),
                scope.isPlaylist(playlist.getId()),
                playlist.getCreatedAt(),
                playlist.getUpdatedAt()
        );
    }
}

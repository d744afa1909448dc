package com.example.trackscheduler.domain.model;

import com.example.trackscheduler.domain.ScopeKind;
import java.util.Objects;

/**
 * The collection playback controls operate on: the queue, or one playlist.
 * Also used as the namespace of weight levels.
 */
public final class PlaybackScope {

    private static final PlaybackScope QUEUE = new PlaybackScope(ScopeKind.QUEUE, null);

    private final ScopeKind kind;
    private final String playlistId;

    private PlaybackScope(ScopeKind kind, String playlistId) {
        this.kind = kind;
        this.playlistId = playlistId;
    }

    public static PlaybackScope queue() {
        return QUEUE;
    }

    public static PlaybackScope playlist(String playlistId) {
        if (playlistId == null || playlistId.trim().isEmpty()) {
            throw new IllegalArgumentException("playlistId must not be blank");
        }
        return new PlaybackScope(ScopeKind.PLAYLIST, playlistId.trim());
    }

    public ScopeKind getKind() {
        return kind;
    }

    public String getPlaylistId() {
        return playlistId;
    }

    public boolean isQueue() {
        return kind == ScopeKind.QUEUE;
    }

    public boolean isPlaylist(String id) {
        return kind == ScopeKind.PLAYLIST && playlistId.equals(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PlaybackScope)) {
            return false;
        }
        PlaybackScope that = (PlaybackScope) o;
        return kind == that.kind && Objects.equals(playlistId, that.playlistId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, playlistId);
    }

    @Override
    public String toString() {
        return isQueue() ? kind.getValue() : kind.getValue() + ":" + playlistId;
    }
}

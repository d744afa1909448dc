package com.example.trackscheduler.infrastructure.library;

import com.example.trackscheduler.domain.model.UserPlaylist;
import java.util.List;

public interface PlaylistStore {

    List<UserPlaylist> listPlaylists();

    /**
     * @return a copy of the playlist, or {@code null} when it does not exist
     */
    UserPlaylist find(String playlistId);

    /**
     * Member paths in playlist order, filtered to paths confirmed to exist.
     *
     * @return {@code null} when the playlist does not exist
     */
    List<String> membersInOrder(String playlistId);

    UserPlaylist create(String name, List<String> trackPaths);

    UserPlaylist rename(String playlistId, String name);

    boolean delete(String playlistId);

    /**
     * @return paths actually added (already-present members are skipped)
     */
    List<String> addTracks(String playlistId, List<String> trackPaths);

    /**
     * @return the removed member path, or {@code null} when it was not a member
     */
    String removeTrack(String playlistId, String trackPath);
}

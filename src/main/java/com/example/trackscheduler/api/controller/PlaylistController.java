package com.example.trackscheduler.api.controller;

import com.example.trackscheduler.api.request.AddPlaylistTracksRequest;
import com.example.trackscheduler.api.request.CreatePlaylistRequest;
import com.example.trackscheduler.api.request.PlayPlaylistRequest;
import com.example.trackscheduler.api.request.RenamePlaylistRequest;
import com.example.trackscheduler.api.response.AddPlaylistTracksResponse;
import com.example.trackscheduler.api.response.ApiResponse;
import com.example.trackscheduler.api.response.PlayPlaylistResponse;
import com.example.trackscheduler.api.response.PlaylistResponse;
import com.example.trackscheduler.application.service.PlaylistService;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/playlists")
public class PlaylistController {

    private final PlaylistService playlistService;

    public PlaylistController(PlaylistService playlistService) {
        this.playlistService = playlistService;
    }

    @PostMapping
    public ApiResponse<PlaylistResponse> createPlaylist(@Valid @RequestBody CreatePlaylistRequest request) {
        return ApiResponse.success(playlistService.createPlaylist(request.getName(), request.getTrackPaths()));
    }

    @GetMapping
    public ApiResponse<List<PlaylistResponse>> listPlaylists() {
        return ApiResponse.success(playlistService.listPlaylists());
    }

    @GetMapping("/{id}")
    public ApiResponse<PlaylistResponse> getPlaylist(@PathVariable("id") String id) {
        return ApiResponse.success(playlistService.getPlaylist(id));
    }

    @PatchMapping("/{id}")
    public ApiResponse<PlaylistResponse> renamePlaylist(@PathVariable("id") String id,
                                                        @Valid @RequestBody RenamePlaylistRequest request) {
        return ApiResponse.success(playlistService.renamePlaylist(id, request.getName()));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<String> deletePlaylist(@PathVariable("id") String id) {
        playlistService.deletePlaylist(id);
        return ApiResponse.success("DELETED");
    }

    @PostMapping("/{id}/tracks")
    public ApiResponse<AddPlaylistTracksResponse> addTracks(@PathVariable("id") String id,
                                                            @Valid @RequestBody AddPlaylistTracksRequest request) {
        return ApiResponse.success(playlistService.addTracks(id, request.getTrackPaths()));
    }

    @DeleteMapping("/{id}/tracks")
    public ApiResponse<Boolean> removeTrack(@PathVariable("id") String id,
                                            @RequestParam("path") String path) {
        return ApiResponse.success(playlistService.removeTrack(id, path));
    }

    @PostMapping("/{id}/play")
    public ApiResponse<PlayPlaylistResponse> play(@PathVariable("id") String id,
                                                  @RequestBody(required = false) PlayPlaylistRequest request) {
        String startPath = request == null ? null : request.getStartPath();
        String mode = request == null ? null : request.getMode();
        return ApiResponse.success(playlistService.play(id, startPath, mode));
    }
}

package com.example.trackscheduler.api.controller;

import com.example.trackscheduler.api.response.ApiResponse;
import com.example.trackscheduler.api.response.NowPlayingResponse;
import com.example.trackscheduler.api.response.TrackResponse;
import com.example.trackscheduler.application.service.TrackPresenter;
import com.example.trackscheduler.application.service.TrackSchedulerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Selection endpoints. A {@code null} data field means no playable candidate.
 */
@RestController
@RequestMapping("/api/v1/playback")
public class PlaybackController {

    private final TrackSchedulerService scheduler;
    private final TrackPresenter trackPresenter;

    public PlaybackController(TrackSchedulerService scheduler, TrackPresenter trackPresenter) {
        this.scheduler = scheduler;
        this.trackPresenter = trackPresenter;
    }

    @PostMapping("/next")
    public ApiResponse<TrackResponse> next(
            @RequestParam(value = "mode", defaultValue = "sequential") String mode) {
        return ApiResponse.success(trackPresenter.toResponse(scheduler.next(ScopeParams.toMode(mode))));
    }

    @PostMapping("/previous")
    public ApiResponse<TrackResponse> previous(
            @RequestParam(value = "mode", defaultValue = "sequential") String mode) {
        return ApiResponse.success(trackPresenter.toResponse(scheduler.previous(ScopeParams.toMode(mode))));
    }

    @PostMapping("/peek")
    public ApiResponse<TrackResponse> peek(
            @RequestParam(value = "mode", defaultValue = "sequential") String mode) {
        return ApiResponse.success(trackPresenter.toResponse(scheduler.peekNext(ScopeParams.toMode(mode))));
    }

    @PostMapping("/random-first")
    public ApiResponse<TrackResponse> randomFirst() {
        return ApiResponse.success(trackPresenter.toResponse(scheduler.randomFirst()));
    }

    @PostMapping("/random-excluding-current")
    public ApiResponse<TrackResponse> randomExcludingCurrent() {
        return ApiResponse.success(trackPresenter.toResponse(scheduler.randomExcludingCurrent()));
    }

    @PostMapping("/select/{index}")
    public ApiResponse<TrackResponse> selectAt(@PathVariable("index") int index) {
        return ApiResponse.success(trackPresenter.toResponse(scheduler.selectAt(index)));
    }

    @GetMapping("/now-playing")
    public ApiResponse<NowPlayingResponse> nowPlaying() {
        return ApiResponse.success(new NowPlayingResponse(
                trackPresenter.toResponse(scheduler.currentScope(), scheduler.playableCount()),
                trackPresenter.toResponse(scheduler.nowPlaying())));
    }
}

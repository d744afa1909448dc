package com.example.trackscheduler.api.controller;

import com.example.trackscheduler.api.request.SetScopeRequest;
import com.example.trackscheduler.api.response.ApiResponse;
import com.example.trackscheduler.api.response.ScopeResponse;
import com.example.trackscheduler.application.service.TrackPresenter;
import com.example.trackscheduler.application.service.TrackSchedulerService;
import com.example.trackscheduler.domain.model.PlaybackScope;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/scope")
public class ScopeController {

    private final TrackSchedulerService scheduler;
    private final TrackPresenter trackPresenter;

    public ScopeController(TrackSchedulerService scheduler, TrackPresenter trackPresenter) {
        this.scheduler = scheduler;
        this.trackPresenter = trackPresenter;
    }

    @GetMapping
    public ApiResponse<ScopeResponse> currentScope() {
        return ApiResponse.success(trackPresenter.toResponse(scheduler.currentScope(), scheduler.playableCount()));
    }

    @PutMapping
    public ApiResponse<ScopeResponse> setScope(@Valid @RequestBody SetScopeRequest request) {
        PlaybackScope scope = ScopeParams.toScope(request.getKind(), request.getPlaylistId());
        if (scope.isQueue()) {
            scheduler.setScopeQueue();
        } else {
            scheduler.setScopePlaylist(scope.getPlaylistId());
        }
        return ApiResponse.success(trackPresenter.toResponse(scheduler.currentScope(), scheduler.playableCount()));
    }

    @GetMapping("/playable-count")
    public ApiResponse<Integer> playableCount() {
        return ApiResponse.success(scheduler.playableCount());
    }
}

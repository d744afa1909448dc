package com.example.trackscheduler.api.controller;

import com.example.trackscheduler.api.request.SetWeightRequest;
import com.example.trackscheduler.api.response.ApiResponse;
import com.example.trackscheduler.api.response.WeightLevelResponse;
import com.example.trackscheduler.api.response.WeightSyncResponse;
import com.example.trackscheduler.application.service.PlaybackWeightService;
import com.example.trackscheduler.application.service.TrackSchedulerService;
import com.example.trackscheduler.domain.WeightLevel;
import com.example.trackscheduler.domain.model.PlaybackScope;
import com.example.trackscheduler.domain.model.WeightMutation;
import com.example.trackscheduler.domain.model.WeightSyncResult;
import java.util.Map;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/weights")
public class WeightController {

    private final TrackSchedulerService scheduler;
    private final PlaybackWeightService weightService;

    public WeightController(TrackSchedulerService scheduler, PlaybackWeightService weightService) {
        this.scheduler = scheduler;
        this.weightService = weightService;
    }

    @GetMapping
    public ApiResponse<WeightLevelResponse> getLevel(
            @RequestParam("path") String path,
            @RequestParam(value = "scope", required = false) String scope,
            @RequestParam(value = "playlistId", required = false) String playlistId) {
        PlaybackScope resolved = ScopeParams.toScope(scope, playlistId);
        WeightLevel level = scheduler.weightLevel(path, resolved);
        return ApiResponse.success(toResponse(path, resolved, level, null));
    }

    @PutMapping
    public ApiResponse<WeightLevelResponse> setLevel(@Valid @RequestBody SetWeightRequest request) {
        PlaybackScope resolved = ScopeParams.toScope(request.getScope(), request.getPlaylistId());
        WeightMutation mutation = scheduler.setWeightLevel(request.getLevel(), request.getPath(), resolved);
        WeightLevel level = scheduler.weightLevel(request.getPath(), resolved);
        return ApiResponse.success(toResponse(request.getPath(), resolved, level, mutation.isChanged()));
    }

    /**
     * Non-default levels of one scope, keyed by canonical track key.
     */
    @GetMapping("/overrides")
    public ApiResponse<Map<String, WeightLevel>> overrides(
            @RequestParam(value = "scope", required = false) String scope,
            @RequestParam(value = "playlistId", required = false) String playlistId) {
        return ApiResponse.success(weightService.overrides(ScopeParams.toScope(scope, playlistId)));
    }

    @DeleteMapping
    public ApiResponse<Boolean> clear(
            @RequestParam(value = "scope", required = false) String scope,
            @RequestParam(value = "playlistId", required = false) String playlistId) {
        return ApiResponse.success(scheduler.clearWeights(ScopeParams.toScope(scope, playlistId)).isChanged());
    }

    @DeleteMapping("/all")
    public ApiResponse<Boolean> clearAll() {
        return ApiResponse.success(scheduler.clearAllWeights().isChanged());
    }

    @PostMapping("/sync-to-queue/{playlistId}")
    public ApiResponse<WeightSyncResponse> syncToQueue(@PathVariable("playlistId") String playlistId) {
        WeightSyncResult result = scheduler.syncWeightsToQueue(playlistId);
        return ApiResponse.success(new WeightSyncResponse(playlistId, result.getTotal(), result.getChanged()));
    }

    private WeightLevelResponse toResponse(String path, PlaybackScope scope, WeightLevel level, Boolean changed) {
        return new WeightLevelResponse(path, scope.toString(), level.getValue(), level.getMultiplier(), changed);
    }
}

package com.example.trackscheduler.api.controller;

import com.example.trackscheduler.api.request.AddTracksRequest;
import com.example.trackscheduler.api.request.TrackFailureRequest;
import com.example.trackscheduler.api.request.TrackPathRequest;
import com.example.trackscheduler.api.response.AddTracksResponse;
import com.example.trackscheduler.api.response.ApiResponse;
import com.example.trackscheduler.api.response.TrackResponse;
import com.example.trackscheduler.application.service.TrackPresenter;
import com.example.trackscheduler.application.service.TrackSchedulerService;
import com.example.trackscheduler.domain.model.TrackRecord;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * The physical queue and playback outcome reports.
 */
@RestController
@RequestMapping("/api/v1/tracks")
public class TrackController {

    private final TrackSchedulerService scheduler;
    private final TrackPresenter trackPresenter;

    public TrackController(TrackSchedulerService scheduler, TrackPresenter trackPresenter) {
        this.scheduler = scheduler;
        this.trackPresenter = trackPresenter;
    }

    @GetMapping
    public ApiResponse<List<TrackResponse>> listQueue() {
        List<TrackRecord> records = scheduler.queue();
        List<TrackResponse> result = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            result.add(trackPresenter.toResponse(i, records.get(i)));
        }
        return ApiResponse.success(result);
    }

    @PostMapping
    public ApiResponse<AddTracksResponse> addTracks(@Valid @RequestBody AddTracksRequest request) {
        int before = scheduler.queue().size();
        Integer focusIndex = scheduler.ensureInQueue(request.getPaths(), request.getFocusPath());
        int after = scheduler.queue().size();
        return ApiResponse.success(new AddTracksResponse(request.getPaths().size(), after - before, focusIndex, after));
    }

    @DeleteMapping("/{index}")
    public ApiResponse<TrackResponse> removeTrack(@PathVariable("index") int index) {
        return ApiResponse.success(trackPresenter.toResponse(index, scheduler.removeTrack(index)));
    }

    @DeleteMapping
    public ApiResponse<String> clearQueue() {
        scheduler.clearQueue();
        return ApiResponse.success("CLEARED");
    }

    @PostMapping("/failure")
    public ApiResponse<Boolean> reportFailure(@Valid @RequestBody TrackFailureRequest request) {
        return ApiResponse.success(scheduler.markUnplayable(request.getPath(), request.getReason()));
    }

    @PostMapping("/success")
    public ApiResponse<Boolean> reportSuccess(@Valid @RequestBody TrackPathRequest request) {
        return ApiResponse.success(scheduler.markPlayable(request.getPath()));
    }
}

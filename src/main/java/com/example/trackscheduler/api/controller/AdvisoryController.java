package com.example.trackscheduler.api.controller;

import com.example.trackscheduler.api.response.ApiResponse;
import com.example.trackscheduler.application.service.PersistenceAdvisoryService;
import com.example.trackscheduler.domain.model.PersistenceAdvisory;
import java.util.List;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Non-fatal persistence failures waiting to be shown to the user.
 */
@RestController
@RequestMapping("/api/v1/advisories")
public class AdvisoryController {

    private final PersistenceAdvisoryService advisoryService;

    public AdvisoryController(PersistenceAdvisoryService advisoryService) {
        this.advisoryService = advisoryService;
    }

    @GetMapping
    public ApiResponse<List<PersistenceAdvisory>> recent() {
        return ApiResponse.success(advisoryService.recent());
    }

    @DeleteMapping
    public ApiResponse<String> dismissAll() {
        advisoryService.clear();
        return ApiResponse.success("CLEARED");
    }
}

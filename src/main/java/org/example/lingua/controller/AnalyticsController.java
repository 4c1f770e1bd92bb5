package org.example.lingua.controller;

import org.example.lingua.config.RequestCorrelation;
import org.example.lingua.model.ProgressSummary;
import org.example.lingua.model.Recommendations;
import org.example.lingua.service.ProgressService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {

    private final ProgressService progressService;

    public AnalyticsController(ProgressService progressService) {
        this.progressService = progressService;
    }

    @GetMapping("/progress")
    public ProgressSummary getProgress(@RequestHeader(RequestCorrelation.USER_HEADER_NAME) String userId) {
        return progressService.getProgressSummary(userId);
    }

    @GetMapping("/recommendations")
    public Recommendations getRecommendations(@RequestHeader(RequestCorrelation.USER_HEADER_NAME) String userId) {
        return progressService.getRecommendations(userId);
    }
}

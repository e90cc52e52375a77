package org.be.trackerservice.controller;

import lombok.RequiredArgsConstructor;
import org.be.trackerservice.dto.response.AnalyticsResponseDto;
import org.be.trackerservice.enums.BucketGranularity;
import org.be.trackerservice.service.analytics.AnalyticsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    @GetMapping("/sentiment")
    public ResponseEntity<AnalyticsResponseDto.SentimentDistribution> getSentimentDistribution(
            @RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(analyticsService.getSentimentDistribution(days));
    }

    @GetMapping("/topics")
    public ResponseEntity<List<AnalyticsResponseDto.TopicCount>> getTopTopics(
            @RequestParam(defaultValue = "7") int days,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(analyticsService.getTopTopics(days, limit));
    }

    @GetMapping("/sources")
    public ResponseEntity<List<AnalyticsResponseDto.SourceCount>> getSourceBreakdown(
            @RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(analyticsService.getSourceBreakdown(days));
    }

    /**
     * GET /api/v1/analytics/timeline?days=&granularity=hour|day
     */
    @GetMapping("/timeline")
    public ResponseEntity<AnalyticsResponseDto.Timeline> getTimeline(
            @RequestParam(defaultValue = "7") int days,
            @RequestParam(defaultValue = "day") String granularity) {
        return ResponseEntity.ok(analyticsService.getTimeline(days, BucketGranularity.fromCode(granularity)));
    }

    @GetMapping("/spikes")
    public ResponseEntity<AnalyticsResponseDto.SpikeReport> getSpikeReport(
            @RequestParam(defaultValue = "7") int days,
            @RequestParam(defaultValue = "2.5") double thresholdSigma) {
        return ResponseEntity.ok(analyticsService.getSpikeReport(days, thresholdSigma));
    }

    @GetMapping("/summary")
    public ResponseEntity<AnalyticsResponseDto.Summary> getSummary(
            @RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(analyticsService.getSummary(days));
    }
}

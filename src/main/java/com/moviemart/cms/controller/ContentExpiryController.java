package com.moviemart.cms.controller;

import com.moviemart.cms.dto.ExpiryPassResult;
import com.moviemart.cms.dto.ScheduleWindow;
import com.moviemart.cms.dto.ScheduledVideoView;
import com.moviemart.cms.dto.SchedulerStatusResponse;
import com.moviemart.cms.dto.UpcomingExpiringContent;
import com.moviemart.cms.scheduler.ContentExpiryScheduler;
import com.moviemart.cms.service.ContentExpiryService;
import com.moviemart.cms.service.ScheduledVideoService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Admin endpoints for content visibility scheduling.
 * Access control is applied by the gateway in front of this service.
 */
@RestController
@RequestMapping("/api/admin/content-expiry")
@RequiredArgsConstructor
@Slf4j
public class ContentExpiryController {

    private final ContentExpiryService contentExpiryService;
    private final ScheduledVideoService scheduledVideoService;
    private final ContentExpiryScheduler contentExpiryScheduler;

    /**
     * Run one expiry pass now, outside the timer.
     */
    @PostMapping("/process")
    public ResponseEntity<ExpiryPassResult> processExpiredContent() {
        log.info("Manual content expiry pass requested");
        return ResponseEntity.ok(contentExpiryService.processExpiredContent());
    }

    @GetMapping("/upcoming")
    public ResponseEntity<UpcomingExpiringContent> getUpcomingExpiringContent(
            @RequestParam(defaultValue = "7") @Min(0) @Max(365) int daysAhead) {
        log.info("Getting content expiring within {} days", daysAhead);
        return ResponseEntity.ok(contentExpiryService.getUpcomingExpiringContent(daysAhead));
    }

    /**
     * List scheduled video assets, optionally filtered by {@code upcoming}, {@code expiring} or {@code expired}.
     */
    @GetMapping("/scheduled-videos")
    public ResponseEntity<List<ScheduledVideoView>> getScheduledVideos(
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "7") @Min(0) @Max(365) int daysAhead) {
        ScheduleWindow window = ScheduleWindow.fromParam(status);
        log.info("Getting scheduled videos: window={}, daysAhead={}", window, daysAhead);
        return ResponseEntity.ok(scheduledVideoService.getScheduledVideos(window, daysAhead));
    }

    @GetMapping("/scheduler")
    public ResponseEntity<SchedulerStatusResponse> getSchedulerStatus() {
        return ResponseEntity.ok(contentExpiryScheduler.status());
    }
}

package com.moviemart.cms.service;

import com.moviemart.cms.dto.ScheduleWindow;
import com.moviemart.cms.dto.ScheduledVideoView;
import com.moviemart.cms.exception.InvalidExpiryWindowException;
import com.moviemart.cms.model.WatchVideo;
import com.moviemart.cms.repository.WatchVideoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Admin listing of active video assets that carry a visibility schedule.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledVideoService {

    private final WatchVideoRepository watchVideoRepository;
    private final Clock clock;

    public List<ScheduledVideoView> getScheduledVideos(ScheduleWindow window, int daysAhead) {
        if (daysAhead < 0) {
            throw new InvalidExpiryWindowException("daysAhead must not be negative: " + daysAhead);
        }
        Instant now = clock.instant();

        List<WatchVideo> videos;
        switch (window) {
            case UPCOMING:
                videos = watchVideoRepository.findByScheduledTrueAndActiveTrueAndVisibleFromAfterOrderByVisibleUntilAsc(now);
                break;
            case EXPIRING:
                videos = watchVideoRepository.findScheduledActiveExpiringBetween(now, now.plus(Duration.ofDays(daysAhead)));
                break;
            case EXPIRED:
                videos = watchVideoRepository.findByScheduledTrueAndActiveTrueAndVisibleUntilBeforeOrderByVisibleUntilAsc(now);
                break;
            default:
                videos = watchVideoRepository.findByScheduledTrueAndActiveTrueOrderByVisibleUntilAsc();
        }

        log.debug("Scheduled videos window={} daysAhead={} -> {}", window, daysAhead, videos.size());
        return videos.stream()
                .map(ScheduledVideoView::from)
                .collect(Collectors.toList());
    }
}

package com.moviemart.cms.service;

import com.moviemart.cms.dto.ExpiringContentView;
import com.moviemart.cms.dto.ExpiryPassResult;
import com.moviemart.cms.dto.TransitionCounts;
import com.moviemart.cms.dto.UpcomingExpiringContent;
import com.moviemart.cms.exception.InvalidExpiryWindowException;
import com.moviemart.cms.model.ContentFamily;
import com.moviemart.cms.model.ScheduledContent;
import com.moviemart.cms.model.WatchVideo;
import com.moviemart.cms.repository.ContentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Enforces visibility windows of scheduled content.
 *
 * A pass runs these stages one after another, each against the same {@code now}:
 * 1. Video assets
 * 2. Events
 * 3. Movies
 * 4. Episodes inside series assets
 *
 * Expired items are deleted when {@code autoDeleteOnExpiry} is set, otherwise deactivated
 * and moved to their family's archived status. Failures are collected in the result and
 * never abort the pass.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContentExpiryService {

    public static final int DEFAULT_DAYS_AHEAD = 7;

    private final ContentStore contentStore;
    private final EpisodeReconciler episodeReconciler;
    private final Clock clock;

    public ExpiryPassResult processExpiredContent() {
        Instant now = clock.instant();
        ExpiryPassResult result = new ExpiryPassResult();

        try {
            for (ContentFamily family : ContentFamily.values()) {
                expireFamily(family, now, result);
            }
            reconcileEpisodes(now, result);
        } catch (Exception e) {
            String errorMsg = "Expiry pass failed: " + e.getMessage();
            result.addError(errorMsg);
            log.error(errorMsg, e);
        }

        log.info("Expiry pass at {}: {} errors={}", now, result.getFamilyCounts(), result.getErrors().size());
        return result;
    }

    public UpcomingExpiringContent getUpcomingExpiringContent() {
        return getUpcomingExpiringContent(DEFAULT_DAYS_AHEAD);
    }

    public UpcomingExpiringContent getUpcomingExpiringContent(int daysAhead) {
        if (daysAhead < 0) {
            throw new InvalidExpiryWindowException("daysAhead must not be negative: " + daysAhead);
        }
        Instant now = clock.instant();
        Instant until = now.plus(Duration.ofDays(daysAhead));

        return UpcomingExpiringContent.builder()
                .videos(upcoming(ContentFamily.VIDEO, now, until))
                .events(upcoming(ContentFamily.EVENT, now, until))
                .movies(upcoming(ContentFamily.MOVIE, now, until))
                .build();
    }

    private void expireFamily(ContentFamily family, Instant now, ExpiryPassResult result) {
        List<ScheduledContent> expired;
        try {
            expired = contentStore.findExpired(family, now);
        } catch (Exception e) {
            String errorMsg = family.getLabel() + " scan failed: " + e.getMessage();
            result.addError(errorMsg);
            log.error(errorMsg, e);
            return;
        }

        if (expired.isEmpty()) {
            log.debug("No expired {} items", family.getLabel());
            return;
        }
        log.info("Found {} expired {} items to process", expired.size(), family.getLabel());

        TransitionCounts counts = result.countsFor(family);
        for (ScheduledContent item : expired) {
            try {
                if (item.isAutoDeleteOnExpiry()) {
                    if (contentStore.delete(family, item.getId())) {
                        counts.recordDeleted();
                        log.info("Deleted expired {}: {} ({})", family.getLabel(), item.getTitle(), item.getId());
                    } else {
                        log.warn("Expired {} {} was already removed", family.getLabel(), item.getId());
                    }
                } else {
                    if (contentStore.hide(family, item.getId())) {
                        counts.recordHidden();
                        log.info("Hidden expired {}: {} ({})", family.getLabel(), item.getTitle(), item.getId());
                    } else {
                        log.warn("Expired {} {} disappeared before it could be hidden", family.getLabel(), item.getId());
                    }
                }
            } catch (Exception e) {
                String errorMsg = family.getLabel() + " " + item.getId() + ": " + e.getMessage();
                result.addError(errorMsg);
                log.error(errorMsg, e);
            }
        }
    }

    private void reconcileEpisodes(Instant now, ExpiryPassResult result) {
        List<WatchVideo> seriesList;
        try {
            seriesList = contentStore.findSeriesWithScheduledEpisodes();
        } catch (Exception e) {
            String errorMsg = "Series scan failed: " + e.getMessage();
            result.addError(errorMsg);
            log.error(errorMsg, e);
            return;
        }

        TransitionCounts videoCounts = result.countsFor(ContentFamily.VIDEO);
        for (WatchVideo series : seriesList) {
            SeriesReconciliation outcome = episodeReconciler.reconcile(series.getSeasons(), now);
            if (!outcome.changed()) {
                continue;
            }

            try {
                if (contentStore.applyEpisodeTransitions(series.getId(), outcome.transitions())) {
                    videoCounts.add(outcome.hidden(), outcome.deleted());
                    log.info("Reconciled series {} ({}): {} episodes hidden, {} removed, totalEpisodes={}",
                            series.getTitle(), series.getId(), outcome.hidden(), outcome.deleted(),
                            outcome.totalEpisodes());
                } else {
                    log.warn("Series {} changed or disappeared before its episodes could be updated", series.getId());
                }
            } catch (Exception e) {
                String errorMsg = "Series " + series.getId() + ": " + e.getMessage();
                result.addError(errorMsg);
                log.error(errorMsg, e);
            }
        }
    }

    private List<ExpiringContentView> upcoming(ContentFamily family, Instant from, Instant to) {
        return contentStore.findExpiringBetween(family, from, to).stream()
                .map(ExpiringContentView::from)
                .collect(Collectors.toList());
    }
}

package com.moviemart.cms.repository;

import com.moviemart.cms.model.ContentFamily;
import com.moviemart.cms.model.EpisodeTransition;
import com.moviemart.cms.model.ScheduledContent;
import com.moviemart.cms.model.WatchVideo;

import java.time.Instant;
import java.util.List;

/**
 * Operations the expiry engine needs from the content collections.
 * <p>
 * {@link #hide} and {@link #delete} report whether a document matched; {@code false} means the
 * document was already gone when the write landed.
 */
public interface ContentStore {

    /**
     * Scheduled, still-active items of the family whose {@code visibleUntil} is at or before {@code now}.
     */
    List<ScheduledContent> findExpired(ContentFamily family, Instant now);

    /**
     * Scheduled, still-active items whose {@code visibleUntil} falls within {@code [from, to]},
     * soonest first.
     */
    List<ScheduledContent> findExpiringBetween(ContentFamily family, Instant from, Instant to);

    /**
     * Sets {@code isActive=false} and the family's archived status.
     */
    boolean hide(ContentFamily family, String id);

    boolean delete(ContentFamily family, String id);

    List<WatchVideo> findSeriesWithScheduledEpisodes();

    /**
     * Hides or removes the given episodes of a series and repairs {@code totalEpisodes}, touching
     * no other field of the stored document.
     *
     * @return {@code false} when the series is gone or its episodes changed since they were read
     */
    boolean applyEpisodeTransitions(String seriesId, List<EpisodeTransition> transitions);
}

package com.moviemart.cms.repository;

import com.moviemart.cms.model.WatchVideo;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface WatchVideoRepository extends MongoRepository<WatchVideo, String> {

    // Series that still carry at least one scheduled episode
    @Query("{ 'videoType': 'series', 'isActive': true, 'seasons.episodes.isScheduled': true }")
    List<WatchVideo> findActiveSeriesWithScheduledEpisodes();

    List<WatchVideo> findByScheduledTrueAndActiveTrueOrderByVisibleUntilAsc();

    List<WatchVideo> findByScheduledTrueAndActiveTrueAndVisibleFromAfterOrderByVisibleUntilAsc(Instant now);

    List<WatchVideo> findByScheduledTrueAndActiveTrueAndVisibleUntilBeforeOrderByVisibleUntilAsc(Instant now);

    @Query(value = "{ 'isScheduled': true, 'isActive': true, 'visibleUntil': { '$gte': ?0, '$lte': ?1 } }",
            sort = "{ 'visibleUntil': 1 }")
    List<WatchVideo> findScheduledActiveExpiringBetween(Instant from, Instant to);
}

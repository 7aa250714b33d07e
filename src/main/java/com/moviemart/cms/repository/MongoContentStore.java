package com.moviemart.cms.repository;

import com.moviemart.cms.model.ContentFamily;
import com.moviemart.cms.model.EpisodeTransition;
import com.moviemart.cms.model.ScheduledContent;
import com.moviemart.cms.model.WatchVideo;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link ContentStore} backed by MongoDB. The three families share one query shape, so the
 * generic operations go through {@link MongoTemplate} keyed by {@link ContentFamily#getDocumentType()};
 * series are read through {@link WatchVideoRepository} and written back with a targeted update.
 * <p>
 * The CRUD layer owns many series fields this worker does not map, so episode transitions are
 * applied to the stored {@code seasons} array as raw {@link Document}s and only {@code seasons}
 * and {@code totalEpisodes} are written. The write matches on the {@code seasons} value it was
 * computed from; a concurrent edit makes it miss instead of being overwritten.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MongoContentStore implements ContentStore {

    static final String ID = "_id";
    static final String IS_SCHEDULED = "isScheduled";
    static final String IS_ACTIVE = "isActive";
    static final String VISIBLE_UNTIL = "visibleUntil";
    static final String STATUS = "status";
    static final String SEASONS = "seasons";
    static final String EPISODES = "episodes";
    static final String TOTAL_EPISODES = "totalEpisodes";

    private final MongoTemplate mongoTemplate;
    private final WatchVideoRepository watchVideoRepository;

    @Override
    public List<ScheduledContent> findExpired(ContentFamily family, Instant now) {
        Query query = Query.query(scheduledAndActive().and(VISIBLE_UNTIL).lte(now));
        return new ArrayList<>(mongoTemplate.find(query, family.getDocumentType()));
    }

    @Override
    public List<ScheduledContent> findExpiringBetween(ContentFamily family, Instant from, Instant to) {
        Query query = Query.query(scheduledAndActive().and(VISIBLE_UNTIL).gte(from).lte(to))
                .with(Sort.by(Sort.Direction.ASC, VISIBLE_UNTIL));
        query.fields().include("title", family.getPreviewImageField(), VISIBLE_UNTIL, "autoDeleteOnExpiry");
        return new ArrayList<>(mongoTemplate.find(query, family.getDocumentType()));
    }

    @Override
    public boolean hide(ContentFamily family, String id) {
        Update update = new Update()
                .set(IS_ACTIVE, false)
                .set(STATUS, family.getArchivedStatus());
        UpdateResult result = mongoTemplate.updateFirst(byId(id), update, family.getDocumentType());
        log.debug("Hide {} {} matched={} modified={}", family.getLabel(), id,
                result.getMatchedCount(), result.getModifiedCount());
        return result.getMatchedCount() > 0;
    }

    @Override
    public boolean delete(ContentFamily family, String id) {
        DeleteResult result = mongoTemplate.remove(byId(id), family.getDocumentType());
        return result.getDeletedCount() > 0;
    }

    @Override
    public List<WatchVideo> findSeriesWithScheduledEpisodes() {
        return watchVideoRepository.findActiveSeriesWithScheduledEpisodes();
    }

    @Override
    public boolean applyEpisodeTransitions(String seriesId, List<EpisodeTransition> transitions) {
        Document stored = mongoTemplate.findOne(rawById(seriesId), Document.class, WatchVideo.COLLECTION);
        if (stored == null) {
            log.debug("Series {} no longer exists", seriesId);
            return false;
        }

        List<Document> seasons = stored.getList(SEASONS, Document.class, List.of());
        List<Document> updatedSeasons = applyTo(seasons, transitions);
        if (updatedSeasons == null) {
            log.debug("Series {} episodes moved since the scan", seriesId);
            return false;
        }

        int totalEpisodes = updatedSeasons.stream()
                .mapToInt(season -> season.getList(EPISODES, Document.class, List.of()).size())
                .sum();
        Query unchanged = Query.query(Criteria.where(ID).is(stored.get(ID)).and(SEASONS).is(seasons));
        Update update = new Update()
                .set(SEASONS, updatedSeasons)
                .set(TOTAL_EPISODES, totalEpisodes);
        UpdateResult result = mongoTemplate.updateFirst(unchanged, update, WatchVideo.COLLECTION);
        log.debug("Series {} episode update matched={} modified={}", seriesId,
                result.getMatchedCount(), result.getModifiedCount());
        return result.getMatchedCount() > 0;
    }

    /**
     * Copies of the stored seasons with the transitions applied, or {@code null} when a transition
     * no longer points at the episode it was computed for.
     */
    static List<Document> applyTo(List<Document> seasons, List<EpisodeTransition> transitions) {
        List<Document> updated = new ArrayList<>(seasons.size());
        for (int seasonIndex = 0; seasonIndex < seasons.size(); seasonIndex++) {
            Document season = seasons.get(seasonIndex);
            List<Document> episodes = season.getList(EPISODES, Document.class, List.of());
            List<Document> keptEpisodes = new ArrayList<>(episodes.size());
            Set<Integer> removed = new HashSet<>();
            Set<Integer> hidden = new HashSet<>();
            boolean touched = false;

            for (EpisodeTransition transition : transitions) {
                if (transition.seasonIndex() != seasonIndex) {
                    continue;
                }
                if (transition.episodeIndex() >= episodes.size()
                        || !sameEpisode(episodes.get(transition.episodeIndex()), transition)) {
                    return null;
                }
                if (transition.action() == EpisodeTransition.Action.REMOVE) {
                    removed.add(transition.episodeIndex());
                } else {
                    hidden.add(transition.episodeIndex());
                }
                touched = true;
            }

            if (!touched) {
                updated.add(season);
                continue;
            }
            for (int episodeIndex = 0; episodeIndex < episodes.size(); episodeIndex++) {
                if (removed.contains(episodeIndex)) {
                    continue;
                }
                Document episode = episodes.get(episodeIndex);
                if (hidden.contains(episodeIndex)) {
                    episode = new Document(episode);
                    episode.put(IS_ACTIVE, false);
                }
                keptEpisodes.add(episode);
            }
            Document updatedSeason = new Document(season);
            updatedSeason.put(EPISODES, keptEpisodes);
            updated.add(updatedSeason);
        }

        boolean allInRange = transitions.stream().allMatch(t -> t.seasonIndex() < seasons.size());
        return allInRange ? updated : null;
    }

    private static boolean sameEpisode(Document episode, EpisodeTransition transition) {
        return transition.episodeId() == null
                || Objects.equals(transition.episodeId(), Objects.toString(episode.get(ID), null));
    }

    private static Criteria scheduledAndActive() {
        return Criteria.where(IS_SCHEDULED).is(true).and(IS_ACTIVE).is(true);
    }

    private static Query byId(String id) {
        return Query.query(Criteria.where(ID).is(id));
    }

    private static Query rawById(String id) {
        return Query.query(Criteria.where(ID).is(ObjectId.isValid(id) ? new ObjectId(id) : id));
    }
}

package com.moviemart.cms.service;

import com.moviemart.cms.model.Episode;
import com.moviemart.cms.model.EpisodeTransition;
import com.moviemart.cms.model.Season;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies the expiry policy to the episodes of a series.
 * <p>
 * Builds new season and episode lists instead of editing the given ones, so the caller's
 * document stays untouched until it decides to persist the result. Kept episodes retain
 * their relative order. Each hidden or removed episode is also reported as an
 * {@link EpisodeTransition} addressed by its position in the input lists.
 */
@Component
public class EpisodeReconciler {

    public SeriesReconciliation reconcile(List<Season> seasons, Instant now) {
        if (seasons == null || seasons.isEmpty()) {
            return new SeriesReconciliation(List.of(), List.of());
        }

        List<Season> reconciled = new ArrayList<>(seasons.size());
        List<EpisodeTransition> transitions = new ArrayList<>();

        for (int seasonIndex = 0; seasonIndex < seasons.size(); seasonIndex++) {
            Season season = seasons.get(seasonIndex);
            if (season.getEpisodes() == null || season.getEpisodes().isEmpty()) {
                reconciled.add(season);
                continue;
            }

            List<Episode> kept = new ArrayList<>(season.getEpisodes().size());
            boolean seasonChanged = false;
            for (int episodeIndex = 0; episodeIndex < season.getEpisodes().size(); episodeIndex++) {
                Episode episode = season.getEpisodes().get(episodeIndex);
                if (!isExpired(episode, now)) {
                    kept.add(episode);
                } else if (episode.isAutoDeleteOnExpiry()) {
                    transitions.add(EpisodeTransition.remove(seasonIndex, episodeIndex, episode.getId()));
                    seasonChanged = true;
                } else {
                    kept.add(episode.toBuilder().active(false).build());
                    transitions.add(EpisodeTransition.hide(seasonIndex, episodeIndex, episode.getId()));
                    seasonChanged = true;
                }
            }

            reconciled.add(seasonChanged ? season.toBuilder().episodes(kept).build() : season);
        }

        return new SeriesReconciliation(reconciled, List.copyOf(transitions));
    }

    static boolean isExpired(Episode episode, Instant now) {
        return episode.isScheduled()
                && episode.isActive()
                && episode.getVisibleUntil() != null
                && !episode.getVisibleUntil().isAfter(now);
    }
}

package com.moviemart.cms.service;

import com.moviemart.cms.model.EpisodeTransition;
import com.moviemart.cms.model.Season;

import java.util.List;

/**
 * Seasons of a series after expired episodes were hidden or removed, with the transitions that
 * produced them. The transitions are what gets written back; the seasons are the resulting view.
 */
public record SeriesReconciliation(List<Season> seasons, List<EpisodeTransition> transitions) {

    public boolean changed() {
        return !transitions.isEmpty();
    }

    public int hidden() {
        return count(EpisodeTransition.Action.HIDE);
    }

    public int deleted() {
        return count(EpisodeTransition.Action.REMOVE);
    }

    public int totalEpisodes() {
        return seasons.stream()
                .mapToInt(season -> season.getEpisodes() == null ? 0 : season.getEpisodes().size())
                .sum();
    }

    private int count(EpisodeTransition.Action action) {
        return (int) transitions.stream().filter(t -> t.action() == action).count();
    }
}

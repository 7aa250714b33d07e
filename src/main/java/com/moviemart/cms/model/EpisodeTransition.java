package com.moviemart.cms.model;

/**
 * One expired episode of a series, addressed by its position in the stored {@code seasons} array.
 * {@code episodeId} is the episode's {@code _id} when it has one and guards against the array having
 * shifted since it was read.
 */
public record EpisodeTransition(int seasonIndex, int episodeIndex, String episodeId, Action action) {

    public enum Action {
        HIDE,
        REMOVE
    }

    public static EpisodeTransition hide(int seasonIndex, int episodeIndex, String episodeId) {
        return new EpisodeTransition(seasonIndex, episodeIndex, episodeId, Action.HIDE);
    }

    public static EpisodeTransition remove(int seasonIndex, int episodeIndex, String episodeId) {
        return new EpisodeTransition(seasonIndex, episodeIndex, episodeId, Action.REMOVE);
    }
}

package com.moviemart.cms.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Per-collection settings for the expiry engine. Declaration order is the order
 * in which a pass processes the families.
 */
@Getter
@RequiredArgsConstructor
public enum ContentFamily {

    VIDEO("Video", "videos", WatchVideo.Status.ARCHIVED, "thumbnailUrl", WatchVideo.class),
    EVENT("Event", "events", Event.Status.COMPLETED, "posterImage", Event.class),
    MOVIE("Movie", "movies", Movie.Status.RELEASED, "posterUrl", Movie.class);

    private final String label;
    private final String resultKey;
    private final String archivedStatus;
    private final String previewImageField;
    private final Class<? extends ScheduledContent> documentType;
}

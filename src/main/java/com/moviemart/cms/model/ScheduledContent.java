package com.moviemart.cms.model;

import java.time.Instant;

/**
 * Scheduling fields shared by every document the expiry engine can hide or delete.
 */
public interface ScheduledContent {

    String getId();

    String getTitle();

    boolean isScheduled();

    Instant getVisibleUntil();

    boolean isActive();

    boolean isAutoDeleteOnExpiry();

    /**
     * Representative image of the item (thumbnail or poster, depending on the collection).
     */
    String getPreviewImageUrl();
}

package com.moviemart.cms.dto;

import com.moviemart.cms.exception.InvalidExpiryWindowException;

import java.util.Locale;

/**
 * Filter for the scheduled-video listing.
 */
public enum ScheduleWindow {
    /** Not yet visible: {@code visibleFrom} in the future. */
    UPCOMING,
    /** Leaving within the requested number of days. */
    EXPIRING,
    /** {@code visibleUntil} already passed but not yet processed. */
    EXPIRED,
    ALL;

    public static ScheduleWindow fromParam(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        try {
            return ScheduleWindow.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidExpiryWindowException("Unknown schedule status: " + value, e);
        }
    }
}

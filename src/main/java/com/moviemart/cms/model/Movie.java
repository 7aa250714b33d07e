package com.moviemart.cms.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Theatrical movie listing, including time-limited trade listings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "movies")
public class Movie implements ScheduledContent {

    @Id
    private String id;

    private String title;
    private String description;
    private String posterUrl;
    private String trailerUrl;

    @Builder.Default
    private String tradeStatus = "get_it_now";

    @Builder.Default
    private String status = Status.UPCOMING;

    @Builder.Default
    @Field("isActive")
    private boolean active = true;

    // Visibility schedule - for time-limited trade movies
    @Field("isScheduled")
    private boolean scheduled;
    private Instant visibleFrom;
    private Instant visibleUntil;
    private boolean autoDeleteOnExpiry;

    private Instant createdAt;
    private Instant updatedAt;

    @Override
    public String getPreviewImageUrl() {
        return posterUrl;
    }

    public static class Status {
        public static final String UPCOMING = "upcoming";
        public static final String RELEASED = "released";
        public static final String IN_PRODUCTION = "in_production";
    }
}

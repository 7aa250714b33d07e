package com.moviemart.cms.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Live event listing (concerts, screenings, meetups).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "events")
public class Event implements ScheduledContent {

    @Id
    private String id;

    private String title;
    private String description;
    private String eventType;
    private String category;

    private Instant startDate;
    private Instant endDate;

    private String posterImage;

    @Builder.Default
    private List<String> galleryImages = new ArrayList<>();

    @Builder.Default
    private String status = Status.UPCOMING;

    @Builder.Default
    @Field("isActive")
    private boolean active = true;

    @Field("isScheduled")
    private boolean scheduled;
    private Instant visibleFrom;
    private Instant visibleUntil;
    private boolean autoDeleteOnExpiry;

    private Instant createdAt;
    private Instant updatedAt;

    @Override
    public String getPreviewImageUrl() {
        return posterImage;
    }

    public static class Status {
        public static final String UPCOMING = "upcoming";
        public static final String ONGOING = "ongoing";
        public static final String COMPLETED = "completed";
        public static final String CANCELLED = "cancelled";
    }
}

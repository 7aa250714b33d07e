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
 * Streamable video asset. A {@code series} asset owns seasons of episodes and keeps
 * {@code totalEpisodes} equal to the number of episodes across all seasons.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = WatchVideo.COLLECTION)
public class WatchVideo implements ScheduledContent {

    public static final String COLLECTION = "watchvideos";

    @Id
    private String id;

    private String title;
    private String description;
    private String channelId;

    @Builder.Default
    private String videoType = VideoType.SINGLE;

    @Builder.Default
    private List<Season> seasons = new ArrayList<>();

    private int totalEpisodes;

    private String thumbnailUrl;
    private String videoUrl;

    @Builder.Default
    private String status = Status.DRAFT;

    @Builder.Default
    @Field("isActive")
    private boolean active = true;

    // Visibility schedule
    @Field("isScheduled")
    private boolean scheduled;
    private Instant visibleFrom;
    private Instant visibleUntil;
    private boolean autoDeleteOnExpiry;

    private Instant createdAt;
    private Instant updatedAt;

    @Override
    public String getPreviewImageUrl() {
        return thumbnailUrl;
    }

    public boolean isSeries() {
        return VideoType.SERIES.equals(videoType);
    }

    public static class VideoType {
        public static final String SINGLE = "single";
        public static final String SERIES = "series";
    }

    public static class Status {
        public static final String DRAFT = "draft";
        public static final String PUBLISHED = "published";
        public static final String ARCHIVED = "archived";
    }
}

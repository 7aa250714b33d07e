package com.moviemart.cms.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Episode embedded in a {@link Season}. Scheduling fields are independent of the parent series.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Episode {

    @Id
    private String id;

    private int episodeNumber;
    private String title;
    private String description;
    private String videoUrl;
    private String thumbnailUrl;
    private Integer duration;       // seconds

    @Builder.Default
    @Field("isActive")
    private boolean active = true;

    @Field("isScheduled")
    private boolean scheduled;

    private Instant visibleFrom;
    private Instant visibleUntil;
    private boolean autoDeleteOnExpiry;
}

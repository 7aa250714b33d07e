package com.moviemart.cms.dto;

import com.moviemart.cms.model.WatchVideo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledVideoView {
    private String id;
    private String title;
    private String thumbnailUrl;
    private Instant visibleFrom;
    private Instant visibleUntil;
    private boolean autoDeleteOnExpiry;
    private String status;
    private Instant createdAt;

    public static ScheduledVideoView from(WatchVideo video) {
        return ScheduledVideoView.builder()
                .id(video.getId())
                .title(video.getTitle())
                .thumbnailUrl(video.getThumbnailUrl())
                .visibleFrom(video.getVisibleFrom())
                .visibleUntil(video.getVisibleUntil())
                .autoDeleteOnExpiry(video.isAutoDeleteOnExpiry())
                .status(video.getStatus())
                .createdAt(video.getCreatedAt())
                .build();
    }
}

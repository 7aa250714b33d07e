package com.moviemart.cms.dto;

import com.moviemart.cms.model.ScheduledContent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpiringContentView {
    private String id;
    private String title;
    private String imageUrl;
    private Instant visibleUntil;
    private boolean autoDeleteOnExpiry;

    public static ExpiringContentView from(ScheduledContent item) {
        return ExpiringContentView.builder()
                .id(item.getId())
                .title(item.getTitle())
                .imageUrl(item.getPreviewImageUrl())
                .visibleUntil(item.getVisibleUntil())
                .autoDeleteOnExpiry(item.isAutoDeleteOnExpiry())
                .build();
    }
}

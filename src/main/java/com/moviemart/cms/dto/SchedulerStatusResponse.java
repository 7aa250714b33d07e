package com.moviemart.cms.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatusResponse {
    private boolean running;
    private long intervalMs;
    private boolean passInProgress;
    private long skippedTicks;
    private Instant lastCompletedAt;
    private ExpiryPassResult lastResult;
}

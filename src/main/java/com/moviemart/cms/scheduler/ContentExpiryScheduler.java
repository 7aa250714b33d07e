package com.moviemart.cms.scheduler;

import com.moviemart.cms.dto.ExpiryPassResult;
import com.moviemart.cms.dto.SchedulerStatusResponse;
import com.moviemart.cms.service.ContentExpiryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the content expiry pass on a fixed-rate timer.
 * The first pass runs as soon as the timer starts; at most one timer is active at a time.
 * <p>
 * The executor never runs two ticks of the same task at once: ticks that come due during a long
 * pass are queued and fire right after it. Each tick therefore compares the time it actually fired
 * with its slot ({@code start + n * interval}) and is skipped when it is a whole interval or more
 * late, so an overrunning pass is followed by the next on-time slot instead of a burst of catch-up passes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ContentExpiryScheduler {

    private final ContentExpiryService contentExpiryService;
    private final TaskScheduler contentExpiryTaskScheduler;
    private final Clock clock;

    private final AtomicBoolean passInProgress = new AtomicBoolean(false);
    private final AtomicLong skippedTicks = new AtomicLong();

    private final AtomicLong ticksSinceStart = new AtomicLong();

    // guarded by this
    private ScheduledFuture<?> scheduledTask;

    private volatile long intervalMs;
    private volatile Instant startedAt;

    private volatile ExpiryPassResult lastResult;
    private volatile Instant lastCompletedAt;

    public synchronized void start(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Expiry interval must be positive: " + intervalMs);
        }
        if (scheduledTask != null) {
            log.info("Content expiry scheduler is already running");
            return;
        }

        log.info("Starting content expiry scheduler (interval: {} ms)", intervalMs);
        Instant firstTick = clock.instant();
        this.intervalMs = intervalMs;
        this.startedAt = firstTick;
        this.ticksSinceStart.set(0);
        this.scheduledTask = contentExpiryTaskScheduler.scheduleAtFixedRate(
                this::runTick, firstTick, Duration.ofMillis(intervalMs));
    }

    /**
     * Cancels future ticks. A pass that is already running completes normally.
     */
    public synchronized void stop() {
        if (scheduledTask == null) {
            return;
        }
        scheduledTask.cancel(false);
        scheduledTask = null;
        startedAt = null;
        log.info("Content expiry scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return scheduledTask != null;
    }

    public synchronized SchedulerStatusResponse status() {
        return SchedulerStatusResponse.builder()
                .running(scheduledTask != null)
                .intervalMs(intervalMs)
                .passInProgress(passInProgress.get())
                .skippedTicks(skippedTicks.get())
                .lastCompletedAt(lastCompletedAt)
                .lastResult(lastResult)
                .build();
    }

    void runTick() {
        long lateMs = lateness();
        if (lateMs >= intervalMs && intervalMs > 0) {
            long skipped = skippedTicks.incrementAndGet();
            log.warn("Skipping content expiry tick {} ms late: previous pass overran its slot (skipped so far: {})",
                    lateMs, skipped);
            return;
        }
        passInProgress.set(true);
        try {
            log.debug("Running scheduled content expiry check...");
            ExpiryPassResult result = contentExpiryService.processExpiredContent();
            lastResult = result;
            lastCompletedAt = clock.instant();
            if (!result.getErrors().isEmpty()) {
                log.warn("Content expiry check completed with {} errors: {}", result.getErrors().size(), result.getErrors());
            } else {
                log.info("Content expiry check completed: {} items transitioned", result.totalTransitions());
            }
        } catch (Exception e) {
            log.error("Scheduled content expiry check failed: {}", e.getMessage(), e);
        } finally {
            passInProgress.set(false);
        }
    }

    /**
     * Milliseconds between this tick's slot and now; zero for a tick run outside the timer.
     */
    private long lateness() {
        Instant start = startedAt;
        if (start == null) {
            return 0;
        }
        Instant slot = start.plusMillis(ticksSinceStart.getAndIncrement() * intervalMs);
        return Math.max(0, Duration.between(slot, clock.instant()).toMillis());
    }
}

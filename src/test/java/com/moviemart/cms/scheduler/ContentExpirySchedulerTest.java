package com.moviemart.cms.scheduler;

import com.moviemart.cms.dto.ExpiryPassResult;
import com.moviemart.cms.dto.SchedulerStatusResponse;
import com.moviemart.cms.model.ContentFamily;
import com.moviemart.cms.service.ContentExpiryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContentExpirySchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final long HOUR_MS = 60 * 60 * 1000L;

    @Mock
    private ContentExpiryService contentExpiryService;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> scheduledFuture;

    private ContentExpiryScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ContentExpiryScheduler(contentExpiryService, taskScheduler, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void start_schedulesFixedRateTaskBeginningNow() {
        doReturn(scheduledFuture).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        scheduler.start(HOUR_MS);

        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(NOW), eq(Duration.ofMillis(HOUR_MS)));
        assertThat(scheduler.isRunning()).isTrue();
    }

    @Test
    void start_isNoOpWhenAlreadyRunning() {
        doReturn(scheduledFuture).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        scheduler.start(HOUR_MS);
        scheduler.start(1000L);

        verify(taskScheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        assertThat(scheduler.status().getIntervalMs()).isEqualTo(HOUR_MS);
    }

    @Test
    void start_rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> scheduler.start(0))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(taskScheduler);
    }

    @Test
    void stop_cancelsWithoutInterruptingRunningPass() {
        doReturn(scheduledFuture).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        scheduler.start(HOUR_MS);

        scheduler.stop();

        verify(scheduledFuture).cancel(false);
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    void stop_withoutStartDoesNothing() {
        assertThatCode(() -> scheduler.stop()).doesNotThrowAnyException();
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    void canRestartAfterStop() {
        doReturn(scheduledFuture).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        scheduler.start(HOUR_MS);
        scheduler.stop();
        scheduler.start(HOUR_MS);

        verify(taskScheduler, times(2)).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        assertThat(scheduler.isRunning()).isTrue();
    }

    @Test
    void tick_runsPassAndRecordsResult() {
        ExpiryPassResult result = new ExpiryPassResult();
        result.countsFor(ContentFamily.VIDEO).recordHidden();
        when(contentExpiryService.processExpiredContent()).thenReturn(result);
        doReturn(scheduledFuture).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        scheduler.start(HOUR_MS);

        capturedTick().run();

        SchedulerStatusResponse status = scheduler.status();
        assertThat(status.getLastResult()).isSameAs(result);
        assertThat(status.getLastCompletedAt()).isEqualTo(NOW);
        assertThat(status.isPassInProgress()).isFalse();
    }

    @Test
    void tick_swallowsPassFailure() {
        when(contentExpiryService.processExpiredContent()).thenThrow(new IllegalStateException("store down"));

        assertThatCode(() -> scheduler.runTick()).doesNotThrowAnyException();
        assertThat(scheduler.status().isPassInProgress()).isFalse();
    }

    @Test
    void lateTicksQueuedBehindAnOverrunningPass_areSkipped() {
        SteppedClock steppedClock = new SteppedClock(NOW);
        scheduler = new ContentExpiryScheduler(contentExpiryService, taskScheduler, steppedClock);
        doReturn(scheduledFuture).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        when(contentExpiryService.processExpiredContent()).thenAnswer(invocation -> {
            steppedClock.advance(Duration.ofMillis(3500));
            return new ExpiryPassResult();
        }).thenReturn(new ExpiryPassResult());
        scheduler.start(1000L);
        Runnable tick = capturedTick();

        tick.run();            // slot 0, pass ends at +3500
        tick.run();            // slot +1000, fired at +3500
        tick.run();            // slot +2000, fired at +3500
        tick.run();            // slot +3000, fired at +3500

        verify(contentExpiryService, times(2)).processExpiredContent();
        assertThat(scheduler.status().getSkippedTicks()).isEqualTo(2);
    }

    @Test
    void onTimeTicks_areNeverSkipped() {
        SteppedClock steppedClock = new SteppedClock(NOW);
        scheduler = new ContentExpiryScheduler(contentExpiryService, taskScheduler, steppedClock);
        doReturn(scheduledFuture).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        when(contentExpiryService.processExpiredContent()).thenReturn(new ExpiryPassResult());
        scheduler.start(1000L);
        Runnable tick = capturedTick();

        for (int i = 0; i < 3; i++) {
            tick.run();
            steppedClock.advance(Duration.ofMillis(1000));
        }

        verify(contentExpiryService, times(3)).processExpiredContent();
        assertThat(scheduler.status().getSkippedTicks()).isZero();
    }

    @Test
    void realTimer_skipsTicksThatCameDueDuringASlowPass() throws Exception {
        ThreadPoolTaskScheduler threadPool = new ThreadPoolTaskScheduler();
        threadPool.setPoolSize(1);
        threadPool.initialize();
        AtomicInteger passes = new AtomicInteger();
        when(contentExpiryService.processExpiredContent()).thenAnswer(invocation -> {
            passes.incrementAndGet();
            Thread.sleep(300);
            return new ExpiryPassResult();
        });
        scheduler = new ContentExpiryScheduler(contentExpiryService, threadPool, Clock.systemUTC());

        try {
            scheduler.start(50L);
            Thread.sleep(1000);
            scheduler.stop();
        } finally {
            threadPool.shutdown();
        }

        assertThat(scheduler.status().getSkippedTicks()).isPositive();
        assertThat(passes.get()).isBetween(2, 5);
    }

    private Runnable capturedTick() {
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).scheduleAtFixedRate(captor.capture(), any(Instant.class), any(Duration.class));
        return captor.getValue();
    }

    private static final class SteppedClock extends Clock {

        private Instant now;

        SteppedClock(Instant start) {
            this.now = start;
        }

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

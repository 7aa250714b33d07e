package com.moviemart.cms.service;

import com.moviemart.cms.dto.ScheduleWindow;
import com.moviemart.cms.dto.ScheduledVideoView;
import com.moviemart.cms.exception.InvalidExpiryWindowException;
import com.moviemart.cms.model.WatchVideo;
import com.moviemart.cms.repository.WatchVideoRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduledVideoServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private WatchVideoRepository watchVideoRepository;

    private ScheduledVideoService scheduledVideoService;

    @BeforeEach
    void setUp() {
        scheduledVideoService = new ScheduledVideoService(watchVideoRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void expiringWindow_spansRequestedDays() {
        WatchVideo video = WatchVideo.builder()
                .id("v1").title("Finale").thumbnailUrl("https://cdn/v1.jpg")
                .status(WatchVideo.Status.PUBLISHED).scheduled(true)
                .visibleUntil(NOW.plus(Duration.ofDays(2))).build();
        when(watchVideoRepository.findScheduledActiveExpiringBetween(NOW, NOW.plus(Duration.ofDays(3))))
                .thenReturn(List.of(video));

        List<ScheduledVideoView> views = scheduledVideoService.getScheduledVideos(ScheduleWindow.EXPIRING, 3);

        assertThat(views).singleElement().satisfies(view -> {
            assertThat(view.getId()).isEqualTo("v1");
            assertThat(view.getThumbnailUrl()).isEqualTo("https://cdn/v1.jpg");
            assertThat(view.getStatus()).isEqualTo("published");
        });
    }

    @Test
    void upcomingWindow_looksAtVisibleFrom() {
        scheduledVideoService.getScheduledVideos(ScheduleWindow.UPCOMING, 7);

        verify(watchVideoRepository).findByScheduledTrueAndActiveTrueAndVisibleFromAfterOrderByVisibleUntilAsc(NOW);
    }

    @Test
    void expiredWindow_looksBeforeNow() {
        scheduledVideoService.getScheduledVideos(ScheduleWindow.EXPIRED, 7);

        verify(watchVideoRepository).findByScheduledTrueAndActiveTrueAndVisibleUntilBeforeOrderByVisibleUntilAsc(NOW);
    }

    @Test
    void allWindow_listsEveryScheduledVideo() {
        scheduledVideoService.getScheduledVideos(ScheduleWindow.ALL, 7);

        verify(watchVideoRepository).findByScheduledTrueAndActiveTrueOrderByVisibleUntilAsc();
    }

    @Test
    void rejectsNegativeDays() {
        assertThatThrownBy(() -> scheduledVideoService.getScheduledVideos(ScheduleWindow.EXPIRING, -2))
                .isInstanceOf(InvalidExpiryWindowException.class);
        verifyNoInteractions(watchVideoRepository);
    }
}

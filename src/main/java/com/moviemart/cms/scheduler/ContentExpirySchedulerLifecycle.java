package com.moviemart.cms.scheduler;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the expiry scheduler once the application (and its Mongo connection) is ready.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ContentExpirySchedulerLifecycle {

    private final ContentExpiryScheduler contentExpiryScheduler;

    @Value("${content-expiry.enabled:true}")
    private boolean enabled;

    @Value("${content-expiry.interval-ms:3600000}")
    private long intervalMs;

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (!enabled) {
            log.info("Content expiry scheduler disabled (content-expiry.enabled=false)");
            return;
        }
        contentExpiryScheduler.start(intervalMs);
    }

    @PreDestroy
    public void stopOnShutdown() {
        contentExpiryScheduler.stop();
    }
}

package com.weatherbot.infrastructure.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window rate limiter keyed by sender.
 * 
 * State is process-local: every instance of the service limits independently.
 * Each sender's window is locked on its own, so different senders never contend.
 */
@Component
public class SenderRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(SenderRateLimiter.class);

    private final Map<String, RateWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxRequests;
    private final Duration window;

    public SenderRateLimiter(
        Clock clock,
        @Value("${app.rate-limit.max-requests:5}") int maxRequests,
        @Value("${app.rate-limit.window-seconds:60}") long windowSeconds
    ) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("max-requests must be at least 1");
        }
        this.clock = clock;
        this.maxRequests = maxRequests;
        this.window = Duration.ofSeconds(windowSeconds);
    }

    /**
     * Records a request for the sender if the window has room.
     * 
     * @param senderKey Stable sender identifier
     * @return true if admitted, false if the sender already used up the window
     */
    public boolean admit(String senderKey) {
        while (true) {
            RateWindow rateWindow = windows.computeIfAbsent(senderKey, key -> new RateWindow());
            synchronized (rateWindow) {
                if (rateWindow.retired) {
                    // evicted between lookup and lock, take the fresh one
                    continue;
                }
                long now = clock.millis();
                rateWindow.purgeBefore(now - window.toMillis());
                if (rateWindow.timestamps.size() >= maxRequests) {
                    logger.debug("Sender {} has {} requests in the current window", senderKey,
                        rateWindow.timestamps.size());
                    return false;
                }
                rateWindow.timestamps.addLast(now);
                return true;
            }
        }
    }

    public Duration getWindow() {
        return window;
    }

    /**
     * Drops windows whose timestamps have all expired.
     */
    @Scheduled(fixedDelayString = "${app.rate-limit.eviction-interval-ms:300000}")
    public void evictIdleWindows() {
        long cutoff = clock.millis() - window.toMillis();
        int before = windows.size();
        windows.forEach((senderKey, rateWindow) -> {
            synchronized (rateWindow) {
                rateWindow.purgeBefore(cutoff);
                if (rateWindow.timestamps.isEmpty()) {
                    rateWindow.retired = true;
                    windows.remove(senderKey, rateWindow);
                }
            }
        });
        logger.debug("Evicted {} idle rate-limit windows", before - windows.size());
    }

    int trackedSenders() {
        return windows.size();
    }

    /**
     * Request timestamps of one sender, oldest first. Guarded by its own monitor.
     */
    private static final class RateWindow {
        private final Deque<Long> timestamps = new ArrayDeque<>();
        private boolean retired;

        private void purgeBefore(long cutoffMillis) {
            while (!timestamps.isEmpty() && timestamps.peekFirst() < cutoffMillis) {
                timestamps.pollFirst();
            }
        }
    }
}

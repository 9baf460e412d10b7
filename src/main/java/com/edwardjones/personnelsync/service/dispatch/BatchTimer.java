package com.edwardjones.personnelsync.service.dispatch;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Admission gate that lets at most {@code maxPerWindow} operations start per window.
 *
 * This is a burst-then-pause limiter over fixed windows, not a smooth one: the first
 * {@code maxPerWindow} callers in a window pass immediately and the next one waits for the
 * following window. The windows are counted from construction.
 */
@Slf4j
public class BatchTimer {

    public static final int DEFAULT_MAX_PER_WINDOW = 50;
    public static final int DEFAULT_WINDOW_SECONDS = 60;

    // Upper bound for one acquire call, in windows
    private static final int MAX_WAIT_WINDOWS = 100;

    private final int maxPerWindow;
    private final int windowSeconds;
    private final RateLimiter rateLimiter;

    public BatchTimer(int maxPerWindow, int windowSeconds) {
        this("batchTimer", maxPerWindow, windowSeconds);
    }

    public BatchTimer(String name, int maxPerWindow, int windowSeconds) {
        this.maxPerWindow = maxPerWindow > 0 ? maxPerWindow : DEFAULT_MAX_PER_WINDOW;
        this.windowSeconds = windowSeconds > 0 ? windowSeconds : DEFAULT_WINDOW_SECONDS;

        Duration window = Duration.ofSeconds(this.windowSeconds);
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(this.maxPerWindow)
                .limitRefreshPeriod(window)
                .timeoutDuration(window.multipliedBy(MAX_WAIT_WINDOWS))
                .build();
        this.rateLimiter = RateLimiter.of(name, config);

        log.debug("Batch timer '{}' admits {} operations per {}s window", name, this.maxPerWindow, this.windowSeconds);
    }

    /**
     * Blocks until the caller may start its operation.
     *
     * @throws DispatchInterruptedException if the thread is interrupted while waiting
     */
    public void admit() {
        while (!rateLimiter.acquirePermission()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new DispatchInterruptedException("Interrupted while waiting for batch timer '"
                        + rateLimiter.getName() + "'");
            }
            log.debug("Batch timer '{}' still saturated, waiting again", rateLimiter.getName());
        }
    }

    public int getMaxPerWindow() {
        return maxPerWindow;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }
}

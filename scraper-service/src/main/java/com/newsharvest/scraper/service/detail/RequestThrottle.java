package com.newsharvest.scraper.service.detail;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Fixed pause between consecutive requests to the same origin.
 */
@Slf4j
public final class RequestThrottle {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private static final RequestThrottle NONE = new RequestThrottle(Duration.ZERO, d -> { });

    private final Duration delay;
    private final Sleeper sleeper;

    public RequestThrottle(Duration delay, Sleeper sleeper) {
        this.delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        this.sleeper = sleeper;
    }

    public static RequestThrottle of(Duration delay) {
        return new RequestThrottle(delay, d -> Thread.sleep(d.toMillis()));
    }

    public static RequestThrottle none() {
        return NONE;
    }

    public void pause() {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting between requests");
        }
    }
}

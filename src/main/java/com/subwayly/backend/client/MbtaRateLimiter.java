package com.subwayly.backend.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Spaces MBTA API requests at least {@code mbta.api.min-request-interval-ms} apart.
 * The API allows 1000 requests per minute with a key and 20 without one.
 */
@Component
@Slf4j
public class MbtaRateLimiter {

    private final long minRequestIntervalMs;

    private long nextAvailableTime = System.currentTimeMillis();

    public MbtaRateLimiter(@Value("${mbta.api.min-request-interval-ms:100}") long minRequestIntervalMs) {
        this.minRequestIntervalMs = minRequestIntervalMs;
    }

    /**
     * Blocks until a request permit is available.
     * Thread-safe.
     */
    public synchronized void acquire() {
        long now = System.currentTimeMillis();
        if (now < nextAvailableTime) {
            long waitTime = nextAvailableTime - now;
            try {
                TimeUnit.MILLISECONDS.sleep(waitTime);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("⚠️ Rate limiter interrupted during wait", e);
            }
            // keep cadence relative to the planned slot
            nextAvailableTime += minRequestIntervalMs;
        } else {
            nextAvailableTime = now + minRequestIntervalMs;
        }
    }
}

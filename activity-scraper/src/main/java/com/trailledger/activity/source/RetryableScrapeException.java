package com.trailledger.activity.source;

import java.time.Duration;
import java.util.Optional;

/**
 * A transient failure (network, timeout, DNS) that may succeed on retry.
 * The adapter can suggest how long to wait before the next attempt.
 */
public class RetryableScrapeException extends ScrapeException {

    private final Duration suggestedDelay;

    public RetryableScrapeException(String pageUrl, String message) {
        this(pageUrl, message, null, null);
    }

    public RetryableScrapeException(String pageUrl, String message, Duration suggestedDelay) {
        this(pageUrl, message, suggestedDelay, null);
    }

    public RetryableScrapeException(String pageUrl, String message, Duration suggestedDelay, Throwable cause) {
        super(pageUrl, message, cause);
        this.suggestedDelay = suggestedDelay;
    }

    public Optional<Duration> getSuggestedDelay() {
        return Optional.ofNullable(suggestedDelay);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

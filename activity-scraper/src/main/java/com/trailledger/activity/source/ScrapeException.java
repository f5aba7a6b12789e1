package com.trailledger.activity.source;

import lombok.Getter;

/**
 * Failure reading a page from the source. Carries the page locator.
 */
@Getter
public abstract class ScrapeException extends RuntimeException {

    private final String pageUrl;

    protected ScrapeException(String pageUrl, String message, Throwable cause) {
        super(message, cause);
        this.pageUrl = pageUrl;
    }

    /** Whether another attempt at the same page could succeed. */
    public abstract boolean isRetryable();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + pageUrl + "]: " + getMessage();
    }
}

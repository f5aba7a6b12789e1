package com.trailledger.activity.source;

/**
 * The target no longer exists at the source.
 */
public class MissingContentException extends ScrapeException {

    public MissingContentException(String pageUrl, String message) {
        super(pageUrl, message, null);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}

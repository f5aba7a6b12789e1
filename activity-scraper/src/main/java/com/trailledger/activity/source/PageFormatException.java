package com.trailledger.activity.source;

/**
 * The page did not have the expected structure. Usually means the source site changed.
 */
public class PageFormatException extends ScrapeException {

    public PageFormatException(String pageUrl, String message) {
        super(pageUrl, message, null);
    }

    public PageFormatException(String pageUrl, String message, Throwable cause) {
        super(pageUrl, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}

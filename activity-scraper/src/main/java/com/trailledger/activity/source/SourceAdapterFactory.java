package com.trailledger.activity.source;

/**
 * Opens a fresh {@link SourceAdapter} for one scrape invocation.
 * Register an implementation as a bean to enable scraping.
 */
@FunctionalInterface
public interface SourceAdapterFactory {

    SourceAdapter open();
}

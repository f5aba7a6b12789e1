package com.trailledger.activity.scheduler;

import com.trailledger.activity.config.TrailLedgerProperties;
import com.trailledger.activity.service.ScrapeService;
import com.trailledger.activity.store.ParticipationStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup scraping.
 *
 * Default schedule: every 6 hours. Each run visits the logged-in user's
 * activity list plus any extra profiles configured; only activities whose
 * next scrape time has passed are actually fetched, so frequent runs are cheap.
 *
 * Override with SCRAPE_CRON env var or trail-ledger.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeScheduler {

    private final ScrapeService scrapeService;
    private final ParticipationStore store;
    private final TrailLedgerProperties properties;

    /**
     * On application startup:
     *  1. Always ensure the store schema exists
     *  2. Optionally run a scrape if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        try {
            store.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise store schema (database not reachable?): {}", e.getMessage());
        }

        if (!scrapeService.isAdapterAvailable()) {
            log.warn("No source adapter registered; scheduled scrapes will fail until one is provided");
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, scraping now");
            try {
                scrapeService.scrapeProfiles("startup", properties.getScheduling().getProfileUrls(),
                        properties.getScheduling().isForceFutureRescan());
            } catch (Exception e) {
                log.error("Startup scrape failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Scraper ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${trail-ledger.scheduling.cron:0 0 */6 * * *}")
    public void scheduledScrape() {
        log.info("Scheduled scrape triggered");
        try {
            scrapeService.scrapeProfiles("scheduled", properties.getScheduling().getProfileUrls(),
                    properties.getScheduling().isForceFutureRescan());
        } catch (Exception e) {
            log.error("Scheduled scrape failed: {}", e.getMessage(), e);
        }
    }
}

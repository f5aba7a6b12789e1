package com.trailledger.activity.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One scheduled outing.
 *
 * Schema design notes:
 *  - activityUrl is the natural key; activities are never deleted
 *  - status is the lifecycle reported by the source, not the calendar position
 *    (see {@link TimeStatus} for that)
 *  - nextScrape null means the activity is stable and will not be re-fetched
 *  - the scrapeError* fields record repeated fetch failures on this activity
 */
@Data
@Builder(toBuilder = true)
public class Activity {

    // ── Identity ────────────────────────────────────────────────────────────
    private String activityUrl;

    // ── Trip information ────────────────────────────────────────────────────
    private LocalDate dateStart;
    private LocalDate dateEnd;
    private String name;
    private String committee;
    private String branch;
    private String activityType;
    private String difficulty;
    private String leaderRating;
    private String mileage;
    private String routeName;
    private String routeUrl;
    private ActivityStatus status;
    private String result;

    // ── Scraping information ────────────────────────────────────────────────
    private LocalDateTime scrapedAt;
    private LocalDateTime nextScrape;
    private String scrapeError;
    private int scrapeErrorCount;
    private LocalDateTime scrapeErrorTime;

    /** Resets the failure bookkeeping after a successful fetch. */
    public void clearScrapeError() {
        this.scrapeError = "";
        this.scrapeErrorCount = 0;
        this.scrapeErrorTime = null;
    }

    public void recordScrapeError(String message, LocalDateTime at) {
        this.scrapeError = message == null ? "" : message;
        this.scrapeErrorCount++;
        this.scrapeErrorTime = at;
    }
}

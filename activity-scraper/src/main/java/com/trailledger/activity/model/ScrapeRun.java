package com.trailledger.activity.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each scrape invocation for observability.
 * The most recent runs are kept in memory and served on /scrape/status.
 */
@Data
@Builder
public class ScrapeRun {

    private String runId;           // UUID
    private String trigger;         // scheduled | manual | startup | activity
    private String target;          // profile or activity URL, "self" for the logged-in user
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED | SKIPPED
    private int activitiesCreated;
    private int activitiesUpdated;
    private int participationsCanceled;
    private int activitiesSkipped;
    private String errorPage;       // page URL of the failing fetch, null on success
    private String errorMessage;    // null on success
}

package com.trailledger.activity.service;

import lombok.Getter;
import lombok.ToString;

/**
 * Counts of what one profile scrape did, per activity stub.
 */
@Getter
@ToString
public class ScrapeReport {

    private int created;
    private int updated;
    private int canceled;
    private int unchanged;

    void activityCreated() { created++; }

    void activityUpdated() { updated++; }

    void participationCanceled() { canceled++; }

    void activityUnchanged() { unchanged++; }
}

package com.trailledger.activity.model;

/**
 * Lifecycle status reported by the source for an activity.
 */
public enum ActivityStatus {
    /** Scheduled or currently happening */
    FUTURE,
    /** Has happened but not closed by the leader, so it may still change */
    PAST,
    /** Closed and unlikely to change */
    CLOSED
}

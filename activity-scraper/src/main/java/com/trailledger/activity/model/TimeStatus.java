package com.trailledger.activity.model;

/**
 * Calendar position of an activity relative to now, independent of the
 * status reported by the source.
 */
public enum TimeStatus {
    FUTURE, CURRENT, PAST
}

package com.trailledger.activity.service;

/**
 * What one roster merge changed.
 */
public record MergeStats(int created, int updated, int removed, int stubsCreated) {

    public static final MergeStats EMPTY = new MergeStats(0, 0, 0, 0);
}

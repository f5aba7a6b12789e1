package com.trailledger.activity.source;

/**
 * One line of a member's activity list. Enough to decide whether the
 * activity needs a full detail fetch, nothing more.
 */
public record ActivityStub(
        String activityUrl,
        String activityName,
        boolean canceled,
        boolean future,
        String role,
        String registration,
        String memberResult,
        String activityResult) {}

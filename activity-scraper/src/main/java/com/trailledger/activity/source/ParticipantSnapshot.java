package com.trailledger.activity.source;

/**
 * A roster line on an activity detail page.
 */
public record ParticipantSnapshot(
        String profileUrl,
        String fullName,
        String role,
        boolean canceled,
        String registration,
        String memberResult) {}

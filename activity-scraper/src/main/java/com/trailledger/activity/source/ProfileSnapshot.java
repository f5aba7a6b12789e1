package com.trailledger.activity.source;

/**
 * A member profile page as read from the source.
 */
public record ProfileSnapshot(String profileUrl, String fullName, String portraitUrl, String email, String branch) {}

package com.trailledger.activity.source;

import java.time.LocalDateTime;

/**
 * An authenticated session against the source.
 */
public record SourceSession(String userName, LocalDateTime loggedInAt) {}

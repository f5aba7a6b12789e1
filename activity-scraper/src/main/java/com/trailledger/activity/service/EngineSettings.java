package com.trailledger.activity.service;

import java.time.Duration;

/**
 * Immutable settings handed to a {@link ScrapeEngine}.
 *
 * @param userName               login for the source site
 * @param password               password for the source site, never stored
 * @param profileRefreshInterval how old a scraped profile may get before it is read again
 */
public record EngineSettings(String userName, String password, Duration profileRefreshInterval) {

    public static final Duration DEFAULT_PROFILE_REFRESH = Duration.ofDays(7);

    public EngineSettings {
        if (userName == null || userName.isBlank()) {
            throw new IllegalArgumentException("A source user name is required");
        }
        if (profileRefreshInterval == null) {
            profileRefreshInterval = DEFAULT_PROFILE_REFRESH;
        }
    }

    @Override
    public String toString() {
        return "EngineSettings[userName=" + userName + ", profileRefreshInterval=" + profileRefreshInterval + "]";
    }
}

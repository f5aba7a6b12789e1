package com.trailledger.activity.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * A participant in club activities.
 *
 * A person is either fully profiled (their own profile page has been scraped)
 * or a stub created the first time they were seen on someone else's roster.
 * Stubs carry only the profile URL and the name shown on the roster.
 */
@Data
@Builder(toBuilder = true)
public class Person {

    // ── Identity ────────────────────────────────────────────────────────────
    /** Natural key, unique across the store */
    private String profileUrl;

    /** Login name; only set for people who have logged in through this service */
    private String userName;

    // ── Profile ─────────────────────────────────────────────────────────────
    private String fullName;
    private String portraitUrl;
    private String email;
    private String branch;

    // ── Scrape bookkeeping ──────────────────────────────────────────────────
    /** False for roster stubs */
    private boolean scraped;

    /** When the profile page was last read; null for stubs */
    private LocalDateTime lastScraped;

    public static Person stub(String profileUrl, String fullName) {
        return Person.builder()
                .profileUrl(profileUrl)
                .fullName(fullName == null ? "" : fullName)
                .portraitUrl("")
                .email("")
                .branch("")
                .scraped(false)
                .build();
    }
}

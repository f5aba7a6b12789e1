package com.trailledger.activity.model;

import lombok.Builder;
import lombok.Data;

/**
 * One person's participation in one activity.
 *
 * Addressed by the (profileUrl, activityUrl) pair; there is at most one per pair.
 * Holds keys only, never references to the Person or Activity objects.
 */
@Data
@Builder(toBuilder = true)
public class Participation {

    private String profileUrl;
    private String activityUrl;

    private String role;            // Leader, Co-Leader, Participant, ...
    private boolean canceled;
    private String registration;    // Registered | Waitlisted | Canceled
    private String memberResult;    // Successful | Canceled | ...
}
